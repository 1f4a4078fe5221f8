package com.raditha.magpie.aggregation;

import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.RepoPairResult;
import com.raditha.magpie.model.SimilarityMatrix;
import com.raditha.magpie.model.SourceFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces file-pair scores to a repository-level similarity.
 * <p>
 * Every file of one repository is matched with its best counterpart in the other and the
 * median of those best-match scores is taken. This is done in both directions and the larger
 * median wins, so the result is symmetric and a small repository copied wholesale into a
 * large one still scores high.
 */
public class RepositoryAggregator {

    // Higher score first, then the smaller counterpart path
    private static final Comparator<FilePairScore> BEST_MATCH = Comparator
            .comparingDouble(FilePairScore::combinedScore).reversed()
            .thenComparing(p -> p.fileB().path());

    private final double threshold;

    public RepositoryAggregator(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
    }

    /**
     * Aggregate the file pairs of two repositories.
     *
     * @param filePairs Pairs oriented from repoA to repoB
     */
    public RepoPairResult aggregate(String repoA, String repoB, List<FilePairScore> filePairs) {
        if (filePairs == null || filePairs.isEmpty()) {
            return new RepoPairResult(repoA, repoB, 0.0, List.of(), false);
        }
        double forward = median(scores(bestMatches(filePairs)));
        double backward = median(scores(bestMatches(filePairs.stream().map(FilePairScore::reversed).toList())));
        double similarity = Math.max(forward, backward);

        List<FilePairScore> sorted = new ArrayList<>(filePairs);
        sorted.sort(FilePairScore.BY_COMBINED_DESC);
        return new RepoPairResult(repoA, repoB, similarity, sorted, similarity >= threshold);
    }

    /**
     * Best counterpart for each file on the A side of the pairs, in first-seen order of A.
     * Ties go to the lexicographically smallest path on the B side.
     */
    public List<FilePairScore> bestMatches(List<FilePairScore> filePairs) {
        Map<SourceFile, FilePairScore> best = new LinkedHashMap<>();
        for (FilePairScore pair : filePairs) {
            best.merge(pair.fileA(), pair, (current, candidate) ->
                    BEST_MATCH.compare(candidate, current) < 0 ? candidate : current);
        }
        return new ArrayList<>(best.values());
    }

    /**
     * Median of the values; the mean of the two middle values for an even count, 0.0 when empty.
     */
    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    /**
     * Symmetric N x N matrix over the repositories, diagonal 1.0.
     */
    public SimilarityMatrix buildMatrix(List<String> repositories, List<RepoPairResult> results) {
        return SimilarityMatrix.of(repositories, results);
    }

    public double threshold() {
        return threshold;
    }

    private static List<Double> scores(List<FilePairScore> pairs) {
        return pairs.stream().map(FilePairScore::combinedScore).toList();
    }
}
