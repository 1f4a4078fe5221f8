package com.raditha.magpie.report;

import com.raditha.magpie.commit.CommitAnalysis;
import com.raditha.magpie.model.RepoPairResult;
import com.raditha.magpie.model.Report;
import com.raditha.magpie.model.ReportSummary;
import com.raditha.magpie.model.SimilarityMatrix;
import com.raditha.magpie.normalization.Language;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles the final {@link Report} from the pair results and the commit analysis.
 */
public class ReportBuilder {

    private final Clock clock;

    public ReportBuilder(Clock clock) {
        this.clock = clock;
    }

    public ReportBuilder() {
        this(Clock.systemUTC());
    }

    /**
     * @param repositories Repositories in submission order
     * @param comparisons  Every repository pair, in submission order
     * @param commits      Commit analysis, or {@link CommitAnalysis#empty()} when disabled
     */
    public Report build(List<String> repositories, List<RepoPairResult> comparisons, CommitAnalysis commits,
            Language language, double threshold) {
        SimilarityMatrix matrix = SimilarityMatrix.of(repositories, comparisons);

        List<RepoPairResult> suspicious = comparisons.stream()
                .filter(RepoPairResult::flagged)
                .sorted(Comparator.comparingDouble(RepoPairResult::repoSimilarity).reversed())
                .toList();

        int filePairs = comparisons.stream()
                .mapToInt(r -> r.filePairs().size())
                .sum();

        ReportSummary summary = new ReportSummary(repositories.size(), suspicious.size(), filePairs);
        Instant now = Instant.now(clock);
        return new Report(
                summary,
                matrix,
                suspicious,
                commits.flags(),
                comparisons,
                commits.largeCommits(),
                language.tag(),
                threshold,
                now);
    }
}
