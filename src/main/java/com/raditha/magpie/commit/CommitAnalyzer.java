package com.raditha.magpie.commit;

import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.embedding.ChunkedEmbedder;
import com.raditha.magpie.embedding.EmbeddingCache;
import com.raditha.magpie.model.CombinedScore;
import com.raditha.magpie.model.CommitFlag;
import com.raditha.magpie.model.CommitRecord;
import com.raditha.magpie.model.FlagReason;
import com.raditha.magpie.normalization.CodePreprocessor;
import com.raditha.magpie.similarity.FilePairCombiner;
import com.raditha.magpie.similarity.SemanticSimilarity;
import com.raditha.magpie.similarity.TokenSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares the recent commits of different repositories.
 * <p>
 * Diffs and messages are scored independently with the same token, semantic and combining
 * machinery as files. A pair is flagged when either combined score reaches the threshold
 * ({@code score >= threshold}), the same inclusive comparison used for bands and repository
 * flags. Commits of the same repository are never compared with each other.
 */
public class CommitAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(CommitAnalyzer.class);

    private static final Comparator<CommitRecord> NEWEST_FIRST = Comparator
            .comparing(CommitRecord::timestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final CodePreprocessor preprocessor;
    private final FilePairCombiner combiner;
    private final ChunkedEmbedder embedder;
    private final double threshold;
    private final int maxCommits;
    private final int largeCommitLines;
    private final AutomatedCommitFilter automatedFilter = new AutomatedCommitFilter();
    private final TokenSimilarity tokenSimilarity = new TokenSimilarity();
    private final SemanticSimilarity semanticSimilarity = new SemanticSimilarity();

    public CommitAnalyzer(CodePreprocessor preprocessor, FilePairCombiner combiner, ChunkedEmbedder embedder,
            double threshold, int maxCommits, int largeCommitLines) {
        this.preprocessor = preprocessor;
        this.combiner = combiner;
        this.embedder = embedder;
        this.threshold = threshold;
        this.maxCommits = maxCommits;
        this.largeCommitLines = largeCommitLines;
    }

    public CommitAnalyzer(AnalysisConfig config, CodePreprocessor preprocessor, FilePairCombiner combiner,
            ChunkedEmbedder embedder) {
        this(preprocessor, combiner, embedder, config.threshold(), config.maxCommits(), config.largeCommitLines());
    }

    /**
     * Analyze the commits of every repository.
     *
     * @param commitsByRepo Commits keyed by repository id, in submission order
     */
    public CommitAnalysis analyze(Map<String, List<CommitRecord>> commitsByRepo) {
        // Step 1: bound the window and drop automated or empty commits
        Map<String, List<CommitRecord>> eligible = new LinkedHashMap<>();
        List<CommitRecord> largeCommits = new ArrayList<>();
        int total = 0;
        for (Map.Entry<String, List<CommitRecord>> entry : commitsByRepo.entrySet()) {
            List<CommitRecord> kept = select(entry.getValue());
            for (CommitRecord commit : kept) {
                if (commit.changedLineCount() > largeCommitLines) {
                    largeCommits.add(commit);
                }
            }
            eligible.put(entry.getKey(), kept);
            total += kept.size();
            logger.debug("Repository {}: {} of {} commits eligible", entry.getKey(), kept.size(),
                    entry.getValue().size());
        }
        if (eligible.size() < 2 || total == 0) {
            return new CommitAnalysis(List.of(), largeCommits, total);
        }

        // Step 2: normalize diff and message texts and embed them once
        Map<CommitRecord, CommitTexts> texts = new IdentityHashMap<>();
        List<String> allTexts = new ArrayList<>();
        for (List<CommitRecord> commits : eligible.values()) {
            for (CommitRecord commit : commits) {
                CommitTexts t = textsOf(commit);
                texts.put(commit, t);
                allTexts.add(t.diff());
                allTexts.add(t.message());
            }
        }
        EmbeddingCache cache = EmbeddingCache.build(allTexts, embedder);

        // Step 3: compare commits across different repositories
        List<CommitFlag> flags = new ArrayList<>();
        List<String> repos = new ArrayList<>(eligible.keySet());
        for (int i = 0; i < repos.size(); i++) {
            for (int j = i + 1; j < repos.size(); j++) {
                for (CommitRecord a : eligible.get(repos.get(i))) {
                    for (CommitRecord b : eligible.get(repos.get(j))) {
                        CommitFlag flag = compare(a, texts.get(a), b, texts.get(b), cache);
                        if (flag != null) {
                            flags.add(flag);
                        }
                    }
                }
            }
        }
        flags.sort(Comparator.comparingDouble(
                (CommitFlag f) -> Math.max(f.diffSimilarity(), f.messageSimilarity())).reversed());
        logger.info("Commit analysis: {} commits compared, {} flagged pairs, {} large commits",
                total, flags.size(), largeCommits.size());
        return new CommitAnalysis(flags, largeCommits, total);
    }

    private List<CommitRecord> select(List<CommitRecord> commits) {
        if (commits == null) {
            return List.of();
        }
        return commits.stream()
                .sorted(NEWEST_FIRST)
                .limit(maxCommits)
                .filter(c -> !automatedFilter.isAutomated(c))
                .filter(CommitRecord::hasChanges)
                .toList();
    }

    private CommitFlag compare(CommitRecord a, CommitTexts textsA, CommitRecord b, CommitTexts textsB,
            EmbeddingCache cache) {
        double diff = score(textsA.diff(), textsB.diff(), cache);
        double message = score(textsA.message(), textsB.message(), cache);
        boolean diffHit = diff >= threshold;
        boolean messageHit = message >= threshold;
        if (!diffHit && !messageHit) {
            return null;
        }
        return new CommitFlag(a, b, message, diff, FlagReason.of(diffHit, messageHit));
    }

    private double score(String textA, String textB, EmbeddingCache cache) {
        double token = tokenSimilarity.calculate(textA, textB);
        double semantic = semanticSimilarity.calculate(cache.vectorFor(textA), cache.vectorFor(textB));
        CombinedScore combined = combiner.combine(token, semantic);
        return combined.score();
    }

    private CommitTexts textsOf(CommitRecord commit) {
        List<String> changed = new ArrayList<>(commit.addedLines());
        changed.addAll(commit.removedLines());
        String diff = preprocessor.normalize(String.join("\n", changed));
        return new CommitTexts(diff, CodePreprocessor.normalizeMessage(commit.message()));
    }

    private record CommitTexts(String diff, String message) {
    }
}
