package com.raditha.magpie.report;

import com.raditha.magpie.model.FilePairScore;
import com.raditha.magpie.model.RepoPairResult;

import java.util.List;

/**
 * Offline explanation: lists the strongest file pairs and closes with a verdict derived from
 * the repository similarity.
 */
public class TemplateExplanationGenerator implements ExplanationGenerator {

    private static final int MAX_PAIRS = 10;

    @Override
    public String explain(RepoPairResult result) {
        List<FilePairScore> flagged = result.flaggedFilePairs();
        StringBuilder sb = new StringBuilder();
        sb.append("REUSE ANALYSIS\n");
        sb.append("=".repeat(40)).append("\n");
        sb.append("Repository 1: ").append(shortName(result.repoA())).append("\n");
        sb.append("Repository 2: ").append(shortName(result.repoB())).append("\n");
        sb.append(String.format("Repository similarity: %.2f%%%n", result.repoSimilarity() * 100));
        sb.append("\n");
        sb.append("Similar file pairs (").append(flagged.size()).append("):\n");

        for (int i = 0; i < Math.min(MAX_PAIRS, flagged.size()); i++) {
            FilePairScore pair = flagged.get(i);
            sb.append(String.format("%d. %s <-> %s%n", i + 1, pair.fileA().path(), pair.fileB().path()));
            sb.append(String.format("   Similarity: %.2f%% (token %.2f%%, semantic %.2f%%)%n",
                    pair.combinedScore() * 100, pair.tokenScore() * 100, pair.semanticScore() * 100));
            sb.append("   Band: ").append(pair.band()).append("\n");
        }
        if (flagged.size() > MAX_PAIRS) {
            sb.append("... and ").append(flagged.size() - MAX_PAIRS).append(" more similar pairs\n");
        }

        sb.append("\nVERDICT: ").append(verdict(result.repoSimilarity()));
        return sb.toString();
    }

    static String verdict(double repoSimilarity) {
        if (repoSimilarity > 0.85) {
            return "LIKELY REUSE - Recommend manual review";
        }
        if (repoSimilarity > 0.75) {
            return "SUSPICIOUS - Possible reuse or shared libraries";
        }
        return "LOW RISK - Similarity within acceptable range";
    }

    /**
     * Last path segment of a repository id, so URLs and paths read as names.
     */
    static String shortName(String repoId) {
        String trimmed = repoId.endsWith("/") ? repoId.substring(0, repoId.length() - 1) : repoId;
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return name.endsWith(".git") ? name.substring(0, name.length() - 4) : name;
    }
}
