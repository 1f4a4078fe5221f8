package com.raditha.magpie.model;

import java.util.List;

/**
 * Aggregated comparison of two repositories.
 *
 * @param repoA          First repository (submission order)
 * @param repoB          Second repository (submission order)
 * @param repoSimilarity Median-of-best-match similarity (0.0-1.0)
 * @param filePairs      Every compared file pair, highest combined score first
 * @param flagged        True when repoSimilarity reached the job threshold
 * @param explanation    Free-text explanation, empty when none was generated
 */
public record RepoPairResult(
        String repoA,
        String repoB,
        double repoSimilarity,
        List<FilePairScore> filePairs,
        boolean flagged,
        String explanation) {

    public RepoPairResult {
        filePairs = filePairs == null ? List.of() : List.copyOf(filePairs);
        explanation = explanation == null ? "" : explanation;
    }

    public RepoPairResult(String repoA, String repoB, double repoSimilarity,
            List<FilePairScore> filePairs, boolean flagged) {
        this(repoA, repoB, repoSimilarity, filePairs, flagged, "");
    }

    public RepoPairResult withExplanation(String text) {
        return new RepoPairResult(repoA, repoB, repoSimilarity, filePairs, flagged, text);
    }

    /**
     * File pairs whose band is at least LOW.
     */
    public List<FilePairScore> flaggedFilePairs() {
        return filePairs.stream()
                .filter(p -> p.band().isFlagged())
                .toList();
    }

    public boolean involves(String repoId) {
        return repoA.equals(repoId) || repoB.equals(repoId);
    }
}
