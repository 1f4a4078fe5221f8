package com.raditha.magpie.model;

import java.util.Comparator;

/**
 * Similarity between one file of repository A and one file of repository B.
 *
 * @param fileA         File from the first repository
 * @param fileB         File from the second repository
 * @param tokenScore    Jaccard similarity of the normalized token sets (0.0-1.0)
 * @param semanticScore Cosine similarity of the mean-pooled embeddings (0.0-1.0)
 * @param combinedScore Weighted combination of both scores (0.0-1.0)
 * @param band          Confidence band derived from the combined score
 */
public record FilePairScore(
        SourceFile fileA,
        SourceFile fileB,
        double tokenScore,
        double semanticScore,
        double combinedScore,
        Band band) {

    /**
     * Highest combined score first; ties keep a stable path order so reports are reproducible.
     */
    public static final Comparator<FilePairScore> BY_COMBINED_DESC = Comparator
            .comparingDouble(FilePairScore::combinedScore).reversed()
            .thenComparing(p -> p.fileA().path())
            .thenComparing(p -> p.fileB().path());

    /**
     * The same pair seen from repository B.
     */
    public FilePairScore reversed() {
        return new FilePairScore(fileB, fileA, tokenScore, semanticScore, combinedScore, band);
    }
}
