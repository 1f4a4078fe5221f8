package com.raditha.magpie.similarity;

import com.raditha.magpie.embedding.ChunkedEmbedder;
import com.raditha.magpie.embedding.EmbeddingException;
import com.raditha.magpie.embedding.EmbeddingFunction;

import java.util.List;

/**
 * Cosine similarity of embedding vectors, clamped to [0, 1].
 */
public class SemanticSimilarity {

    /**
     * Calculate cosine similarity between two vectors.
     *
     * @return Similarity score (0.0 to 1.0); 0.0 when either vector is all zeros
     * @throws EmbeddingException if the vectors differ in dimension
     */
    public double calculate(double[] vectorA, double[] vectorB) {
        if (vectorA == null || vectorB == null) {
            return 0.0;
        }
        if (vectorA.length != vectorB.length) {
            throw new EmbeddingException(String.format(
                    "Cannot compare vectors of dimension %d and %d", vectorA.length, vectorB.length));
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < vectorA.length; i++) {
            dot += vectorA[i] * vectorB[i];
            normA += vectorA[i] * vectorA[i];
            normB += vectorB[i] * vectorB[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / Math.sqrt(normA * normB);
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    /**
     * Uncached form: embeds both texts with the given function, then compares.
     * Texts longer than the function's input budget are chunked and mean-pooled.
     */
    public double calculate(String textA, String textB, EmbeddingFunction embeddingFunction) {
        List<double[]> vectors = new ChunkedEmbedder(embeddingFunction).embedAll(List.of(textA, textB));
        return calculate(vectors.get(0), vectors.get(1));
    }
}
