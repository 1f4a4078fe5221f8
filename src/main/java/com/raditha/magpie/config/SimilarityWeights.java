package com.raditha.magpie.config;

/**
 * Weights for combining the lexical and semantic file-pair scores.
 *
 * @param tokenWeight    Weight for the token (Jaccard) score (0.0-1.0)
 * @param semanticWeight Weight for the semantic (embedding) score (0.0-1.0)
 */
public record SimilarityWeights(
        double tokenWeight,
        double semanticWeight) {
    /**
     * Validate weights are non-negative and sum to 1.0.
     */
    public SimilarityWeights {
        if (tokenWeight < 0.0 || semanticWeight < 0.0) {
            throw new IllegalArgumentException(
                    String.format("Weights must be non-negative, got token=%.3f semantic=%.3f",
                            tokenWeight, semanticWeight));
        }
        double sum = tokenWeight + semanticWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Balanced weights (default): lexical and semantic evidence count equally.
     */
    public static SimilarityWeights balanced() {
        return new SimilarityWeights(0.5, 0.5);
    }

    /**
     * Lexical weights: favours literal token overlap.
     */
    public static SimilarityWeights lexical() {
        return new SimilarityWeights(0.7, 0.3);
    }

    /**
     * Semantic weights: favours embedding similarity, more tolerant to rewording.
     */
    public static SimilarityWeights semantic() {
        return new SimilarityWeights(0.3, 0.7);
    }

    /**
     * Calculate combined score from the individual metrics.
     */
    public double combine(double tokenScore, double semanticScore) {
        return (tokenScore * tokenWeight) + (semanticScore * semanticWeight);
    }
}
