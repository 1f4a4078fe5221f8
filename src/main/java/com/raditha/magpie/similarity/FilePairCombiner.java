package com.raditha.magpie.similarity;

import com.raditha.magpie.config.BandThresholds;
import com.raditha.magpie.config.SimilarityWeights;
import com.raditha.magpie.model.CombinedScore;

/**
 * Combines the token and semantic scores of a pair with configurable weights and assigns
 * the confidence band.
 */
public class FilePairCombiner {

    private final SimilarityWeights weights;
    private final BandThresholds bands;

    public FilePairCombiner(SimilarityWeights weights, BandThresholds bands) {
        if (weights == null || bands == null) {
            throw new IllegalArgumentException("weights and bands are required");
        }
        this.weights = weights;
        this.bands = bands;
    }

    public FilePairCombiner() {
        this(SimilarityWeights.balanced(), BandThresholds.defaults());
    }

    public CombinedScore combine(double tokenScore, double semanticScore) {
        double score = clamp(weights.combine(tokenScore, semanticScore));
        return new CombinedScore(score, bands.classify(score));
    }

    public SimilarityWeights weights() {
        return weights;
    }

    public BandThresholds bands() {
        return bands;
    }

    // Floating point error can push a weighted sum of 1.0 scores just past 1.0
    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
