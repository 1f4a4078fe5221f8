package com.raditha.magpie.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityWeightsTest {

    @Test
    void testPresetsSumToOne() {
        for (SimilarityWeights weights : new SimilarityWeights[] {
                SimilarityWeights.balanced(), SimilarityWeights.lexical(), SimilarityWeights.semantic() }) {
            assertEquals(1.0, weights.tokenWeight() + weights.semanticWeight(), 0.0001);
        }
    }

    @Test
    void testCombine() {
        SimilarityWeights weights = new SimilarityWeights(0.7, 0.3);
        assertEquals(0.7 * 0.5 + 0.3 * 1.0, weights.combine(0.5, 1.0), 0.0001);
    }

    @Test
    void testWeightsMustSumToOne() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new SimilarityWeights(0.6, 0.6));
        assertTrue(ex.getMessage().contains("sum to 1.0"));
    }

    @Test
    void testNegativeWeightsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.5, 1.5));
    }
}
