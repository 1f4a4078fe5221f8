package com.raditha.magpie.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard index of the unique whitespace-delimited tokens of two normalized texts.
 */
public class TokenSimilarity {

    /**
     * Calculate token similarity between two normalized texts.
     *
     * @param textA First normalized text
     * @param textB Second normalized text
     * @return Similarity score (0.0 to 1.0); 0.0 when either side has no tokens
     */
    public double calculate(String textA, String textB) {
        return calculate(tokenSet(textA), tokenSet(textB));
    }

    /**
     * Jaccard index of two precomputed token sets.
     */
    public double calculate(Set<String> tokensA, Set<String> tokensB) {
        if (tokensA == null || tokensB == null || tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        // Iterate the smaller set
        Set<String> smaller = tokensA.size() <= tokensB.size() ? tokensA : tokensB;
        Set<String> larger = smaller == tokensA ? tokensB : tokensA;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = tokensA.size() + tokensB.size() - intersection;
        return (double) intersection / union;
    }

    /**
     * Unique tokens of a normalized text.
     */
    public static Set<String> tokenSet(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
