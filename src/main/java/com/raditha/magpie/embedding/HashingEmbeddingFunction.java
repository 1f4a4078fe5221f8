package com.raditha.magpie.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline embedding based on signed feature hashing.
 * <p>
 * Word and punctuation tokens and adjacent token bigrams are hashed into a fixed number of
 * buckets; a second hash decides the sign so that collisions tend to cancel out. The vector
 * is L2 normalized. Deterministic, so identical texts always embed identically.
 */
public class HashingEmbeddingFunction implements EmbeddingFunction {

    public static final int DEFAULT_DIMENSION = 384;
    public static final int DEFAULT_INPUT_BUDGET = 2000;

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*|\\d+|[^\\sA-Za-z0-9_]");
    private static final long BUCKET_SEED = 0x9e3779b97f4a7c15L;
    private static final long SIGN_SEED = 0xc2b2ae3d27d4eb4fL;
    private static final double BIGRAM_WEIGHT = 0.5;

    private final int dimension;
    private final int inputBudget;

    public HashingEmbeddingFunction() {
        this(DEFAULT_DIMENSION, DEFAULT_INPUT_BUDGET);
    }

    public HashingEmbeddingFunction(int dimension, int inputBudget) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1");
        }
        if (inputBudget < 1) {
            throw new IllegalArgumentException("inputBudget must be >= 1");
        }
        this.dimension = dimension;
        this.inputBudget = inputBudget;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        List<String> tokens = tokenize(text);
        String previous = null;
        for (String token : tokens) {
            add(vector, token.hashCode(), 1.0);
            if (previous != null) {
                add(vector, (previous + " " + token).hashCode(), BIGRAM_WEIGHT);
            }
            previous = token;
        }
        return normalize(vector);
    }

    @Override
    public int inputBudget() {
        return inputBudget;
    }

    public int dimension() {
        return dimension;
    }

    private void add(double[] vector, int featureHash, double weight) {
        int bucket = (int) Math.floorMod(mix(featureHash, BUCKET_SEED), (long) dimension);
        double sign = (mix(featureHash, SIGN_SEED) & 1L) == 0 ? 1.0 : -1.0;
        vector[bucket] += sign * weight;
    }

    private static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static double[] normalize(double[] vector) {
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return vector;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }

    // 64-bit finalizer mix
    private static long mix(int value, long seed) {
        long h = value ^ seed;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
