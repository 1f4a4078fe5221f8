package com.raditha.magpie.model;

import java.util.List;

/**
 * Symmetric repository-by-repository similarity matrix.
 * The diagonal is fixed at 1.0; self-similarity is never computed.
 */
public final class SimilarityMatrix {

    private final List<String> repositories;
    private final double[][] values;

    public SimilarityMatrix(List<String> repositories) {
        this.repositories = List.copyOf(repositories);
        int n = this.repositories.size();
        this.values = new double[n][n];
        for (int i = 0; i < n; i++) {
            values[i][i] = 1.0;
        }
    }

    /**
     * Record the similarity of two distinct repositories in both cells.
     * Only called while the matrix is being built.
     */
    void set(int i, int j, double similarity) {
        if (i == j) {
            throw new IllegalArgumentException("Diagonal is fixed at 1.0");
        }
        values[i][j] = similarity;
        values[j][i] = similarity;
    }

    /**
     * Build a matrix from pairwise results. Pairs naming unknown repositories are rejected.
     */
    public static SimilarityMatrix of(List<String> repositories, List<RepoPairResult> results) {
        SimilarityMatrix matrix = new SimilarityMatrix(repositories);
        for (RepoPairResult result : results) {
            int i = matrix.indexOf(result.repoA());
            int j = matrix.indexOf(result.repoB());
            matrix.set(i, j, result.repoSimilarity());
        }
        return matrix;
    }

    public List<String> repositories() {
        return repositories;
    }

    public int size() {
        return repositories.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String repoA, String repoB) {
        return values[indexOf(repoA)][indexOf(repoB)];
    }

    /**
     * Defensive copy of the matrix rows.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    private int indexOf(String repo) {
        int index = repositories.indexOf(repo);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown repository: " + repo);
        }
        return index;
    }
}
