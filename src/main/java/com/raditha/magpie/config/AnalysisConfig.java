package com.raditha.magpie.config;

import com.raditha.magpie.normalization.Language;

/**
 * Configuration of one analysis job.
 * Defines the target language, thresholds, weights and the caps that bound the work.
 *
 * @param language          Target language; only files of this language are compared
 * @param threshold         Minimum repository similarity to flag a pair (0.0-1.0)
 * @param weights           Weights for combining token and semantic scores
 * @param bands             Cut points of the confidence bands
 * @param maxRepositories   Hard cap on repositories per job (at least 2)
 * @param maxCommits        Most recent commits inspected per repository
 * @param maxFileChars      Normalized text is truncated to this many characters before scoring
 * @param minTokens         Files with fewer normalized tokens are excluded from comparison
 * @param aggressive        Replace identifiers with positional placeholders
 * @param analyzeCommits    Run the commit analyzer alongside file comparison
 * @param largeCommitLines  Commits changing more lines than this are reported as bulk changes
 */
public record AnalysisConfig(
        Language language,
        double threshold,
        SimilarityWeights weights,
        BandThresholds bands,
        int maxRepositories,
        int maxCommits,
        int maxFileChars,
        int minTokens,
        boolean aggressive,
        boolean analyzeCommits,
        int largeCommitLines) {

    public static final double DEFAULT_THRESHOLD = 0.75;
    public static final int DEFAULT_MAX_REPOSITORIES = 10;
    public static final int DEFAULT_MAX_COMMITS = 50;
    public static final int DEFAULT_MAX_FILE_CHARS = 10_000;
    public static final int DEFAULT_MIN_TOKENS = 5;
    public static final int DEFAULT_LARGE_COMMIT_LINES = 300;

    /**
     * Validate configuration.
     */
    public AnalysisConfig {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (bands == null) {
            bands = BandThresholds.defaults();
        }
        if (maxRepositories < 2) {
            throw new IllegalArgumentException("maxRepositories must be >= 2");
        }
        if (maxCommits < 0) {
            throw new IllegalArgumentException("maxCommits must be >= 0");
        }
        if (maxFileChars < 1) {
            throw new IllegalArgumentException("maxFileChars must be >= 1");
        }
        if (minTokens < 1) {
            throw new IllegalArgumentException("minTokens must be >= 1");
        }
        if (largeCommitLines < 1) {
            throw new IllegalArgumentException("largeCommitLines must be >= 1");
        }
    }

    /**
     * Moderate preset: 75% threshold, balanced weights. Good default for most comparisons.
     */
    public static AnalysisConfig moderate(Language language) {
        return new AnalysisConfig(
                language,
                DEFAULT_THRESHOLD,
                SimilarityWeights.balanced(),
                BandThresholds.defaults(),
                DEFAULT_MAX_REPOSITORIES,
                DEFAULT_MAX_COMMITS,
                DEFAULT_MAX_FILE_CHARS,
                DEFAULT_MIN_TOKENS,
                false, // aggressive
                true, // analyzeCommits
                DEFAULT_LARGE_COMMIT_LINES);
    }

    /**
     * Strict preset: 85% threshold with identifier anonymization so renames do not hide copies.
     */
    public static AnalysisConfig strict(Language language) {
        return new AnalysisConfig(
                language,
                0.85,
                SimilarityWeights.balanced(),
                BandThresholds.defaults(),
                DEFAULT_MAX_REPOSITORIES,
                DEFAULT_MAX_COMMITS,
                DEFAULT_MAX_FILE_CHARS,
                DEFAULT_MIN_TOKENS,
                true,
                true,
                DEFAULT_LARGE_COMMIT_LINES);
    }

    /**
     * Lenient preset: 60% threshold, semantic weights. Finds more candidates, more false positives.
     */
    public static AnalysisConfig lenient(Language language) {
        return new AnalysisConfig(
                language,
                0.60,
                SimilarityWeights.semantic(),
                BandThresholds.defaults(),
                DEFAULT_MAX_REPOSITORIES,
                DEFAULT_MAX_COMMITS,
                DEFAULT_MAX_FILE_CHARS,
                DEFAULT_MIN_TOKENS,
                false,
                true,
                DEFAULT_LARGE_COMMIT_LINES);
    }

    public AnalysisConfig withThreshold(double newThreshold) {
        return new AnalysisConfig(language, newThreshold, weights, bands, maxRepositories, maxCommits,
                maxFileChars, minTokens, aggressive, analyzeCommits, largeCommitLines);
    }

    public AnalysisConfig withAggressive(boolean newAggressive) {
        return new AnalysisConfig(language, threshold, weights, bands, maxRepositories, maxCommits,
                maxFileChars, minTokens, newAggressive, analyzeCommits, largeCommitLines);
    }

    public AnalysisConfig withAnalyzeCommits(boolean newAnalyzeCommits) {
        return new AnalysisConfig(language, threshold, weights, bands, maxRepositories, maxCommits,
                maxFileChars, minTokens, aggressive, newAnalyzeCommits, largeCommitLines);
    }
}
