package com.raditha.magpie.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.magpie.git.RepositoryLimits;
import com.raditha.magpie.normalization.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads analysis configuration from a YAML file (magpie.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > magpie.yml > defaults
 */
public class AnalysisSettings {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    public static final String DEFAULT_FILE_NAME = "magpie.yml";

    private static final String ANALYSIS_KEY = "analysis";
    private static final String REPOSITORY_KEY = "repository";
    private static final String AI_SERVICE_KEY = "ai_service";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> root;

    AnalysisSettings(Map<String, Object> root) {
        this.root = root == null ? Map.of() : root;
    }

    /**
     * Settings with no file: every value falls back to its default.
     */
    public static AnalysisSettings empty() {
        return new AnalysisSettings(Map.of());
    }

    /**
     * Load settings from the given file, or from magpie.yml in the working directory
     * when no file is given. A missing default file is not an error.
     *
     * @throws IOException if an explicitly given file cannot be read or parsed
     */
    public static AnalysisSettings load(Path configFile) throws IOException {
        if (configFile == null) {
            Path fallback = Path.of(DEFAULT_FILE_NAME);
            if (!Files.isRegularFile(fallback)) {
                return empty();
            }
            configFile = fallback;
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Map<String, Object> parsed = YAML.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {
        });
        logger.debug("Loaded configuration from {}", configFile);
        return new AnalysisSettings(parsed);
    }

    /**
     * Build the analysis configuration, applying CLI overrides where provided.
     */
    public AnalysisConfig loadConfig(CliOverrides cli) {
        Map<String, Object> config = section(ANALYSIS_KEY);

        // Determine language (CLI > YAML > python)
        String languageTag = cli.language() != null ? cli.language() : getString(config, "language", "python");
        Language language = Language.fromTag(languageTag);

        // Preset replaces the base values (CLI > YAML)
        String preset = cli.preset() != null ? cli.preset() : getString(config, "preset", null);
        AnalysisConfig base = preset != null ? fromPreset(preset, language) : null;

        double threshold;
        if (cli.thresholdPercent() != 0) {
            if (cli.thresholdPercent() < 0 || cli.thresholdPercent() > 100) {
                throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + cli.thresholdPercent());
            }
            threshold = cli.thresholdPercent() / 100.0;
        } else if (base != null) {
            threshold = base.threshold();
        } else {
            threshold = getDouble(config, "threshold", AnalysisConfig.DEFAULT_THRESHOLD);
        }

        SimilarityWeights weights = base != null && !config.containsKey("weights") ? base.weights() : buildWeights(config);
        BandThresholds bands = buildBands(config);

        int maxRepositories = getInt(config, "max_repositories", AnalysisConfig.DEFAULT_MAX_REPOSITORIES);
        int maxCommits = cli.maxCommits() != 0 ? cli.maxCommits()
                : getInt(config, "max_commits", AnalysisConfig.DEFAULT_MAX_COMMITS);
        int maxFileChars = cli.maxFileChars() != 0 ? cli.maxFileChars()
                : getInt(config, "max_file_chars", AnalysisConfig.DEFAULT_MAX_FILE_CHARS);
        int minTokens = getInt(config, "min_tokens", AnalysisConfig.DEFAULT_MIN_TOKENS);
        boolean aggressive = cli.aggressive()
                || getBoolean(config, "aggressive", base != null && base.aggressive());
        boolean analyzeCommits = !cli.noCommits() && getBoolean(config, "analyze_commits", true);
        int largeCommitLines = getInt(config, "large_commit_lines", AnalysisConfig.DEFAULT_LARGE_COMMIT_LINES);

        return new AnalysisConfig(
                language,
                threshold,
                weights,
                bands,
                maxRepositories,
                maxCommits,
                maxFileChars,
                minTokens,
                aggressive,
                analyzeCommits,
                largeCommitLines);
    }

    /**
     * Limits applied while reading repositories.
     */
    public RepositoryLimits repositoryLimits() {
        Map<String, Object> config = section(REPOSITORY_KEY);
        RepositoryLimits defaults = RepositoryLimits.defaults();
        List<String> skipDirs = getListString(config, "skip_dirs");
        return new RepositoryLimits(
                getInt(config, "max_files", defaults.maxFiles()),
                getInt(config, "max_file_bytes", defaults.maxFileBytes()),
                skipDirs.isEmpty() ? defaults.skipDirectories() : skipDirs);
    }

    /**
     * Embedding provider name (hashing or gemini).
     */
    public String embeddingProvider() {
        return getString(embeddingSection(), "provider", "hashing");
    }

    public int embeddingDimension() {
        return getInt(embeddingSection(), "dimension", 384);
    }

    public int embeddingInputBudget() {
        return getInt(embeddingSection(), "input_budget", 2000);
    }

    /**
     * Explanation mode (none, template or gemini).
     */
    public String explanationMode() {
        return getString(section(ANALYSIS_KEY), "explanation", "template");
    }

    /**
     * Raw ai_service section handed to the Gemini client.
     */
    public Map<String, Object> aiServiceConfig() {
        return section(AI_SERVICE_KEY);
    }

    private Map<String, Object> embeddingSection() {
        Object value = section(ANALYSIS_KEY).get("embedding");
        return asMap(value);
    }

    private Map<String, Object> section(String key) {
        return asMap(root.get(key));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static AnalysisConfig fromPreset(String preset, Language language) {
        return switch (preset) {
            case "strict" -> AnalysisConfig.strict(language);
            case "lenient" -> AnalysisConfig.lenient(language);
            default -> AnalysisConfig.moderate(language);
        };
    }

    private static SimilarityWeights buildWeights(Map<String, Object> config) {
        Object weightsObj = config.get("weights");
        if (weightsObj instanceof Map) {
            Map<String, Object> weightsMap = asMap(weightsObj);
            double token = getDouble(weightsMap, "token", 0.5);
            double semantic = getDouble(weightsMap, "semantic", 0.5);
            return new SimilarityWeights(token, semantic);
        }
        return SimilarityWeights.balanced();
    }

    private static BandThresholds buildBands(Map<String, Object> config) {
        Object bandsObj = config.get("bands");
        if (bandsObj instanceof Map) {
            Map<String, Object> bandsMap = asMap(bandsObj);
            BandThresholds defaults = BandThresholds.defaults();
            return new BandThresholds(
                    getDouble(bandsMap, "critical", defaults.critical()),
                    getDouble(bandsMap, "high", defaults.high()),
                    getDouble(bandsMap, "medium", defaults.medium()),
                    getDouble(bandsMap, "low", defaults.low()));
        }
        return BandThresholds.defaults();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
