package com.raditha.magpie.cli;

import ch.qos.logback.classic.Level;
import com.raditha.magpie.ai.GeminiAIService;
import com.raditha.magpie.ai.GeminiEmbeddingFunction;
import com.raditha.magpie.ai.GeminiExplanationGenerator;
import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.config.AnalysisSettings;
import com.raditha.magpie.config.CliOverrides;
import com.raditha.magpie.embedding.EmbeddingFunction;
import com.raditha.magpie.embedding.HashingEmbeddingFunction;
import com.raditha.magpie.git.GitRepositoryMaterializer;
import com.raditha.magpie.job.AnalysisPipeline;
import com.raditha.magpie.job.JobRegistry;
import com.raditha.magpie.job.JobSnapshot;
import com.raditha.magpie.job.JobStatus;
import com.raditha.magpie.report.ExplanationGenerator;
import com.raditha.magpie.report.ReportFormatter;
import com.raditha.magpie.report.TemplateExplanationGenerator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Magpie.
 * <p>
 * Usage:
 * java -jar magpie.jar [options] <repository> <repository>...
 * <p>
 * Configuration priority: CLI arguments > magpie.yml > defaults
 */
@Command(name = "magpie", mixinStandardHelpOptions = true, version = "Magpie v1.0.0",
        description = "Estimates how much code repositories reuse from each other")
public class MagpieCLI implements Callable<Integer> {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(2);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<repository>", description = "Local git directories or clone URLs")
    private List<String> repositories;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--language", description = "Language to compare (default: python)", paramLabel = "<lang>")
    private String language;

    @Option(names = "--branch", description = "Branch to analyze (default: repository HEAD)", paramLabel = "<name>")
    private String branch;

    @Option(names = "--threshold", description = "Similarity threshold 0-100 (default: 75)", paramLabel = "<n>")
    private int threshold = 0; // 0 = use YAML/default

    @Option(names = "--strict", description = "Strict preset (85%% threshold, identifier anonymization)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (60%% threshold, semantic weights)")
    private boolean lenient = false;

    @Option(names = "--aggressive", description = "Anonymize identifiers before comparing")
    private boolean aggressive = false;

    @Option(names = "--max-commits", description = "Recent commits per repository (default: 50)", paramLabel = "<n>")
    private int maxCommits = 0;

    @Option(names = "--max-file-chars", description = "Normalized characters kept per file (default: 10000)", paramLabel = "<n>")
    private int maxFileChars = 0;

    @Option(names = "--no-commits", description = "Skip commit analysis")
    private boolean noCommits = false;

    @Option(names = "--embedding", description = "Embedding provider: hashing or gemini", paramLabel = "<provider>")
    private String embedding;

    @Option(names = "--explain", description = "Explanations for flagged pairs: none, template or gemini", paramLabel = "<mode>")
    private String explain;

    @Option(names = "--verbose", description = "Debug logging")
    private boolean verbose = false;

    @Override
    public Integer call() throws Exception {
        validateConfiguration();
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.raditha.magpie")).setLevel(Level.DEBUG);
        }

        AnalysisSettings settings = AnalysisSettings.load(configFile == null ? null : Path.of(configFile));
        String preset = strict ? "strict" : lenient ? "lenient" : null;
        AnalysisConfig config = settings.loadConfig(
                new CliOverrides(language, threshold, preset, maxCommits, maxFileChars, aggressive, noCommits));

        AnalysisPipeline pipeline = new AnalysisPipeline(
                new GitRepositoryMaterializer(settings.repositoryLimits()),
                createEmbeddingFunction(settings),
                createExplanationGenerator(settings));

        try (JobRegistry registry = new JobRegistry(pipeline)) {
            JobSnapshot snapshot = registry.submit(repositories, branch, config);
            snapshot = waitFor(registry, snapshot);
            return printOutcome(snapshot);
        }
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping installed.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new MagpieCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != 0 && (threshold < 0 || threshold > 100)) {
            throw new IllegalArgumentException("Threshold must be between 0 and 100, got: " + threshold);
        }
        if (maxCommits < 0) {
            throw new IllegalArgumentException("Max-commits must not be negative, got: " + maxCommits);
        }
        if (maxFileChars < 0) {
            throw new IllegalArgumentException("Max-file-chars must not be negative, got: " + maxFileChars);
        }
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }
        if (embedding != null && !List.of("hashing", "gemini").contains(embedding.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Embedding provider must be 'hashing' or 'gemini', got: " + embedding);
        }
        if (explain != null && !List.of("none", "template", "gemini").contains(explain.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Explain mode must be 'none', 'template' or 'gemini', got: " + explain);
        }
    }

    private EmbeddingFunction createEmbeddingFunction(AnalysisSettings settings) throws IOException {
        String provider = embedding != null ? embedding : settings.embeddingProvider();
        if ("gemini".equalsIgnoreCase(provider)) {
            return new GeminiEmbeddingFunction(new GeminiAIService(settings.aiServiceConfig()));
        }
        return new HashingEmbeddingFunction(settings.embeddingDimension(), settings.embeddingInputBudget());
    }

    private ExplanationGenerator createExplanationGenerator(AnalysisSettings settings) throws IOException {
        String mode = (explain != null ? explain : settings.explanationMode()).toLowerCase(Locale.ROOT);
        return switch (mode) {
            case "none" -> ExplanationGenerator.NONE;
            case "gemini" -> new GeminiExplanationGenerator(new GeminiAIService(settings.aiServiceConfig()));
            default -> new TemplateExplanationGenerator();
        };
    }

    private JobSnapshot waitFor(JobRegistry registry, JobSnapshot submitted) throws InterruptedException {
        PrintWriter err = spec.commandLine().getErr();
        JobSnapshot snapshot = submitted;
        JobStatus lastStatus = null;
        while (!snapshot.isTerminal()) {
            snapshot = registry.await(snapshot.id(), POLL_INTERVAL);
            if (snapshot.status() != lastStatus && !snapshot.isTerminal()) {
                err.printf("[%3d%%] %s%n", snapshot.progress(), snapshot.status());
                err.flush();
                lastStatus = snapshot.status();
            }
        }
        return snapshot;
    }

    private int printOutcome(JobSnapshot snapshot) {
        if (snapshot.status() == JobStatus.FAILED) {
            spec.commandLine().getErr().println("Analysis failed: " + snapshot.error());
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        snapshot.report().ifPresent(report -> out.print(new ReportFormatter().getDetailedReport(report)));
        out.flush();
        return 0;
    }
}
