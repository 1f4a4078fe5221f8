package com.raditha.magpie.cli;

import com.raditha.magpie.git.GitTestRepository;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MagpieCLITest {

    private static final String CART = """
            class Cart:
                def __init__(self):
                    self.items = []

                def add(self, item, quantity=1):
                    self.items.append((item, quantity))

                def total(self, prices):
                    return sum(prices[item] * qty for item, qty in self.items)
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = MagpieCLI.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path repository(String name, String path, String content) throws Exception {
        Path dir = tempDir.resolve(name);
        try (GitTestRepository repo = GitTestRepository.init(dir)) {
            repo.write(path, content);
            repo.commit("Add " + path);
        }
        return dir;
    }

    @Test
    void testAnalyzesTwoRepositories() throws Exception {
        Path a = repository("alice-shop", "src/cart.py", CART);
        Path b = repository("bob-store", "lib/basket.py", CART);

        int exitCode = cmd.execute(a.toString(), b.toString(), "--explain", "template");

        assertEquals(0, exitCode, err.toString());
        String report = out.toString();
        assertTrue(report.contains("REPOSITORY SIMILARITY REPORT"));
        assertTrue(report.contains("Suspicious pairs (most similar first):"));
        assertTrue(report.contains("src/cart.py <-> lib/basket.py"));
        assertTrue(report.contains("VERDICT: LIKELY REUSE"));
    }

    @Test
    void testConfigFileApplied() throws Exception {
        Path a = repository("one", "main.go", "package main\n\nfunc main() {\n\tprintln(\"hello world\")\n}\n");
        Path b = repository("two", "main.go", "package main\n\nfunc main() {\n\tprintln(\"hello world\")\n}\n");
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, "analysis:\n  language: go\n  explanation: none\n  analyze_commits: false\n");

        int exitCode = cmd.execute("--config-file", config.toString(), a.toString(), b.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("Language: go"));
        assertFalse(out.toString().contains("VERDICT"));
    }

    @Test
    void testThresholdOutOfRange() {
        int exitCode = cmd.execute("--threshold", "150", "a", "b");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Threshold must be between 0 and 100"));
    }

    @Test
    void testSingleRepositoryRejected() {
        int exitCode = cmd.execute("only-one");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("At least 2 repositories are required"));
    }

    @Test
    void testConflictingPresets() {
        assertEquals(2, cmd.execute("--strict", "--lenient", "a", "b"));
    }

    @Test
    void testUnknownLanguage() {
        assertEquals(2, cmd.execute("--language", "cobol", "a", "b"));
    }

    @Test
    void testUnknownOption() {
        assertEquals(2, cmd.execute("--no-such-option", "a", "b"));
    }

    @Test
    void testUnreadableRepositoryFailsAnalysis() throws Exception {
        Path a = repository("present", "app.py", CART);
        String missing = tempDir.resolve("missing").toString();

        int exitCode = cmd.execute(a.toString(), missing, "--no-commits");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Analysis failed: CLONING: "));
        assertTrue(err.toString().contains(missing));
    }

    @Test
    void testHelp() {
        assertEquals(0, cmd.execute("--help"));
        assertTrue(out.toString().contains("--threshold"));
    }

    @Property(tries = 100)
    void validOptionsParse(
            @ForAll @IntRange(min = 1, max = 100) int threshold,
            @ForAll @IntRange(min = 0, max = 500) int maxCommits,
            @ForAll boolean aggressive,
            @ForAll boolean noCommits,
            @ForAll("languages") String language,
            @ForAll("explainModes") String explain) {
        List<String> args = new ArrayList<>(List.of(
                "--threshold", String.valueOf(threshold),
                "--max-commits", String.valueOf(maxCommits),
                "--language", language,
                "--explain", explain));
        if (aggressive) {
            args.add("--aggressive");
        }
        if (noCommits) {
            args.add("--no-commits");
        }
        args.add("repo-a");
        args.add("repo-b");

        CommandLine commandLine = new CommandLine(new MagpieCLI());
        CommandLine.ParseResult result = commandLine.parseArgs(args.toArray(new String[0]));

        assertEquals(List.of("repo-a", "repo-b"), result.matchedPositional(0).getValue());
        assertEquals(threshold, (int) result.matchedOptionValue("--threshold", 0));
    }

    @Provide
    Arbitrary<String> languages() {
        return Arbitraries.of("python", "java", "js", "typescript", "go", "rust", "c", "cpp", "csharp");
    }

    @Provide
    Arbitrary<String> explainModes() {
        return Arbitraries.of("none", "template", "gemini");
    }
}
