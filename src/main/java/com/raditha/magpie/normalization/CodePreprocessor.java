package com.raditha.magpie.normalization;

import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.model.SourceFile;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw source text into normalized text: comments and imports removed, whitespace
 * collapsed and, in aggressive mode, identifiers anonymized.
 * <p>
 * Built once per job for a single {@link Language}. Normalization is pure and deterministic.
 */
public class CodePreprocessor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Language language;
    private final boolean aggressive;
    private final int maxFileChars;
    private final int minTokens;
    private final IdentifierAnonymizer anonymizer;

    public CodePreprocessor(Language language, boolean aggressive, int maxFileChars, int minTokens) {
        if (language == null) {
            throw new IllegalArgumentException("language cannot be null");
        }
        this.language = language;
        this.aggressive = aggressive;
        this.maxFileChars = maxFileChars;
        this.minTokens = minTokens;
        this.anonymizer = new IdentifierAnonymizer(language);
    }

    public CodePreprocessor(AnalysisConfig config) {
        this(config.language(), config.aggressive(), config.maxFileChars(), config.minTokens());
    }

    /**
     * Preprocessor with the default truncation budget and token floor.
     */
    public CodePreprocessor(Language language, boolean aggressive) {
        this(language, aggressive, AnalysisConfig.DEFAULT_MAX_FILE_CHARS, AnalysisConfig.DEFAULT_MIN_TOKENS);
    }

    public Language language() {
        return language;
    }

    /**
     * Normalize raw source text.
     */
    public String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }
        // Step 1: drop comments, keep string literals
        String text = stripComments(rawText);

        // Step 2: drop import / include / use statements
        for (Pattern importPattern : language.importPatterns()) {
            text = importPattern.matcher(text).replaceAll("");
        }

        // Step 3: collapse whitespace
        text = collapseWhitespace(text);

        // Step 4: anonymize identifiers
        if (aggressive) {
            text = anonymizer.anonymize(text);
        }
        return text;
    }

    /**
     * Normalize a file and wrap it as a {@link SourceFile}, truncating the normalized text
     * to the configured character budget.
     */
    public SourceFile prepare(String repoId, String path, String rawText) {
        String normalized = normalize(rawText);
        if (normalized.length() > maxFileChars) {
            normalized = normalized.substring(0, maxFileChars);
        }
        return new SourceFile(repoId, path, rawText, normalized);
    }

    /**
     * Files with too few normalized tokens carry no useful signal and are left out of comparison.
     */
    public boolean isComparable(SourceFile file) {
        return file.tokenCount() >= minTokens;
    }

    /**
     * Normalize text that is not source code (commit messages, diff bodies without syntax).
     */
    public static String normalizeMessage(String message) {
        if (message == null) {
            return "";
        }
        return collapseWhitespace(message).toLowerCase(Locale.ROOT);
    }

    private String stripComments(String text) {
        Matcher matcher = language.commentOrString().matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = matcher.group("comment") != null ? " " : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
