package com.raditha.magpie.normalization;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces identifiers with positional placeholders ({@code ID_0}, {@code ID_1}, ...)
 * in first-seen order, leaving the language's keywords untouched.
 * <p>
 * Two snippets that differ only in naming produce the same output, which lets the
 * token scorer see through systematic renames.
 */
public class IdentifierAnonymizer {

    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_]*\\b");

    private final Language language;

    public IdentifierAnonymizer(Language language) {
        this.language = language;
    }

    public String anonymize(String text) {
        Map<String, String> placeholders = new HashMap<>();
        Matcher matcher = IDENTIFIER.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            String word = matcher.group();
            String replacement = language.isKeyword(word)
                    ? word
                    : placeholders.computeIfAbsent(word, w -> "ID_" + placeholders.size());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
