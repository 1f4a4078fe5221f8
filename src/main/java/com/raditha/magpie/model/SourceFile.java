package com.raditha.magpie.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A source file of one repository together with its normalized text.
 * Identity is the pair (repoId, path); the texts do not take part in equality.
 *
 * @param repoId         Repository the file belongs to
 * @param path           Path relative to the repository root
 * @param rawText        Content as read from the repository
 * @param normalizedText Content after comment/import removal and whitespace collapse
 */
public record SourceFile(
        String repoId,
        String path,
        String rawText,
        String normalizedText) {

    public SourceFile {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(path, "path");
        rawText = rawText == null ? "" : rawText;
        normalizedText = normalizedText == null ? "" : normalizedText;
    }

    /**
     * Whitespace-delimited tokens of the normalized text.
     */
    public List<String> tokens() {
        if (normalizedText.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalizedText.split(" "));
    }

    public int tokenCount() {
        return tokens().size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceFile other)) {
            return false;
        }
        return repoId.equals(other.repoId) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repoId, path);
    }

    @Override
    public String toString() {
        return repoId + ":" + path;
    }
}
