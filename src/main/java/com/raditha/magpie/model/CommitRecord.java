package com.raditha.magpie.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one commit: its message and the lines it added and removed.
 * Unchanged context lines are never part of the record.
 */
public record CommitRecord(
        String repoId,
        String commitHash,
        String message,
        List<String> addedLines,
        List<String> removedLines,
        Instant timestamp) {

    public CommitRecord {
        message = message == null ? "" : message;
        addedLines = addedLines == null ? List.of() : List.copyOf(addedLines);
        removedLines = removedLines == null ? List.of() : List.copyOf(removedLines);
    }

    public boolean hasChanges() {
        return !addedLines.isEmpty() || !removedLines.isEmpty();
    }

    public int changedLineCount() {
        return addedLines.size() + removedLines.size();
    }

    public String shortHash() {
        return commitHash.length() > 8 ? commitHash.substring(0, 8) : commitHash;
    }
}
