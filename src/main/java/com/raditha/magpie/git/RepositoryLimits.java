package com.raditha.magpie.git;

import java.util.List;

/**
 * Bounds applied while reading a repository.
 *
 * @param maxFiles        Source files read per repository
 * @param maxFileBytes    Larger blobs are skipped
 * @param skipDirectories Directory names that are never entered (vendored or generated code)
 */
public record RepositoryLimits(int maxFiles, int maxFileBytes, List<String> skipDirectories) {

    public static final int DEFAULT_MAX_FILES = 100;
    public static final int DEFAULT_MAX_FILE_BYTES = 200 * 1024;
    public static final List<String> DEFAULT_SKIP_DIRECTORIES = List.of(
            "node_modules", "venv", ".venv", "build", "dist", "target", "__pycache__", "vendor");

    public RepositoryLimits {
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be >= 1");
        }
        if (maxFileBytes < 1) {
            throw new IllegalArgumentException("maxFileBytes must be >= 1");
        }
        skipDirectories = skipDirectories == null ? List.of() : List.copyOf(skipDirectories);
    }

    public static RepositoryLimits defaults() {
        return new RepositoryLimits(DEFAULT_MAX_FILES, DEFAULT_MAX_FILE_BYTES, DEFAULT_SKIP_DIRECTORIES);
    }

    /**
     * Hidden directories are skipped along with the configured names.
     */
    public boolean skips(String directoryName) {
        return directoryName.startsWith(".") || skipDirectories.contains(directoryName);
    }
}
