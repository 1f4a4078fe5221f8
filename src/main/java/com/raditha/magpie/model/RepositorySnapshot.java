package com.raditha.magpie.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a repository as handed over by the materializer:
 * source files of the target language keyed by relative path, and the newest commits.
 */
public record RepositorySnapshot(
        String repoId,
        Map<String, String> files,
        List<CommitRecord> commits) {

    public RepositorySnapshot {
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        commits = commits == null ? List.of() : List.copyOf(commits);
    }
}
