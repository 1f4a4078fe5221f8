package com.raditha.magpie.job;

import com.raditha.magpie.git.RepositoryMaterializationException;
import com.raditha.magpie.git.RepositoryMaterializer;
import com.raditha.magpie.model.CommitRecord;
import com.raditha.magpie.model.RepositorySnapshot;
import com.raditha.magpie.normalization.Language;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Serves repositories from memory. Unknown ids fail like an unreachable remote.
 */
class InMemoryMaterializer implements RepositoryMaterializer {

    final Map<String, RepositorySnapshot> repositories = new ConcurrentHashMap<>();
    final List<Integer> requestedCommitWindows = new CopyOnWriteArrayList<>();

    InMemoryMaterializer add(String repoId, Map<String, String> files) {
        return add(repoId, files, List.of());
    }

    InMemoryMaterializer add(String repoId, Map<String, String> files, List<CommitRecord> commits) {
        repositories.put(repoId, new RepositorySnapshot(repoId, files, commits));
        return this;
    }

    @Override
    public RepositorySnapshot materialize(String repoId, String branch, Language language, int maxCommits)
            throws RepositoryMaterializationException {
        requestedCommitWindows.add(maxCommits);
        RepositorySnapshot snapshot = repositories.get(repoId);
        if (snapshot == null) {
            throw new RepositoryMaterializationException(repoId, "repository not found");
        }
        return snapshot;
    }
}
