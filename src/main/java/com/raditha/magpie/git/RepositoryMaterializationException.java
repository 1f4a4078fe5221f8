package com.raditha.magpie.git;

import java.io.IOException;

/**
 * A repository could not be cloned, opened or read. The message names the repository.
 */
public class RepositoryMaterializationException extends IOException {

    private final String repoId;

    public RepositoryMaterializationException(String repoId, String reason, Throwable cause) {
        super("Failed to read repository " + repoId + ": " + reason, cause);
        this.repoId = repoId;
    }

    public RepositoryMaterializationException(String repoId, String reason) {
        this(repoId, reason, null);
    }

    public String getRepoId() {
        return repoId;
    }
}
