package com.raditha.magpie.git;

import com.raditha.magpie.model.RepositorySnapshot;
import com.raditha.magpie.normalization.Language;

/**
 * Produces the source files and recent commits of a repository.
 */
public interface RepositoryMaterializer {

    /**
     * @param repoId     Repository identifier (local path or clone URL)
     * @param branch     Branch to read; null for the default branch
     * @param language   Only files of this language are returned
     * @param maxCommits Most recent commits to read; 0 reads none
     * @throws RepositoryMaterializationException if the repository cannot be read
     */
    RepositorySnapshot materialize(String repoId, String branch, Language language, int maxCommits)
            throws RepositoryMaterializationException;
}
