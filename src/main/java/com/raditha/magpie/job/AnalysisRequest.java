package com.raditha.magpie.job;

import com.raditha.magpie.config.AnalysisConfig;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated request to compare repositories. Construction fails with
 * {@link IllegalArgumentException} on bad input, before any job exists.
 *
 * @param repositories Repository ids (local paths or clone URLs), in submission order
 * @param branch       Branch to analyze; null for each repository's default
 * @param config       Analysis configuration
 */
public record AnalysisRequest(List<String> repositories, String branch, AnalysisConfig config) {

    public AnalysisRequest {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (repositories == null || repositories.size() < 2) {
            throw new IllegalArgumentException("At least 2 repositories are required");
        }
        if (repositories.size() > config.maxRepositories()) {
            throw new IllegalArgumentException(String.format(
                    "At most %d repositories can be compared, got %d",
                    config.maxRepositories(), repositories.size()));
        }
        Set<String> seen = new HashSet<>();
        for (String repo : repositories) {
            if (repo == null || repo.isBlank()) {
                throw new IllegalArgumentException("Repository id must not be blank");
            }
            if (!seen.add(repo.trim())) {
                throw new IllegalArgumentException("Duplicate repository: " + repo);
            }
        }
        repositories = repositories.stream().map(String::trim).toList();
        branch = branch == null || branch.isBlank() ? null : branch.trim();
    }
}
