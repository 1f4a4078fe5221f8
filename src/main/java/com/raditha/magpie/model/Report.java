package com.raditha.magpie.model;

import java.time.Instant;
import java.util.List;

/**
 * Final result of an analysis job. Immutable once attached to a completed job.
 *
 * @param summary          Headline counts
 * @param repositoryMatrix Symmetric repository similarity matrix
 * @param suspiciousPairs  Flagged repository pairs, most similar first
 * @param commitFlags      Suspicious commit pairs across repositories
 * @param comparisons      Every repository pair, in submission order
 * @param largeCommits     Commits that changed more lines than the configured limit
 * @param language         Language tag of the job
 * @param threshold        Similarity threshold of the job
 * @param generatedAt      When the report was assembled
 */
public record Report(
        ReportSummary summary,
        SimilarityMatrix repositoryMatrix,
        List<RepoPairResult> suspiciousPairs,
        List<CommitFlag> commitFlags,
        List<RepoPairResult> comparisons,
        List<CommitRecord> largeCommits,
        String language,
        double threshold,
        Instant generatedAt) {

    public Report {
        suspiciousPairs = List.copyOf(suspiciousPairs);
        commitFlags = List.copyOf(commitFlags);
        comparisons = List.copyOf(comparisons);
        largeCommits = List.copyOf(largeCommits);
    }

    public boolean hasSuspiciousPairs() {
        return !suspiciousPairs.isEmpty();
    }
}
