package com.raditha.magpie.job;

import com.raditha.magpie.model.Report;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable view of a job at one point in time, handed to pollers.
 *
 * @param id           Job id
 * @param status       Current stage
 * @param progress     0-100, never decreasing
 * @param repositories Repositories in submission order
 * @param threshold    Similarity threshold of the job
 * @param language     Language tag of the job
 * @param result       Report, present only when COMPLETED
 * @param error        "STAGE: cause", present only when FAILED
 * @param createdAt    Submission time
 * @param updatedAt    Time of the last transition or progress update
 */
public record JobSnapshot(
        UUID id,
        JobStatus status,
        int progress,
        List<String> repositories,
        double threshold,
        String language,
        @Nullable Report result,
        @Nullable String error,
        Instant createdAt,
        Instant updatedAt) {

    public JobSnapshot {
        repositories = List.copyOf(repositories);
    }

    static JobSnapshot queued(UUID id, AnalysisRequest request, Instant now) {
        return new JobSnapshot(id, JobStatus.QUEUED, 0, request.repositories(),
                request.config().threshold(), request.config().language().tag(), null, null, now, now);
    }

    public Optional<Report> report() {
        return Optional.ofNullable(result);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    JobSnapshot withStatus(JobStatus next, int newProgress, Instant now) {
        return new JobSnapshot(id, next, newProgress, repositories, threshold, language, result, error,
                createdAt, now);
    }

    JobSnapshot withProgress(int newProgress, Instant now) {
        return new JobSnapshot(id, status, newProgress, repositories, threshold, language, result, error,
                createdAt, now);
    }

    JobSnapshot completed(Report report, Instant now) {
        return new JobSnapshot(id, JobStatus.COMPLETED, 100, repositories, threshold, language, report, null,
                createdAt, now);
    }

    JobSnapshot failed(String message, Instant now) {
        return new JobSnapshot(id, JobStatus.FAILED, progress, repositories, threshold, language, null, message,
                createdAt, now);
    }
}
