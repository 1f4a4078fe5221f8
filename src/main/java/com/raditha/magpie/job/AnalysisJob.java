package com.raditha.magpie.job;

import com.raditha.magpie.model.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One analysis run. All state lives in a single {@link AtomicReference} so a poller sees
 * either the snapshot before a transition or the one after it, never a mix. The report is
 * published in the same snapshot as the COMPLETED status.
 */
public class AnalysisJob {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisJob.class);

    private final UUID id;
    private final AnalysisRequest request;
    private final Clock clock;
    private final AtomicReference<JobSnapshot> state;
    private final AtomicBoolean cancellationRequested = new AtomicBoolean();

    public AnalysisJob(UUID id, AnalysisRequest request, Clock clock) {
        this.id = id;
        this.request = request;
        this.clock = clock;
        this.state = new AtomicReference<>(JobSnapshot.queued(id, request, Instant.now(clock)));
    }

    public AnalysisJob(AnalysisRequest request) {
        this(UUID.randomUUID(), request, Clock.systemUTC());
    }

    public UUID id() {
        return id;
    }

    public AnalysisRequest request() {
        return request;
    }

    public JobSnapshot snapshot() {
        return state.get();
    }

    /**
     * Move to the next stage.
     *
     * @throws IllegalStateException if the move is not forward or the job already finished
     */
    public JobSnapshot transition(JobStatus next) {
        if (next == JobStatus.COMPLETED || next == JobStatus.FAILED) {
            throw new IllegalArgumentException("Use complete() or fail() to finish a job");
        }
        JobSnapshot updated = state.updateAndGet(current -> {
            if (!current.status().canTransitionTo(next)) {
                throw new IllegalStateException(
                        String.format("Illegal transition %s -> %s for job %s", current.status(), next, id));
            }
            return current.withStatus(next, Math.max(current.progress(), next.progressStart()), Instant.now(clock));
        });
        logger.info("Job {} entered {} ({}%)", id, next, updated.progress());
        return updated;
    }

    /**
     * Report progress. Values are clamped to [0, 100] and never move backwards.
     */
    public JobSnapshot progress(int value) {
        return state.updateAndGet(current -> {
            if (current.isTerminal()) {
                return current;
            }
            int next = Math.max(current.progress(), Math.max(0, Math.min(100, value)));
            return next == current.progress() ? current : current.withProgress(next, Instant.now(clock));
        });
    }

    /**
     * Publish the report and finish.
     *
     * @throws IllegalStateException if the job already finished
     */
    public JobSnapshot complete(Report report) {
        JobSnapshot updated = state.updateAndGet(current -> {
            if (current.isTerminal()) {
                throw new IllegalStateException("Job " + id + " already finished as " + current.status());
            }
            return current.completed(report, Instant.now(clock));
        });
        logger.info("Job {} completed", id);
        return updated;
    }

    /**
     * Finish with an error. A job that already finished keeps its outcome.
     *
     * @return true if this call moved the job to FAILED
     */
    public boolean fail(String message) {
        JobSnapshot before = state.getAndUpdate(current ->
                current.isTerminal() ? current : current.failed(message, Instant.now(clock)));
        if (before.isTerminal()) {
            return false;
        }
        logger.warn("Job {} failed: {}", id, message);
        return true;
    }

    /**
     * Ask the job to stop at the next stage boundary. Idempotent.
     *
     * @return true if this call made the request
     */
    public boolean requestCancellation() {
        boolean first = cancellationRequested.compareAndSet(false, true);
        if (first) {
            logger.info("Cancellation requested for job {}", id);
        }
        return first;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }
}
