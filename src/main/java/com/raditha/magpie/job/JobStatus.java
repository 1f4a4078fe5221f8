package com.raditha.magpie.job;

/**
 * Lifecycle of an analysis job. Stages run in declaration order; FAILED can be reached from
 * any stage that is not terminal.
 */
public enum JobStatus {
    QUEUED(0, 0),
    CLONING(0, 20),
    PREPROCESSING(20, 40),
    EMBEDDING(40, 60),
    SCORING(60, 85),
    REASONING(85, 95),
    COMPLETED(100, 100),
    FAILED(0, 100);

    private final int progressStart;
    private final int progressEnd;

    JobStatus(int progressStart, int progressEnd) {
        this.progressStart = progressStart;
        this.progressEnd = progressEnd;
    }

    public int progressStart() {
        return progressStart;
    }

    public int progressEnd() {
        return progressEnd;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Only forward moves out of a non-terminal state are allowed.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() > ordinal();
    }

    /**
     * Progress at a given fraction of this stage.
     */
    public int progressAt(double fraction) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return progressStart + (int) Math.floor((progressEnd - progressStart) * clamped);
    }
}
