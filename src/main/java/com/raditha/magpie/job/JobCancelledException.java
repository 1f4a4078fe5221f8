package com.raditha.magpie.job;

/**
 * Thrown at a stage boundary once cancellation has been requested.
 */
class JobCancelledException extends RuntimeException {

    JobCancelledException(JobStatus stage) {
        super("cancelled by request during " + stage);
    }
}
