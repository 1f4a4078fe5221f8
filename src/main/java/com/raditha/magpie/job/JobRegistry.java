package com.raditha.magpie.job;

import com.raditha.magpie.config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the jobs of this process, addressed by id, and runs them one at a time on a single
 * worker thread.
 */
public class JobRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    private final AnalysisPipeline pipeline;
    private final Clock clock;
    private final Map<UUID, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final Map<UUID, Future<?>> futures = new ConcurrentHashMap<>();
    private final ExecutorService worker;

    public JobRegistry(AnalysisPipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock = clock;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "magpie-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public JobRegistry(AnalysisPipeline pipeline) {
        this(pipeline, Clock.systemUTC());
    }

    /**
     * Validate and queue a job.
     *
     * @throws IllegalArgumentException on invalid input; no job is created
     */
    public JobSnapshot submit(List<String> repositories, String branch, AnalysisConfig config) {
        return submit(new AnalysisRequest(repositories, branch, config));
    }

    /**
     * @throws IllegalStateException if the registry has been closed; no job is created
     */
    public synchronized JobSnapshot submit(AnalysisRequest request) {
        if (worker.isShutdown()) {
            throw new IllegalStateException("Job registry is closed");
        }
        AnalysisJob job = new AnalysisJob(UUID.randomUUID(), request, clock);
        Future<?> future = worker.submit(() -> pipeline.run(job));
        jobs.put(job.id(), job);
        futures.put(job.id(), future);
        logger.info("Queued job {} for {} repositories", job.id(), request.repositories().size());
        return job.snapshot();
    }

    public Optional<JobSnapshot> find(UUID id) {
        return Optional.ofNullable(jobs.get(id)).map(AnalysisJob::snapshot);
    }

    /**
     * Every job, oldest first.
     */
    public List<JobSnapshot> list() {
        return jobs.values().stream()
                .map(AnalysisJob::snapshot)
                .sorted(Comparator.comparing(JobSnapshot::createdAt))
                .toList();
    }

    /**
     * Request cancellation. The job stops at its next stage boundary.
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancel(UUID id) {
        AnalysisJob job = jobs.get(id);
        if (job == null || job.snapshot().isTerminal()) {
            return false;
        }
        job.requestCancellation();
        return true;
    }

    /**
     * Forget every completed or failed job.
     *
     * @return the number of jobs removed
     */
    public synchronized int purgeFinished() {
        List<UUID> finished = jobs.values().stream()
                .filter(job -> job.snapshot().isTerminal())
                .map(AnalysisJob::id)
                .toList();
        for (UUID id : finished) {
            jobs.remove(id);
            futures.remove(id);
        }
        logger.debug("Purged {} finished jobs", finished.size());
        return finished.size();
    }

    /**
     * Wait for a job to finish, up to the timeout.
     *
     * @return the latest snapshot, terminal unless the timeout elapsed first
     * @throws IllegalArgumentException if the job is unknown
     */
    public JobSnapshot await(UUID id, Duration timeout) throws InterruptedException {
        AnalysisJob job = jobs.get(id);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + id);
        }
        Future<?> future = futures.get(id);
        if (future == null) {
            return job.snapshot();
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.debug("Job {} still running after {}", id, timeout);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job " + id + " crashed", e.getCause());
        }
        return job.snapshot();
    }

    @Override
    public synchronized void close() {
        jobs.values().stream()
                .filter(job -> !job.snapshot().isTerminal())
                .forEach(AnalysisJob::requestCancellation);
        worker.shutdownNow();
        // Jobs that never left the queue will not run
        jobs.values().stream()
                .filter(job -> job.snapshot().status() == JobStatus.QUEUED)
                .forEach(job -> job.fail("QUEUED: registry closed"));
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Worker did not stop within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
