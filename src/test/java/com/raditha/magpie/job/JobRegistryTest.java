package com.raditha.magpie.job;

import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.embedding.HashingEmbeddingFunction;
import com.raditha.magpie.git.RepositoryMaterializationException;
import com.raditha.magpie.git.RepositoryMaterializer;
import com.raditha.magpie.normalization.Language;
import com.raditha.magpie.report.ExplanationGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.raditha.magpie.job.SampleCode.CART;
import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private InMemoryMaterializer materializer;
    private CountDownLatch started;
    private CountDownLatch release;
    private JobRegistry registry;
    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        materializer = new InMemoryMaterializer()
                .add("a", Map.of("cart.py", CART))
                .add("b", Map.of("basket.py", CART));
        started = new CountDownLatch(1);
        release = new CountDownLatch(0);
        config = AnalysisConfig.moderate(Language.PYTHON);
        RepositoryMaterializer gated = (repoId, branch, language, maxCommits) -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RepositoryMaterializationException(repoId, "interrupted", e);
            }
            return materializer.materialize(repoId, branch, language, maxCommits);
        };
        registry = new JobRegistry(new AnalysisPipeline(gated, new HashingEmbeddingFunction(),
                ExplanationGenerator.NONE));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        registry.close();
    }

    @Test
    void testSubmitRunsToCompletion() throws InterruptedException {
        JobSnapshot queued = registry.submit(List.of("a", "b"), null, config);

        JobSnapshot done = registry.await(queued.id(), TIMEOUT);

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1.0, done.report().orElseThrow().comparisons().get(0).repoSimilarity(), 1e-9);
        assertEquals(done, registry.find(queued.id()).orElseThrow());
    }

    @Test
    void testInvalidSubmissionCreatesNoJob() {
        assertThrows(IllegalArgumentException.class, () -> registry.submit(List.of("a"), null, config));
        assertThrows(IllegalArgumentException.class, () -> registry.submit(List.of("a", "a"), null, config));

        assertTrue(registry.list().isEmpty());
    }

    @Test
    void testFailedJobReported() throws InterruptedException {
        JobSnapshot queued = registry.submit(List.of("a", "unknown"), null, config);

        JobSnapshot done = registry.await(queued.id(), TIMEOUT);

        assertEquals(JobStatus.FAILED, done.status());
        assertTrue(done.error().contains("unknown"));
    }

    @Test
    void testCancelRunningJob() throws InterruptedException {
        release = new CountDownLatch(1);
        JobSnapshot queued = registry.submit(List.of("a", "b"), null, config);
        assertTrue(started.await(30, TimeUnit.SECONDS));

        assertTrue(registry.cancel(queued.id()));
        release.countDown();
        JobSnapshot done = registry.await(queued.id(), TIMEOUT);

        assertEquals(JobStatus.FAILED, done.status());
        assertTrue(done.error().contains("cancelled"));
        assertFalse(registry.cancel(queued.id()));
    }

    @Test
    void testUnknownJob() {
        UUID unknown = UUID.randomUUID();

        assertTrue(registry.find(unknown).isEmpty());
        assertFalse(registry.cancel(unknown));
        assertThrows(IllegalArgumentException.class, () -> registry.await(unknown, TIMEOUT));
    }

    @Test
    void testListReturnsEveryJob() throws InterruptedException {
        JobSnapshot first = registry.submit(List.of("a", "b"), null, config);
        JobSnapshot second = registry.submit(List.of("b", "a"), "main", config);
        registry.await(second.id(), TIMEOUT);

        List<UUID> ids = registry.list().stream().map(JobSnapshot::id).toList();

        assertEquals(2, ids.size());
        assertTrue(ids.containsAll(List.of(first.id(), second.id())));
    }

    @Test
    void testCloseFailsQueuedJobs() throws InterruptedException {
        release = new CountDownLatch(1);
        JobSnapshot running = registry.submit(List.of("a", "b"), null, config);
        assertTrue(started.await(30, TimeUnit.SECONDS));
        JobSnapshot waiting = registry.submit(List.of("a", "b"), null, config);

        registry.close();

        JobSnapshot closed = registry.find(waiting.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, closed.status());
        assertEquals("QUEUED: registry closed", closed.error());
        assertEquals(JobStatus.FAILED, registry.find(running.id()).orElseThrow().status());
    }

    @Test
    void testSubmitAfterCloseCreatesNoJob() {
        registry.close();

        assertThrows(IllegalStateException.class, () -> registry.submit(List.of("a", "b"), null, config));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void testPurgeFinishedKeepsRunningJobs() throws InterruptedException {
        JobSnapshot finished = registry.submit(List.of("a", "b"), null, config);
        registry.await(finished.id(), TIMEOUT);
        release = new CountDownLatch(1);
        started = new CountDownLatch(1);
        JobSnapshot running = registry.submit(List.of("a", "b"), null, config);

        assertEquals(1, registry.purgeFinished());

        assertTrue(registry.find(finished.id()).isEmpty());
        assertTrue(registry.find(running.id()).isPresent());
        release.countDown();
        assertEquals(JobStatus.COMPLETED, registry.await(running.id(), TIMEOUT).status());
    }
}
