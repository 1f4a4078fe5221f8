package com.raditha.magpie.job;

import com.raditha.magpie.commit.CommitAnalysis;
import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.model.Report;
import com.raditha.magpie.normalization.Language;
import com.raditha.magpie.report.ReportBuilder;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisJobTest {

    private AnalysisJob job;

    @BeforeEach
    void setUp() {
        job = newJob();
    }

    private static AnalysisJob newJob() {
        return new AnalysisJob(new AnalysisRequest(List.of("a", "b"), null, AnalysisConfig.moderate(Language.PYTHON)));
    }

    private static Report emptyReport() {
        return new ReportBuilder().build(List.of("a", "b"), List.of(), CommitAnalysis.empty(), Language.PYTHON, 0.75);
    }

    @Test
    void testStartsQueued() {
        JobSnapshot snapshot = job.snapshot();

        assertEquals(JobStatus.QUEUED, snapshot.status());
        assertEquals(0, snapshot.progress());
        assertEquals(List.of("a", "b"), snapshot.repositories());
        assertEquals("python", snapshot.language());
        assertTrue(snapshot.report().isEmpty());
        assertTrue(snapshot.errorMessage().isEmpty());
    }

    @Test
    void testTransitionsMoveProgressToStageStart() {
        job.transition(JobStatus.CLONING);
        job.transition(JobStatus.EMBEDDING);

        assertEquals(JobStatus.EMBEDDING, job.snapshot().status());
        assertEquals(40, job.snapshot().progress());
    }

    @Test
    void testBackwardTransitionRejected() {
        job.transition(JobStatus.SCORING);

        assertThrows(IllegalStateException.class, () -> job.transition(JobStatus.CLONING));
        assertThrows(IllegalArgumentException.class, () -> job.transition(JobStatus.COMPLETED));
    }

    @Test
    void testCompletePublishesReportAtomically() {
        job.transition(JobStatus.REASONING);
        Report report = emptyReport();

        JobSnapshot snapshot = job.complete(report);

        assertEquals(JobStatus.COMPLETED, snapshot.status());
        assertEquals(100, snapshot.progress());
        assertSame(report, snapshot.report().orElseThrow());
        assertThrows(IllegalStateException.class, () -> job.complete(report));
    }

    @Test
    void testFailKeepsFirstOutcome() {
        job.transition(JobStatus.CLONING);

        assertTrue(job.fail("CLONING: boom"));
        assertFalse(job.fail("CLONING: again"));
        assertEquals("CLONING: boom", job.snapshot().error());
        assertTrue(job.snapshot().report().isEmpty());
        assertThrows(IllegalStateException.class, () -> job.transition(JobStatus.SCORING));
    }

    @Test
    void testFailedJobCannotComplete() {
        job.fail("QUEUED: stop");

        assertThrows(IllegalStateException.class, () -> job.complete(emptyReport()));
    }

    @Test
    void testCancellationRequestIsIdempotent() {
        assertFalse(job.isCancellationRequested());
        assertTrue(job.requestCancellation());
        assertFalse(job.requestCancellation());
        assertTrue(job.isCancellationRequested());
    }

    @Property(tries = 100)
    void progressNeverDecreases(@ForAll("progressValues") List<Integer> values) {
        AnalysisJob fresh = newJob();
        int last = 0;
        for (int value : values) {
            int now = fresh.progress(value).progress();
            assertTrue(now >= last);
            assertTrue(now >= 0 && now <= 100);
            last = now;
        }
    }

    @Property(tries = 50)
    void progressIgnoredAfterFailure(@ForAll @IntRange(min = 0, max = 100) int value) {
        AnalysisJob fresh = newJob();
        fresh.progress(10);
        fresh.fail("QUEUED: stop");

        assertEquals(10, fresh.progress(value).progress());
    }

    @Provide
    Arbitrary<List<Integer>> progressValues() {
        return Arbitraries.integers().between(-50, 150).list().ofMaxSize(20);
    }
}
