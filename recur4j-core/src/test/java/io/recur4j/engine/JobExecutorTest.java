package io.recur4j.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.core.JobStatus;
import io.recur4j.core.JobType;
import io.recur4j.store.InMemoryJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryJobRepository repository;
    private ScriptedHandler handler;
    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
        handler = new ScriptedHandler();
        executor = new JobExecutor(repository,
                new JobHandlerRegistry(List.of(handler)),
                new JobLocks(),
                new ObjectMapper(),
                Clock.fixed(T0, ZoneOffset.UTC),
                ZoneOffset.UTC,
                "worker-test");
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void successShouldUpdateStatisticsAndScheduleNextRun() {
        Job job = saved(newJob("stats-job"), j -> {
            j.setRetryCount(1);
            j.setSuccessfulRuns(1);
            j.setTotalRuns(2);
            j.setFailedRuns(1);
            j.setAverageRuntime(2.0);
        });
        AtomicReference<JobStatus> statusDuringRun = new AtomicReference<>();
        handler.body(() -> {
            statusDuringRun.set(repository.findJob(job.getId()).orElseThrow().getStatus());
            return "done";
        });

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(JobStatus.RUNNING, statusDuringRun.get());
        assertEquals(JobStatus.COMPLETED, execution.getStatus());
        assertEquals("done", execution.getResult());
        assertEquals("worker-test", execution.getWorkerNode());
        assertEquals(T0, execution.getStartedAt());

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, after.getStatus());
        assertEquals(3, after.getTotalRuns());
        assertEquals(2, after.getSuccessfulRuns());
        assertEquals(1, after.getFailedRuns());
        assertEquals(0, after.getRetryCount());
        // weighted by every run, failed ones included
        assertEquals((2.0 * 2 + execution.getDuration()) / 3, after.getAverageRuntime(), 1e-9);
        assertEquals(T0, after.getLastRunTime());
        assertEquals(T0.plusSeconds(3600), after.getNextRunTime());
        assertEquals(1, repository.listExecutions(job.getId(), 1, 10).total());
    }

    @Test
    void blankResultShouldFallBackToDefaultMessage() {
        Job job = saved(newJob("quiet-job"), j -> { });
        handler.body(() -> null);

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(JobExecutor.DEFAULT_RESULT, execution.getResult());
    }

    @Test
    void payloadShouldReachHandler() {
        Job job = saved(newJob("payload-job"), j -> j.setPayload(Map.of("operation", "sync", "batch", 50)));

        executor.execute(job.getId());

        assertEquals("sync", handler.lastPayload().get("operation"));
        assertEquals(50, handler.lastPayload().get("batch"));
    }

    @Test
    void unknownTypeShouldRunOnCustomHandler() {
        Job job = saved(newJob("backup-job"), j -> j.setJobType(JobType.BACKUP_TASK));

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(1, handler.invocations());
        assertEquals(JobStatus.COMPLETED, execution.getStatus());
    }

    @Test
    void failedRunShouldLeaveAverageUntouchedButWeighTheNextOne() {
        Job job = saved(newJob("avg-job"), j -> j.setMaxRetries(3));
        handler.body(() -> {
            throw new IllegalStateException("first attempt");
        });
        executor.execute(job.getId()).orElseThrow();

        Job afterFailure = repository.findJob(job.getId()).orElseThrow();
        assertEquals(1, afterFailure.getTotalRuns());
        assertEquals(0.0, afterFailure.getAverageRuntime(), 1e-9);

        handler.body(() -> "ok");
        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(2, after.getTotalRuns());
        assertEquals(1, after.getSuccessfulRuns());
        assertEquals(execution.getDuration() / 2, after.getAverageRuntime(), 1e-9);
    }

    @Test
    void failureShouldScheduleRetryWithBackoff() {
        Job job = saved(newJob("flaky-job"), j -> { });
        handler.body(() -> {
            throw new IllegalStateException("upstream unavailable");
        });

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(JobStatus.FAILED, execution.getStatus());
        assertEquals("upstream unavailable", execution.getErrorMessage());
        assertTrue(execution.getStackTrace().contains("IllegalStateException"));

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, after.getStatus());
        assertEquals(1, after.getRetryCount());
        assertEquals(1, after.getFailedRuns());
        assertEquals(T0.plus(Duration.ofMinutes(2)), after.getNextRunTime());
    }

    @Test
    void exhaustedRetriesShouldFailJob() {
        Job job = saved(newJob("doomed-job"), j -> j.setMaxRetries(2));
        handler.body(() -> {
            throw new RuntimeException("always");
        });

        for (int i = 0; i < 3; i++) {
            executor.execute(job.getId());
        }

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertEquals(2, after.getRetryCount());
        assertEquals(3, after.getFailedRuns());
        assertEquals(3, after.getTotalRuns());
        assertNull(after.getNextRunTime());
        assertEquals(3, repository.listExecutions(job.getId(), 1, 10).total());
    }

    @Test
    void zeroRetriesShouldFailOnFirstError() {
        Job job = saved(newJob("no-retry-job"), j -> j.setMaxRetries(0));
        handler.body(() -> {
            throw new RuntimeException("nope");
        });

        executor.execute(job.getId());

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, after.getStatus());
        assertEquals(0, after.getRetryCount());
        assertNull(after.getNextRunTime());
    }

    @Test
    void slowHandlerShouldTimeOut() {
        Job job = saved(newJob("slow-job"), j -> j.setTimeoutSeconds(1));
        handler.body(() -> {
            Thread.sleep(10_000);
            return "too late";
        });

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(JobStatus.FAILED, execution.getStatus());
        assertTrue(execution.getErrorMessage().contains("timed out"), execution.getErrorMessage());
        assertTrue(execution.getDuration() >= 0.9 && execution.getDuration() < 5.0, "duration=" + execution.getDuration());
        assertEquals(1, repository.findJob(job.getId()).orElseThrow().getRetryCount());
    }

    @Test
    void inactiveJobShouldNotRun() {
        Job job = saved(newJob("paused-job"), j -> {
            j.setActive(false);
            j.setStatus(JobStatus.PAUSED);
        });

        Optional<JobExecution> execution = executor.execute(job.getId());

        assertTrue(execution.isEmpty());
        assertEquals(0, handler.invocations());
        assertEquals(JobStatus.PAUSED, repository.findJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void missingJobShouldNotRun() {
        assertTrue(executor.execute(UUID.randomUUID().toString()).isEmpty());
        assertEquals(0, handler.invocations());
    }

    @Test
    void jobDeletedDuringRunShouldDiscardExecution() {
        Job job = saved(newJob("vanishing-job"), j -> { });
        handler.body(() -> {
            repository.deleteJob(job.getId());
            return "done";
        });

        Optional<JobExecution> execution = executor.execute(job.getId());

        assertTrue(execution.isEmpty());
        assertTrue(repository.findJob(job.getId()).isEmpty());
        assertEquals(0, repository.listExecutions(job.getId(), 1, 10).total());
    }

    @Test
    void jobPausedDuringRunShouldStayPaused() {
        Job job = saved(newJob("pausing-job"), j -> { });
        handler.body(() -> {
            Job current = repository.findJob(job.getId()).orElseThrow();
            current.setActive(false);
            current.setStatus(JobStatus.PAUSED);
            current.setNextRunTime(null);
            repository.saveJob(current);
            return "done";
        });

        JobExecution execution = executor.execute(job.getId()).orElseThrow();

        assertEquals(JobStatus.COMPLETED, execution.getStatus());
        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PAUSED, after.getStatus());
        assertNull(after.getNextRunTime());
        assertEquals(1, after.getSuccessfulRuns());
    }

    private Job saved(Job job, Consumer<Job> customizer) {
        customizer.accept(job);
        repository.saveJob(job);
        return job;
    }

    static Job newJob(String name) {
        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setName(name);
        job.setIntervalSeconds(3600L);
        job.setNextRunTime(T0);
        job.setMaxRetries(3);
        job.setTimeoutSeconds(60);
        job.setPriority(5);
        job.setCreatedBy("system");
        job.setCreatedAt(T0);
        job.setUpdatedAt(T0);
        job.setPayload(Map.of());
        return job;
    }
}
