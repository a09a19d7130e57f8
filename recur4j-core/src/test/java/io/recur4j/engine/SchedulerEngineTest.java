package io.recur4j.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.core.JobStatus;
import io.recur4j.exception.JobStoreException;
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
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.recur4j.engine.Waits.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class SchedulerEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private Recur4jProperties props;
    private InMemoryJobRepository repository;
    private ScriptedHandler handler;
    private JobLocks locks;
    private JobExecutor executor;
    private SchedulerEngine engine;

    @BeforeEach
    void setUp() {
        props = new Recur4jProperties();
        props.setMaxConcurrency(4);
        props.setShutdownTimeout(Duration.ofSeconds(2));

        repository = new InMemoryJobRepository();
        handler = new ScriptedHandler();
        locks = new JobLocks();
        executor = new JobExecutor(repository, new JobHandlerRegistry(List.of(handler)), locks,
                new ObjectMapper(), Clock.systemUTC(), ZoneOffset.UTC, "worker-test");
        engine = new SchedulerEngine(props, repository, executor, locks, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        executor.shutdown();
    }

    @Test
    void scheduleJobShouldArmOnlyRunnableJobs() {
        Job paused = newJob("paused-job", Instant.now().plusSeconds(3600));
        paused.setActive(false);
        Job unscheduled = newJob("no-next-run", null);
        Job ready = newJob("ready-job", Instant.now().plusSeconds(3600));

        assertFalse(engine.scheduleJob(paused));
        assertFalse(engine.scheduleJob(unscheduled));
        assertTrue(engine.scheduleJob(ready));

        assertEquals(Set.of(ready.getId()), engine.armedJobIds());
    }

    @Test
    void reschedulingShouldReplaceTrigger() {
        Instant first = Instant.now().plusSeconds(3600);
        Job job = newJob("moving-job", first);
        engine.scheduleJob(job);

        job.setNextRunTime(first.plusSeconds(3600));
        engine.rescheduleJob(job);

        assertEquals(1, engine.armedJobIds().size());
        assertEquals(first.plusSeconds(3600), engine.nextFireTime(job.getId()).orElseThrow());

        engine.removeJob(job.getId());
        engine.removeJob(job.getId());
        assertFalse(engine.isArmed(job.getId()));
        assertTrue(engine.nextFireTime(job.getId()).isEmpty());
    }

    @Test
    void dueJobShouldFireAndBeRearmed() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        handler.body(() -> {
            ran.countDown();
            return "ok";
        });
        Job job = persisted(newJob("due-job", Instant.now().minusSeconds(1)));
        engine.scheduleJob(job);

        engine.start();

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        waitUntil(() -> repository.listExecutions(job.getId(), 1, 10).total() == 1, WAIT);
        waitUntil(() -> engine.isArmed(job.getId()), WAIT);

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, after.getStatus());
        Instant fireAt = engine.nextFireTime(job.getId()).orElseThrow();
        assertEquals(after.getNextRunTime(), fireAt);
        assertTrue(fireAt.isAfter(Instant.now().plusSeconds(3500)));
    }

    @Test
    void overlappingFiringShouldBeCoalesced() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        handler.body(() -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "ok";
        });
        Job job = persisted(newJob("long-job", Instant.now().plusSeconds(3600)));
        engine.start();

        assertTrue(engine.dispatch(job.getId()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(engine.isInFlight(job.getId()));

        assertFalse(engine.dispatch(job.getId()));

        release.countDown();
        waitUntil(() -> !engine.isInFlight(job.getId()), WAIT);

        assertEquals(1, handler.invocations());
        assertEquals(1, repository.listExecutions(job.getId(), 1, 10).total());
        assertEquals(1, repository.findJob(job.getId()).orElseThrow().getTotalRuns());
    }

    @Test
    void dispatchBeforeStartShouldFail() {
        assertThrows(IllegalStateException.class, () -> engine.dispatch(UUID.randomUUID().toString()));
    }

    @Test
    void triggerOfDeactivatedJobShouldBeSkipped() throws Exception {
        props.setRestoreOnStartup(false);
        Job job = persisted(newJob("stale-job", Instant.now().minusSeconds(1)));
        engine.scheduleJob(job);

        Job deactivated = repository.findJob(job.getId()).orElseThrow();
        deactivated.setActive(false);
        deactivated.setStatus(JobStatus.PAUSED);
        repository.saveJob(deactivated);

        engine.start();

        waitUntil(() -> !engine.isArmed(job.getId()) && !engine.isInFlight(job.getId()), WAIT);
        assertEquals(0, handler.invocations());
        assertEquals(0, repository.listExecutions(job.getId(), 1, 10).total());
    }

    @Test
    void dispatchFailureShouldBeIsolatedToOneJob() throws Exception {
        Job bad = persisted(newJob("bad-job", Instant.now().minusSeconds(1)));
        Job good = persisted(newJob("good-job", Instant.now().minusSeconds(1)));

        JobExecutor failing = spy(executor);
        doThrow(new JobStoreException("store unavailable")).when(failing).execute(bad.getId());
        engine = new SchedulerEngine(props, repository, failing, locks, Clock.systemUTC());

        engine.start();

        waitUntil(() -> repository.listExecutions(good.getId(), 1, 10).total() == 1, WAIT);
        waitUntil(() -> repository.findJob(bad.getId()).orElseThrow().getStatus() == JobStatus.FAILED, WAIT);
        waitUntil(() -> engine.isArmed(bad.getId()), WAIT);

        Job badAfter = repository.findJob(bad.getId()).orElseThrow();
        assertEquals(1, badAfter.getFailedRuns());
        assertEquals(0, badAfter.getTotalRuns());
        assertTrue(badAfter.getNextRunTime().isAfter(Instant.now().plusSeconds(3500)));

        // dispatcher survives and keeps firing
        Job later = persisted(newJob("later-job", Instant.now().minusSeconds(1)));
        engine.scheduleJob(later);
        waitUntil(() -> repository.listExecutions(later.getId(), 1, 10).total() == 1, WAIT);
    }

    @Test
    void dispatchFailureOfPausedJobShouldKeepItPaused() throws Exception {
        Job job = persisted(newJob("paused-job", Instant.now().minusSeconds(1)));

        JobExecutor failing = spy(executor);
        doAnswer(inv -> {
            Job current = repository.findJob(job.getId()).orElseThrow();
            current.setActive(false);
            current.setStatus(JobStatus.PAUSED);
            current.setNextRunTime(null);
            repository.saveJob(current);
            throw new JobStoreException("store unavailable");
        }).when(failing).execute(job.getId());
        engine = new SchedulerEngine(props, repository, failing, locks, Clock.systemUTC());

        engine.start();

        waitUntil(() -> repository.findJob(job.getId()).orElseThrow().getFailedRuns() == 1, WAIT);

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PAUSED, after.getStatus());
        assertFalse(after.isActive());
        assertNull(after.getNextRunTime());
        assertFalse(engine.isArmed(job.getId()));
    }

    @Test
    void failedRunWithRetriesLeftShouldBeRearmedAtBackoff() throws Exception {
        handler.body(() -> {
            throw new IllegalStateException("boom");
        });
        Job job = persisted(newJob("retry-job", Instant.now().minusSeconds(1)));
        engine.scheduleJob(job);

        engine.start();

        waitUntil(() -> repository.listExecutions(job.getId(), 1, 10).total() == 1, WAIT);
        waitUntil(() -> engine.isArmed(job.getId()), WAIT);

        Job after = repository.findJob(job.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, after.getStatus());
        assertEquals(1, after.getRetryCount());
        assertEquals(after.getNextRunTime(), engine.nextFireTime(job.getId()).orElseThrow());
        JobExecution execution = repository.listExecutions(job.getId(), 1, 1).items().get(0);
        assertEquals("boom", execution.getErrorMessage());
    }

    @Test
    void startShouldRestoreActiveJobsAndRecoverInterruptedRuns() {
        Instant future = Instant.now().plusSeconds(3600);
        Job interrupted = newJob("interrupted-job", future);
        interrupted.setStatus(JobStatus.RUNNING);
        persisted(interrupted);
        Job pending = persisted(newJob("pending-job", future));
        Job paused = newJob("paused-job", null);
        paused.setActive(false);
        paused.setStatus(JobStatus.PAUSED);
        persisted(paused);

        engine.start();

        assertTrue(engine.isArmed(interrupted.getId()));
        assertTrue(engine.isArmed(pending.getId()));
        assertFalse(engine.isArmed(paused.getId()));
        assertEquals(JobStatus.PENDING, repository.findJob(interrupted.getId()).orElseThrow().getStatus());
        assertEquals(future, engine.nextFireTime(interrupted.getId()).orElseThrow());
    }

    @Test
    void stopShouldClearTriggersAndRestartShouldRestoreThem() {
        Job job = persisted(newJob("restart-job", Instant.now().plusSeconds(3600)));
        engine.start();
        engine.start();
        assertTrue(engine.isStarted());
        assertTrue(engine.isArmed(job.getId()));

        engine.stop();
        engine.stop();
        assertFalse(engine.isStarted());
        assertTrue(engine.armedJobIds().isEmpty());

        engine.start();
        assertTrue(engine.isArmed(job.getId()));
    }

    @Test
    void invalidConcurrencyShouldFailStart() {
        props.setMaxConcurrency(0);

        assertThrows(IllegalArgumentException.class, () -> engine.start());
        assertFalse(engine.isStarted());
    }

    private Job persisted(Job job) {
        repository.saveJob(job);
        return job;
    }

    private static Job newJob(String name, Instant nextRunTime) {
        Instant now = Instant.now();
        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setName(name);
        job.setIntervalSeconds(3600L);
        job.setNextRunTime(nextRunTime);
        job.setMaxRetries(3);
        job.setTimeoutSeconds(60);
        job.setPriority(5);
        job.setCreatedBy("system");
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setPayload(Map.of());
        return job;
    }
}
