package io.recur4j.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobHandler;
import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobHandlerRegistry;
import io.recur4j.core.JobStatus;
import io.recur4j.exception.ExecutionTimeoutException;
import io.recur4j.exception.InvalidRecurrenceException;
import io.recur4j.exception.JobExecutionException;
import io.recur4j.store.JobRepository;
import io.recur4j.utils.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one firing of a job and records its outcome.
 *
 * <p>A run has three phases:
 * <ol>
 *   <li>mark the persisted job {@code RUNNING} (under the job's lock)</li>
 *   <li>run the handler on the handler pool, waiting at most {@code timeoutSeconds}</li>
 *   <li>re-read the job, apply statistics, retry policy and next run time, and save job and
 *       execution together (under the job's lock)</li>
 * </ol>
 *
 * <p>Handler failures and timeouts become data: a failed {@link JobExecution} and updated job
 * state. Only repository failures escape {@link #execute(String)}.
 *
 * <p>A timed-out handler is interrupted but not waited for. If it ignores interruption, its
 * thread keeps running until the handler returns; its result is discarded.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String DEFAULT_RESULT = "Job completed successfully";

    private final JobRepository repository;
    private final JobHandlerRegistry handlers;
    private final JobLocks locks;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId zone;
    private final String workerId;

    private final ExecutorService handlerPool;

    public JobExecutor(JobRepository repository,
                       JobHandlerRegistry handlers,
                       JobLocks locks,
                       ObjectMapper objectMapper,
                       Clock clock,
                       ZoneId zone,
                       String workerId) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");

        AtomicInteger seq = new AtomicInteger();
        this.handlerPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("recur4j.handler-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Run the job once.
     *
     * @return the persisted execution, or empty if the job was missing or inactive at start
     *         (nothing persisted) or was deleted while running (execution discarded)
     * @throws io.recur4j.exception.JobStoreException if the repository fails
     */
    public Optional<JobExecution> execute(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");

        Job job = locks.withLock(jobId, () -> markRunning(jobId));
        if (job == null) {
            return Optional.empty();
        }

        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        JobExecution execution = JobExecution.begin(jobId, workerId, startedAt);
        log.debug("recur4j job started name={} id={} at={}", job.getName(), jobId, startedAt);

        String result = null;
        JobExecutionException failure = null;
        try {
            result = runHandler(job);
        } catch (JobExecutionException e) {
            failure = e;
        }

        double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        Instant completedAt = clock.instant();

        if (failure == null) {
            execution.complete(result != null && !result.isBlank() ? result : DEFAULT_RESULT,
                    completedAt, durationSeconds);
        } else {
            Throwable reported = failure.getCause() != null ? failure.getCause() : failure;
            execution.fail(failure.getMessage(), stackTraceOf(reported), completedAt, durationSeconds);
        }

        return locks.withLock(jobId, () -> commit(jobId, execution));
    }

    public void shutdown() {
        handlerPool.shutdownNow();
    }

    private Job markRunning(String jobId) {
        Optional<Job> found = repository.findJob(jobId);
        if (found.isEmpty()) {
            log.warn("recur4j job not found, skipping execution id={}", jobId);
            return null;
        }
        Job job = found.get();
        if (!job.isActive()) {
            log.warn("recur4j job inactive, skipping execution name={} id={}", job.getName(), jobId);
            return null;
        }

        job.setStatus(JobStatus.RUNNING);
        job.setUpdatedAt(clock.instant());
        repository.saveJob(job);
        return job;
    }

    private String runHandler(Job job) {
        JobHandler<?> handler = handlers.resolve(job.getJobType());
        Map<String, Object> payload = job.getPayload();
        Duration timeout = Duration.ofSeconds(job.getTimeoutSeconds());

        Future<String> future = handlerPool.submit(() -> invoke(handler, payload));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("recur4j job timed out name={} id={} timeoutSeconds={}",
                    job.getName(), job.getId(), timeout.toSeconds());
            throw new ExecutionTimeoutException(job.getId(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new JobExecutionException(job.getId(), messageOf(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new JobExecutionException(job.getId(), "Job execution interrupted", e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> String invoke(JobHandler<?> handler, Map<String, Object> rawPayload) throws Exception {
        var h = (JobHandler<T>) handler;
        T payload = (rawPayload == null) ? null : objectMapper.convertValue(rawPayload, h.payloadClass());
        return h.execute(payload);
    }

    private Optional<JobExecution> commit(String jobId, JobExecution execution) {
        Optional<Job> found = repository.findJob(jobId);
        if (found.isEmpty()) {
            log.warn("recur4j job deleted while running, discarding execution id={} executionId={}",
                    jobId, execution.getId());
            return Optional.empty();
        }

        Job job = found.get();
        Instant now = execution.getCompletedAt();

        job.setTotalRuns(job.getTotalRuns() + 1);
        job.setLastRunTime(execution.getStartedAt());
        job.setUpdatedAt(now);

        if (execution.getStatus() == JobStatus.COMPLETED) {
            applySuccess(job, execution, now);
        } else {
            applyFailure(job, execution, now);
        }

        if (!job.isActive()) {
            // paused while running: keep the pause
            job.setStatus(JobStatus.PAUSED);
            job.setNextRunTime(null);
        }

        repository.saveRun(job, execution);
        return Optional.of(execution);
    }

    private void applySuccess(Job job, JobExecution execution, Instant now) {
        // totalRuns already counts this run
        long n = job.getTotalRuns();
        double duration = execution.getDuration();

        job.setSuccessfulRuns(job.getSuccessfulRuns() + 1);
        job.setAverageRuntime((job.getAverageRuntime() * (n - 1) + duration) / n);
        job.setRetryCount(0);
        job.setStatus(JobStatus.COMPLETED);
        job.setNextRunTime(nextRunOrNull(job, now));

        log.info("recur4j job completed name={} id={} duration={}s nextRunTime={}",
                job.getName(), job.getId(), String.format("%.3f", duration), job.getNextRunTime());
    }

    private void applyFailure(Job job, JobExecution execution, Instant now) {
        job.setFailedRuns(job.getFailedRuns() + 1);

        if (job.getRetryCount() < job.getMaxRetries()) {
            job.setRetryCount(job.getRetryCount() + 1);
            job.setStatus(JobStatus.PENDING);
            job.setNextRunTime(TriggerCalculator.nextRetryTime(job.getRetryCount(), now));
            log.warn("recur4j job failed, retry scheduled name={} id={} retry={}/{} nextRunTime={} msg={}",
                    job.getName(), job.getId(), job.getRetryCount(), job.getMaxRetries(),
                    job.getNextRunTime(), execution.getErrorMessage());
        } else {
            job.setStatus(JobStatus.FAILED);
            job.setNextRunTime(null);
            log.error("recur4j job failed permanently name={} id={} maxRetries={} msg={}",
                    job.getName(), job.getId(), job.getMaxRetries(), execution.getErrorMessage());
        }
    }

    private Instant nextRunOrNull(Job job, Instant from) {
        try {
            return TriggerCalculator.nextRunTime(job, from, zone);
        } catch (InvalidRecurrenceException e) {
            log.error("recur4j cannot compute next run name={} id={} msg={}", job.getName(), job.getId(), e.getMessage());
            return null;
        }
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getName() : msg;
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
