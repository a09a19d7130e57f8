package io.recur4j.engine;

import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.Job;
import io.recur4j.core.JobStatus;
import io.recur4j.exception.InvalidRecurrenceException;
import io.recur4j.exception.SchedulerDispatchException;
import io.recur4j.store.JobRepository;
import io.recur4j.utils.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the armed trigger set and turns due triggers into executor runs.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One armed trigger per active job with a next run time</li>
 *   <li>A single dispatcher thread that never blocks on execution</li>
 *   <li>A bounded worker pool with at most one run in flight per job</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * engine.start();
 * engine.scheduleJob(job);
 * engine.removeJob(job.getId());
 * engine.stop();
 * }</pre>
 *
 * <p>Triggers may be armed before {@link #start()}; they fire once the dispatcher runs.
 * Callers mutating a job hold its {@link JobLocks} stripe while calling
 * {@link #scheduleJob(Job)} or {@link #removeJob(String)}.
 */
public class SchedulerEngine {
    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    private final Recur4jProperties props;
    private final JobRepository repository;
    private final JobExecutor executor;
    private final JobLocks locks;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong generations = new AtomicLong();

    private final DelayQueue<ArmedTrigger> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, ArmedTrigger> armed = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private ExecutorService workerPool;
    private Thread dispatcherThread;

    private static final class ArmedTrigger implements Delayed {
        private final String jobId;
        private final Instant fireAt;
        private final long generation;

        private ArmedTrigger(String jobId, Instant fireAt, long generation) {
            this.jobId = jobId;
            this.fireAt = fireAt;
            this.generation = generation;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof ArmedTrigger o) {
                int c = this.fireAt.compareTo(o.fireAt);
                return c != 0 ? c : Long.compare(this.generation, o.generation);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    public SchedulerEngine(Recur4jProperties props, JobRepository repository, JobExecutor executor, JobLocks locks, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the worker pool and dispatcher, restoring persisted triggers first when configured.
     * Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        if (props.getMaxConcurrency() <= 0) {
            started.set(false);
            throw new IllegalArgumentException("recur4j.maxConcurrency must be positive");
        }
        Duration shutdownTimeout = Objects.requireNonNull(props.getShutdownTimeout(), "recur4j.shutdownTimeout must not be null");
        if (shutdownTimeout.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("recur4j.shutdownTimeout must not be negative");
        }

        log.info("recur4j engine starting workerId={} maxConcurrency={} restoreOnStartup={} timezone={}",
                executor.getWorkerId(),
                props.getMaxConcurrency(),
                props.isRestoreOnStartup(),
                props.getTimezone());

        if (props.isRestoreOnStartup()) {
            try {
                restore();
            } catch (RuntimeException e) {
                started.set(false);
                throw e;
            }
        }

        if (workerPool == null) {
            AtomicInteger seq = new AtomicInteger();
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("recur4j.worker-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("recur4j.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("recur4j engine started armed={}", armed.size());
    }

    /**
     * Stop dispatching, wait up to the shutdown timeout for in-flight runs, then force
     * shutdown. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("recur4j engine stopping inFlight={}", inFlight.size());

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("recur4j engine forcing shutdown inFlight={}", inFlight.size());
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        queue.clear();
        armed.clear();
        log.info("recur4j engine stopped.");
    }

    public boolean isStarted() {
        return started.get();
    }

    /* ================= trigger set ================= */

    /**
     * Arm (or re-arm) the job at its next run time, replacing any trigger it already has.
     *
     * @return false if the job is inactive or has no next run time; nothing is armed then
     */
    public boolean scheduleJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String jobId = Objects.requireNonNull(job.getId(), "job id must not be null");

        if (!job.isActive() || job.getNextRunTime() == null) {
            log.warn("recur4j job not schedulable, not arming name={} id={} active={} nextRunTime={}",
                    job.getName(), jobId, job.isActive(), job.getNextRunTime());
            return false;
        }

        ArmedTrigger trigger = new ArmedTrigger(jobId, job.getNextRunTime(), generations.incrementAndGet());
        ArmedTrigger previous = armed.put(jobId, trigger);
        if (previous != null) {
            queue.remove(previous);
        }
        queue.offer(trigger);

        log.debug("recur4j job armed name={} id={} fireAt={} replaced={}",
                job.getName(), jobId, trigger.fireAt, previous != null);
        return true;
    }

    public boolean rescheduleJob(Job job) {
        return scheduleJob(job);
    }

    /**
     * Disarm the job. Idempotent; a run already in flight is not affected.
     */
    public void removeJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        ArmedTrigger previous = armed.remove(jobId);
        if (previous != null) {
            queue.remove(previous);
            log.debug("recur4j job disarmed id={}", jobId);
        }
    }

    public Set<String> armedJobIds() {
        return Set.copyOf(armed.keySet());
    }

    public Optional<Instant> nextFireTime(String jobId) {
        ArmedTrigger t = armed.get(jobId);
        return t == null ? Optional.empty() : Optional.of(t.fireAt);
    }

    public boolean isArmed(String jobId) {
        return armed.containsKey(jobId);
    }

    public boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    /* ================= dispatch ================= */

    /**
     * Submit one run of the job to the worker pool without waiting for it.
     *
     * @return false if a run of this job is already in flight (the firing is coalesced) or
     *         the pool no longer accepts work
     * @throws IllegalStateException if the engine is not started
     */
    public boolean dispatch(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        ExecutorService pool = workerPool;
        if (!started.get() || pool == null) {
            throw new IllegalStateException("recur4j engine is not started");
        }

        if (!inFlight.add(jobId)) {
            log.warn("recur4j job already in flight, coalescing firing id={}", jobId);
            return false;
        }

        try {
            pool.submit(() -> runJob(jobId));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            log.warn("recur4j worker pool rejected job id={} msg={}", jobId, e.getMessage());
            return false;
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                ArmedTrigger trigger = queue.take();

                if (!armed.remove(trigger.jobId, trigger)) {
                    log.debug("recur4j stale trigger skipped id={} generation={}", trigger.jobId, trigger.generation);
                    continue;
                }
                dispatch(trigger.jobId);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("recur4j dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void runJob(String jobId) {
        try {
            boolean active = locks.withLock(jobId, () -> repository.findJob(jobId).map(Job::isActive).orElse(false));
            if (!active) {
                log.warn("recur4j job not found or inactive, skipping fire id={}", jobId);
                return;
            }
            executor.execute(jobId);
        } catch (Exception e) {
            handleDispatchFailure(jobId, e);
        } finally {
            inFlight.remove(jobId);
            rearm(jobId);
        }
    }

    private void handleDispatchFailure(String jobId, Exception cause) {
        SchedulerDispatchException failure = new SchedulerDispatchException(jobId,
                "Dispatch failed for job " + jobId + ": " + cause.getMessage(), cause);
        log.error("recur4j dispatch failed id={} msg={}", jobId, failure.getMessage(), failure);

        try {
            locks.withLock(jobId, () -> {
                Optional<Job> found = repository.findJob(jobId);
                if (found.isEmpty()) {
                    return;
                }
                Job job = found.get();
                Instant now = clock.instant();
                job.setStatus(job.isActive() ? JobStatus.FAILED : JobStatus.PAUSED);
                job.setFailedRuns(job.getFailedRuns() + 1);
                job.setNextRunTime(job.isActive() ? nextRunOrNull(job, now) : null);
                job.setUpdatedAt(now);
                repository.saveJob(job);
            });
        } catch (Exception storeEx) {
            log.error("recur4j markDispatchFailure failed id={} msg={}", jobId, storeEx.getMessage(), storeEx);
        }
    }

    private void rearm(String jobId) {
        try {
            locks.withLock(jobId, () -> {
                Optional<Job> found = repository.findJob(jobId);
                if (found.isPresent() && found.get().isActive() && found.get().getNextRunTime() != null) {
                    scheduleJob(found.get());
                } else {
                    removeJob(jobId);
                }
            });
        } catch (Exception e) {
            log.error("recur4j rearm failed id={} msg={}", jobId, e.getMessage(), e);
        }
    }

    /* ================= restore ================= */

    private void restore() {
        List<Job> jobs = repository.findActiveJobs();
        int restored = 0;
        int recovered = 0;

        for (Job candidate : jobs) {
            String jobId = candidate.getId();
            int[] outcome = locks.withLock(jobId, () -> restoreOne(jobId));
            restored += outcome[0];
            recovered += outcome[1];
        }
        log.info("recur4j restored triggers active={} armed={} recovered={}", jobs.size(), restored, recovered);
    }

    // {armed, recovered}
    private int[] restoreOne(String jobId) {
        Optional<Job> found = repository.findJob(jobId);
        if (found.isEmpty() || !found.get().isActive()) {
            return new int[]{0, 0};
        }
        Job job = found.get();
        int recovered = 0;

        if (job.getStatus() == JobStatus.RUNNING) {
            // left running by a crash; its due time is still set, so it fires again
            job.setStatus(JobStatus.PENDING);
            job.setUpdatedAt(clock.instant());
            repository.saveJob(job);
            recovered = 1;
            log.warn("recur4j recovered interrupted job name={} id={} nextRunTime={}",
                    job.getName(), jobId, job.getNextRunTime());
        }

        if (job.getNextRunTime() == null) {
            return new int[]{0, recovered};
        }
        return new int[]{scheduleJob(job) ? 1 : 0, recovered};
    }

    private Instant nextRunOrNull(Job job, Instant from) {
        try {
            return TriggerCalculator.nextRunTime(job, from, props.zoneId());
        } catch (InvalidRecurrenceException e) {
            log.error("recur4j cannot compute next run name={} id={} msg={}", job.getName(), job.getId(), e.getMessage());
            return null;
        }
    }
}
