package io.recur4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.JobBuilder;
import io.recur4j.JobService;
import io.recur4j.config.Recur4jProperties;
import io.recur4j.core.Job;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.JobStatus;
import io.recur4j.core.JobType;
import io.recur4j.core.JobUpdate;
import io.recur4j.core.Page;
import io.recur4j.engine.JobLocks;
import io.recur4j.engine.SchedulerEngine;
import io.recur4j.exception.InvalidJobConfigurationException;
import io.recur4j.exception.JobNotFoundException;
import io.recur4j.exception.JobStoreException;
import io.recur4j.store.JobRepository;
import io.recur4j.utils.TriggerCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link JobService} over a {@link JobRepository} and a {@link SchedulerEngine}.
 *
 * <p>Every mutation runs under the job's {@link JobLocks} stripe and persists before it touches
 * the trigger set, so a failed write leaves the armed triggers as they were.
 */
public class DefaultJobService implements JobService {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobService.class);

    private final Recur4jProperties props;
    private final JobRepository repository;
    private final SchedulerEngine engine;
    private final JobLocks locks;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultJobService(Recur4jProperties props,
                             JobRepository repository,
                             SchedulerEngine engine,
                             JobLocks locks,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Job createJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Job job = newJob(definition);
        String jobId = job.getId();

        return locks.withLock(jobId, () -> {
            try {
                repository.saveJob(job);
            } catch (JobStoreException e) {
                rollbackCreate(jobId, e);
                log.error("recur4j create failed name={} msg={}", job.getName(), e.getMessage(), e);
                throw new InvalidJobConfigurationException("Failed to create job: " + e.getMessage(), e);
            }

            if (job.isActive()) {
                engine.scheduleJob(job);
            }
            log.info("recur4j job created name={} id={} type={} nextRunTime={}",
                    job.getName(), jobId, job.getJobType().value(), job.getNextRunTime());
            return job.copy();
        });
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, objectMapper, this::createJob);
    }

    @Override
    public Job getJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return repository.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public Page<Job> listJobs(JobQuery query, int page, int pageSize) {
        JobValidator.pagination(page, pageSize, props.getMaxPageSize());
        return repository.listJobs(query != null ? query : JobQuery.all(), page, pageSize);
    }

    @Override
    public Job updateJob(String jobId, JobUpdate update) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(update, "update must not be null");

        return locks.withLock(jobId, () -> {
            Job job = getJob(jobId);
            boolean wasActive = job.isActive();
            int previousPriority = job.getPriority();

            applyUpdate(job, update);

            Instant now = clock.instant();
            boolean activeChanged = job.isActive() != wasActive;
            boolean recurrenceChanged = update.recurrenceChanged();

            if (activeChanged && !job.isActive()) {
                job.setStatus(JobStatus.PAUSED);
                job.setNextRunTime(null);
            } else if (activeChanged) {
                job.setStatus(JobStatus.PENDING);
                job.setNextRunTime(nextRunTime(job, now));
            } else if (recurrenceChanged && job.isActive()) {
                job.setNextRunTime(nextRunTime(job, now));
            }
            job.setUpdatedAt(now);

            repository.saveJob(job);

            if (!job.isActive()) {
                engine.removeJob(jobId);
            } else if (activeChanged || recurrenceChanged) {
                engine.rescheduleJob(job);
            } else if (job.getPriority() != previousPriority && engine.isArmed(jobId)) {
                engine.rescheduleJob(job);
            }

            log.info("recur4j job updated name={} id={} active={} nextRunTime={}",
                    job.getName(), jobId, job.isActive(), job.getNextRunTime());
            return job.copy();
        });
    }

    @Override
    public Job pauseJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return locks.withLock(jobId, () -> {
            Job job = getJob(jobId);
            job.setActive(false);
            job.setStatus(JobStatus.PAUSED);
            job.setNextRunTime(null);
            job.setUpdatedAt(clock.instant());

            repository.saveJob(job);
            engine.removeJob(jobId);

            log.info("recur4j job paused name={} id={}", job.getName(), jobId);
            return job.copy();
        });
    }

    @Override
    public Job resumeJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return locks.withLock(jobId, () -> {
            Job job = getJob(jobId);
            Instant now = clock.instant();
            job.setActive(true);
            job.setStatus(JobStatus.PENDING);
            job.setNextRunTime(nextRunTime(job, now));
            job.setUpdatedAt(now);

            repository.saveJob(job);
            engine.scheduleJob(job);

            log.info("recur4j job resumed name={} id={} nextRunTime={}", job.getName(), jobId, job.getNextRunTime());
            return job.copy();
        });
    }

    @Override
    public void deleteJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        locks.withLock(jobId, () -> {
            Job job = getJob(jobId);
            boolean wasArmed = engine.isArmed(jobId);

            engine.removeJob(jobId);
            try {
                repository.deleteJob(jobId);
            } catch (JobStoreException e) {
                if (wasArmed) {
                    engine.scheduleJob(job);
                }
                log.error("recur4j delete failed name={} id={} msg={}", job.getName(), jobId, e.getMessage(), e);
                throw e;
            }

            log.info("recur4j job deleted name={} id={}", job.getName(), jobId);
        });
    }

    @Override
    public Page<JobExecution> listExecutions(String jobId, int page, int pageSize) {
        JobValidator.pagination(page, pageSize, props.getMaxPageSize());
        getJob(jobId);
        return repository.listExecutions(jobId, page, pageSize);
    }

    private Job newJob(JobDefinition d) {
        String name = JobValidator.name(d.name());
        String cron = JobValidator.recurrence(d.cronExpression(), d.intervalSeconds());

        int maxRetries = d.maxRetries() != null ? d.maxRetries() : props.getDefaultMaxRetries();
        JobValidator.maxRetries(maxRetries);
        int timeout = d.timeoutSeconds() != null ? d.timeoutSeconds() : props.getDefaultTimeoutSeconds();
        JobValidator.timeout(timeout);
        int priority = d.priority() != null ? d.priority() : props.getDefaultPriority();
        JobValidator.priority(priority);

        Instant now = clock.instant();

        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setName(name);
        job.setDescription(d.description());
        job.setJobType(d.jobType() != null ? d.jobType() : JobType.CUSTOM);
        job.setCronExpression(cron);
        job.setIntervalSeconds(cron == null ? d.intervalSeconds() : null);
        job.setPayload(d.payload() != null ? new LinkedHashMap<>(d.payload()) : new LinkedHashMap<>());
        job.setMaxRetries(maxRetries);
        job.setTimeoutSeconds(timeout);
        job.setPriority(priority);
        job.setCreatedBy(d.createdBy() != null && !d.createdBy().isBlank() ? d.createdBy() : props.getDefaultCreatedBy());
        job.setActive(d.active() == null || d.active());
        job.setStatus(job.isActive() ? JobStatus.PENDING : JobStatus.PAUSED);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setNextRunTime(job.isActive() ? nextRunTime(job, now) : null);
        return job;
    }

    private void applyUpdate(Job job, JobUpdate u) {
        if (u.name() != null) {
            job.setName(JobValidator.name(u.name()));
        }
        if (u.description() != null) {
            job.setDescription(u.description());
        }
        if (u.recurrenceChanged()) {
            String cron = JobValidator.recurrence(u.cronExpression(), u.intervalSeconds());
            job.setCronExpression(cron);
            job.setIntervalSeconds(cron == null ? u.intervalSeconds() : null);
        }
        if (u.payload() != null) {
            job.setPayload(new LinkedHashMap<>(u.payload()));
        }
        if (u.maxRetries() != null) {
            JobValidator.maxRetries(u.maxRetries());
            job.setMaxRetries(u.maxRetries());
            job.setRetryCount(Math.min(job.getRetryCount(), u.maxRetries()));
        }
        if (u.timeoutSeconds() != null) {
            JobValidator.timeout(u.timeoutSeconds());
            job.setTimeoutSeconds(u.timeoutSeconds());
        }
        if (u.priority() != null) {
            JobValidator.priority(u.priority());
            job.setPriority(u.priority());
        }
        if (u.active() != null) {
            job.setActive(u.active());
        }
    }

    private Instant nextRunTime(Job job, Instant from) {
        return TriggerCalculator.nextRunTime(job, from, props.zoneId());
    }

    private void rollbackCreate(String jobId, JobStoreException cause) {
        try {
            repository.deleteJob(jobId);
        } catch (JobStoreException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }
}
