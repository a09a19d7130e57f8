package io.recur4j;

import io.recur4j.core.Job;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.JobUpdate;
import io.recur4j.core.Page;

/**
 * Main scheduler API.
 *
 * <p>Every mutation is validated, persisted, and then reflected in the armed trigger set,
 * in that order. A failed write never changes what is armed.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Job job = jobService.create("nightly-backup")
 *         .type(JobType.BACKUP_TASK)
 *         .cron("0 2 * * *")
 *         .payload(Map.of("source", "/data"))
 *         .save();
 *
 * jobService.pauseJob(job.getId());
 * jobService.resumeJob(job.getId());
 * jobService.deleteJob(job.getId());
 * }</pre>
 *
 * @see io.recur4j.exception.JobValidationException
 * @see io.recur4j.exception.JobNotFoundException
 * @see io.recur4j.exception.JobStoreException
 */
public interface JobService {

    /**
     * Validate, persist and arm a new job.
     *
     * @throws io.recur4j.exception.JobValidationException if a field is invalid
     * @throws io.recur4j.exception.InvalidJobConfigurationException if the job could not be stored
     */
    Job createJob(JobDefinition definition);

    /**
     * Start a fluent builder. Nothing is persisted until {@link JobBuilder#save()}.
     */
    JobBuilder create(String name);

    /**
     * @throws io.recur4j.exception.JobNotFoundException if no job has this id
     */
    Job getJob(String jobId);

    /**
     * Jobs matching the query, ordered by priority descending then creation time descending.
     */
    Page<Job> listJobs(JobQuery query, int page, int pageSize);

    Job updateJob(String jobId, JobUpdate update);

    Job pauseJob(String jobId);

    Job resumeJob(String jobId);

    /**
     * Delete the job and all of its executions.
     */
    void deleteJob(String jobId);

    /**
     * Executions of one job, newest first.
     */
    Page<JobExecution> listExecutions(String jobId, int page, int pageSize);
}
