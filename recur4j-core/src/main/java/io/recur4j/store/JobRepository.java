package io.recur4j.store;

import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.Page;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for jobs and their executions.
 *
 * <p>Implementations hand out copies: a loaded {@link Job} is detached from storage until
 * passed back to a save method. Every failure is reported as
 * {@link io.recur4j.exception.JobStoreException}.
 */
public interface JobRepository {

    Optional<Job> findJob(String jobId);

    /**
     * Matching jobs, ordered by priority descending then createdAt descending.
     */
    Page<Job> listJobs(JobQuery query, int page, int pageSize);

    /**
     * Active jobs regardless of status, used to rebuild the trigger set on startup.
     */
    List<Job> findActiveJobs();

    /**
     * Insert or replace the job with the same id.
     */
    Job saveJob(Job job);

    /**
     * Delete the job and all of its executions as one unit.
     *
     * @return false if no job had this id
     */
    boolean deleteJob(String jobId);

    JobExecution saveExecution(JobExecution execution);

    /**
     * Persist the outcome of one run: the updated job and its execution row, as one unit.
     */
    void saveRun(Job job, JobExecution execution);

    /**
     * Executions of one job, newest first.
     */
    Page<JobExecution> listExecutions(String jobId, int page, int pageSize);
}
