package io.recur4j.store;

import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.Page;
import io.recur4j.exception.JobStoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Heap-backed repository. One lock guards both maps so that multi-row writes are atomic.
 */
public class InMemoryJobRepository implements JobRepository {

    static final Comparator<Job> LISTING_ORDER = Comparator
            .<Job>comparingInt(Job::getPriority).reversed()
            .thenComparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    static final Comparator<JobExecution> NEWEST_FIRST = Comparator
            .<JobExecution, Instant>comparing(JobExecution::getStartedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Job> jobs = new HashMap<>();
    private final Map<String, JobExecution> executions = new LinkedHashMap<>();

    @Override
    public Optional<Job> findJob(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Page<Job> listJobs(JobQuery query, int page, int pageSize) {
        JobQuery q = query != null ? query : JobQuery.all();
        List<Job> matched = new ArrayList<>();
        lock.lock();
        try {
            for (Job job : jobs.values()) {
                if (q.matches(job)) {
                    matched.add(job.copy());
                }
            }
        } finally {
            lock.unlock();
        }
        matched.sort(LISTING_ORDER);
        return Page.of(matched, page, pageSize);
    }

    @Override
    public List<Job> findActiveJobs() {
        List<Job> active = new ArrayList<>();
        lock.lock();
        try {
            for (Job job : jobs.values()) {
                if (job.isActive()) {
                    active.add(job.copy());
                }
            }
        } finally {
            lock.unlock();
        }
        return active;
    }

    @Override
    public Job saveJob(Job job) {
        requireId(job);
        lock.lock();
        try {
            jobs.put(job.getId(), job.copy());
        } finally {
            lock.unlock();
        }
        return job;
    }

    @Override
    public boolean deleteJob(String jobId) {
        lock.lock();
        try {
            if (jobs.remove(jobId) == null) {
                return false;
            }
            executions.values().removeIf(e -> jobId.equals(e.getJobId()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public JobExecution saveExecution(JobExecution execution) {
        requireId(execution);
        lock.lock();
        try {
            if (!jobs.containsKey(execution.getJobId())) {
                throw new JobStoreException("Cannot save execution for missing job id=" + execution.getJobId());
            }
            executions.put(execution.getId(), execution.copy());
        } finally {
            lock.unlock();
        }
        return execution;
    }

    @Override
    public void saveRun(Job job, JobExecution execution) {
        requireId(job);
        requireId(execution);
        if (!job.getId().equals(execution.getJobId())) {
            throw new JobStoreException("Execution " + execution.getId() + " does not belong to job " + job.getId());
        }
        lock.lock();
        try {
            jobs.put(job.getId(), job.copy());
            executions.put(execution.getId(), execution.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Page<JobExecution> listExecutions(String jobId, int page, int pageSize) {
        List<JobExecution> matched = new ArrayList<>();
        lock.lock();
        try {
            for (JobExecution e : executions.values()) {
                if (Objects.equals(jobId, e.getJobId())) {
                    matched.add(e.copy());
                }
            }
        } finally {
            lock.unlock();
        }
        matched.sort(NEWEST_FIRST);
        return Page.of(matched, page, pageSize);
    }

    private static void requireId(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.getId() == null || job.getId().isBlank()) {
            throw new JobStoreException("Job id must be assigned before saving");
        }
    }

    private static void requireId(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        if (execution.getId() == null || execution.getJobId() == null) {
            throw new JobStoreException("Execution id and jobId must be assigned before saving");
        }
    }
}
