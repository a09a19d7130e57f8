package io.recur4j.internal.mongo;

import io.recur4j.core.Job;
import io.recur4j.core.JobExecution;
import io.recur4j.core.JobQuery;
import io.recur4j.core.Page;
import io.recur4j.exception.JobStoreException;
import io.recur4j.store.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for jobs and executions.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code jobs}: one document per job, keyed by job id</li>
 *   <li>{@code job_executions}: finished runs, referencing their job by {@code jobId}</li>
 * </ul>
 *
 * <p>Writes touching both collections ({@link #deleteJob(String)}, {@link #saveRun}) go through
 * the given {@link TransactionOperations}. Pass a {@code TransactionTemplate} over a
 * {@code MongoTransactionManager} (replica set required) for atomicity, or
 * {@link TransactionOperations#withoutTransaction()} on a standalone server.
 */
public class MongoJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(MongoJobRepository.class);

    private final MongoTemplate mongoTemplate;
    private final TransactionOperations transactions;

    public MongoJobRepository(MongoTemplate mongoTemplate) {
        this(mongoTemplate, TransactionOperations.withoutTransaction());
    }

    public MongoJobRepository(MongoTemplate mongoTemplate, TransactionOperations transactions) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return translate("findJob", () ->
                Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(JobDocument::toJob));
    }

    @Override
    public Page<Job> listJobs(JobQuery query, int page, int pageSize) {
        Query q = new Query(toCriteria(query != null ? query : JobQuery.all()));
        return translate("listJobs", () -> {
            long total = mongoTemplate.count(q, JobDocument.class);
            q.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.desc("createdAt")))
                    .skip((long) (page - 1) * pageSize)
                    .limit(pageSize);
            List<Job> items = mongoTemplate.find(q, JobDocument.class).stream()
                    .map(JobDocument::toJob)
                    .toList();
            return new Page<>(items, total, page, pageSize);
        });
    }

    @Override
    public List<Job> findActiveJobs() {
        Query q = new Query(Criteria.where("active").is(true));
        return translate("findActiveJobs", () -> mongoTemplate.find(q, JobDocument.class).stream()
                .map(JobDocument::toJob)
                .toList());
    }

    @Override
    public Job saveJob(Job job) {
        requireId(job);
        translate("saveJob", () -> mongoTemplate.save(JobDocument.from(job)));
        return job;
    }

    @Override
    public boolean deleteJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Boolean deleted = translate("deleteJob", () -> transactions.execute(status -> {
            long jobs = mongoTemplate.remove(byId(jobId), JobDocument.class).getDeletedCount();
            long executions = mongoTemplate.remove(byJobId(jobId), JobExecutionDocument.class).getDeletedCount();
            log.debug("recur4j mongo deleted job id={} jobs={} executions={}", jobId, jobs, executions);
            return jobs > 0;
        }));
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public JobExecution saveExecution(JobExecution execution) {
        requireId(execution);
        translate("saveExecution", () -> {
            if (!mongoTemplate.exists(byId(execution.getJobId()), JobDocument.class)) {
                throw new JobStoreException("Cannot save execution for missing job id=" + execution.getJobId());
            }
            return mongoTemplate.save(JobExecutionDocument.from(execution));
        });
        return execution;
    }

    @Override
    public void saveRun(Job job, JobExecution execution) {
        requireId(job);
        requireId(execution);
        if (!job.getId().equals(execution.getJobId())) {
            throw new JobStoreException("Execution " + execution.getId() + " does not belong to job " + job.getId());
        }
        translate("saveRun", () -> transactions.execute(status -> {
            mongoTemplate.save(JobDocument.from(job));
            return mongoTemplate.save(JobExecutionDocument.from(execution));
        }));
    }

    @Override
    public Page<JobExecution> listExecutions(String jobId, int page, int pageSize) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = byJobId(jobId);
        return translate("listExecutions", () -> {
            long total = mongoTemplate.count(q, JobExecutionDocument.class);
            q.with(Sort.by(Sort.Direction.DESC, "startedAt"))
                    .skip((long) (page - 1) * pageSize)
                    .limit(pageSize);
            List<JobExecution> items = mongoTemplate.find(q, JobExecutionDocument.class).stream()
                    .map(JobExecutionDocument::toExecution)
                    .toList();
            return new Page<>(items, total, page, pageSize);
        });
    }

    static Criteria toCriteria(JobQuery query) {
        Criteria c = new Criteria();
        if (query.status() != null) {
            c = c.and("status").is(query.status());
        }
        if (query.jobType() != null) {
            c = c.and("jobType").is(query.jobType());
        }
        if (query.createdBy() != null) {
            c = c.and("createdBy").is(query.createdBy());
        }
        if (query.active() != null) {
            c = c.and("active").is(query.active());
        }
        return c;
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Query byJobId(String jobId) {
        return new Query(Criteria.where("jobId").is(jobId));
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("recur4j mongo operation failed op={} msg={}", operation, e.getMessage(), e);
            throw new JobStoreException("Mongo " + operation + " failed: " + e.getMessage(), e);
        }
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
