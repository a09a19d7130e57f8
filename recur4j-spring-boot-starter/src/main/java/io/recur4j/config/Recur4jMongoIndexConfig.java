package io.recur4j.config;

import io.recur4j.internal.mongo.JobDocument;
import io.recur4j.internal.mongo.JobExecutionDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.List;

/**
 * MongoDB index definitions for the recur4j collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code recur4j.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Collection {@code jobs}</h3>
 * <ul>
 *   <li><b>idx_active</b>: { active: 1 }
 *       <br/>Used when restoring triggers on startup.</li>
 *   <li><b>idx_listing</b>: { priority: -1, createdAt: -1 }
 *       <br/>Default listing order.</li>
 *   <li><b>idx_status</b>, <b>idx_job_type</b>, <b>idx_created_by</b>
 *       <br/>Listing filters.</li>
 * </ul>
 *
 * <h3>Collection {@code job_executions}</h3>
 * <ul>
 *   <li><b>idx_job_started</b>: { jobId: 1, startedAt: -1 }
 *       <br/>Execution history per job and cascade delete.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ active: 1 }, { name: "idx_active" });
 * db.jobs.createIndex({ priority: -1, createdAt: -1 }, { name: "idx_listing" });
 * db.jobs.createIndex({ status: 1 }, { name: "idx_status" });
 * db.jobs.createIndex({ jobType: 1 }, { name: "idx_job_type" });
 * db.jobs.createIndex({ createdBy: 1 }, { name: "idx_created_by" });
 * db.job_executions.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_started" });
 * </pre>
 */
public class Recur4jMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(Recur4jMongoIndexConfig.class);

    public static final String IDX_ACTIVE = "idx_active";
    public static final String IDX_LISTING = "idx_listing";
    public static final String IDX_STATUS = "idx_status";
    public static final String IDX_JOB_TYPE = "idx_job_type";
    public static final String IDX_CREATED_BY = "idx_created_by";
    public static final String IDX_JOB_STARTED = "idx_job_started";

    private final MongoTemplate mongoTemplate;

    public Recur4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create every index listed above. Existing indexes with the same definition are kept.
     */
    public void ensureIndexes() {
        for (Index index : jobIndexes()) {
            mongoTemplate.indexOps(JobDocument.class).ensureIndex(index);
        }
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobStartedIndex());
        log.info("recur4j mongo indexes ensured jobs={} executions=1", jobIndexes().size());
    }

    public static List<Index> jobIndexes() {
        return List.of(
                new Index().on("active", Sort.Direction.ASC).named(IDX_ACTIVE),
                listingIndex(),
                new Index().on("status", Sort.Direction.ASC).named(IDX_STATUS),
                new Index().on("jobType", Sort.Direction.ASC).named(IDX_JOB_TYPE),
                new Index().on("createdBy", Sort.Direction.ASC).named(IDX_CREATED_BY)
        );
    }

    /**
     * Keys: priority DESC, createdAt DESC
     */
    public static Index listingIndex() {
        return new Index()
                .on("priority", Sort.Direction.DESC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_LISTING);
    }

    /**
     * Keys: jobId ASC, startedAt DESC
     */
    public static Index jobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }
}
