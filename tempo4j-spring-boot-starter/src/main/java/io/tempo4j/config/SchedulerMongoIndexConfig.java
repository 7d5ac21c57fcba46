package io.tempo4j.config;

import io.tempo4j.internal.mongo.JobDocument;
import io.tempo4j.internal.mongo.JobExecutionDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the scheduler collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code tempo.ensure-indexes-on-startup=true}. In production they are usually managed by migrations or ops
 * scripts. Job name uniqueness depends on {@code ux_job_name}; without it duplicate names are only caught by
 * the scheduler's own lookup.
 *
 * <h3>Collection {@code scheduled_jobs}</h3>
 * <ul>
 *   <li><b>ux_job_name</b>: { name: 1 }, unique</li>
 *   <li><b>idx_active_next</b>: { status: 1, nextExecution: 1 }
 *       <br/>Used by every poll tick to load active jobs.</li>
 * </ul>
 *
 * <h3>Collection {@code job_executions}</h3>
 * <ul>
 *   <li><b>idx_job_created</b>: { jobId: 1, createdAt: -1 } (history listing)</li>
 *   <li><b>idx_exec_status</b>: { status: 1 } (startup reconciliation, statistics)</li>
 *   <li><b>idx_completed_at</b>: { completedAt: 1 } (history cleanup)</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ name: 1 }, { name: "ux_job_name", unique: true });
 * db.scheduled_jobs.createIndex({ status: 1, nextExecution: 1 }, { name: "idx_active_next" });
 * db.job_executions.createIndex({ jobId: 1, createdAt: -1 }, { name: "idx_job_created" });
 * db.job_executions.createIndex({ status: 1 }, { name: "idx_exec_status" });
 * db.job_executions.createIndex({ completedAt: 1 }, { name: "idx_completed_at" });
 * </pre>
 */
public class SchedulerMongoIndexConfig {

    public static final String UX_JOB_NAME = "ux_job_name";
    public static final String IDX_ACTIVE_NEXT = "idx_active_next";
    public static final String IDX_JOB_CREATED = "idx_job_created";
    public static final String IDX_EXEC_STATUS = "idx_exec_status";
    public static final String IDX_COMPLETED_AT = "idx_completed_at";

    private final MongoTemplate mongoTemplate;

    public SchedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobNameUniqueIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(activeNextIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobCreatedIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(executionStatusIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(completedAtIndex());
    }

    public static Index jobNameUniqueIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .named(UX_JOB_NAME);
    }

    public static Index activeNextIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextExecution", Sort.Direction.ASC)
                .named(IDX_ACTIVE_NEXT);
    }

    public static Index jobCreatedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_JOB_CREATED);
    }

    public static Index executionStatusIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .named(IDX_EXEC_STATUS);
    }

    public static Index completedAtIndex() {
        return new Index()
                .on("completedAt", Sort.Direction.ASC)
                .named(IDX_COMPLETED_AT);
    }
}
