package io.autopilot4j.config;

import io.autopilot4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the Autopilot module.
 *
 * <p><b>Important:</b> This module does <b>NOT</b> automatically create indexes at application startup
 * unless {@code autopilot.ensure-indexes-on-startup=true}. In production, indexes are usually managed by
 * DB migrations / ops scripts (e.g., Compass, mongosh, CI/CD).
 *
 * <h3>Required indexes (collection: {@code jobs})</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { status: 1, priority: -1, createdAt: 1 }
 *       <br/>Used by workers claiming the best pending job.</li>
 *   <li><b>idx_reclaim</b>: { status: 1, processedAt: 1 }
 *       <br/>Used by the stale-job sweep.</li>
 *   <li><b>idx_type_status</b>: { type: 1, status: 1 }
 *       <br/>Used by job listings and counts per type.</li>
 * </ul>
 *
 * <p>{@code daily_schedules} and {@code settings} are only accessed by {@code _id}.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ status: 1, priority: -1, createdAt: 1 }, { name: "idx_claim" });
 * db.jobs.createIndex({ status: 1, processedAt: 1 }, { name: "idx_reclaim" });
 * db.jobs.createIndex({ type: 1, status: 1 }, { name: "idx_type_status" });
 * </pre>
 */
public class AutopilotMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_RECLAIM = "idx_reclaim";
    public static final String IDX_TYPE_STATUS = "idx_type_status";

    private final MongoTemplate mongoTemplate;

    public AutopilotMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure required indexes for Autopilot.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(claimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(reclaimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(typeStatusIndex());
    }

    /**
     * Keys: status ASC, priority DESC, createdAt ASC
     */
    public static Index claimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    /**
     * Keys: status ASC, processedAt ASC
     */
    public static Index reclaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("processedAt", Sort.Direction.ASC)
                .named(IDX_RECLAIM);
    }

    public static Index typeStatusIndex() {
        return new Index()
                .on("type", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_TYPE_STATUS);
    }
}
