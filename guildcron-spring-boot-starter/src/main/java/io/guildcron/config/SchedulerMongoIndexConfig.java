package io.guildcron.config;

import io.guildcron.internal.mongo.EventConfigDocument;
import io.guildcron.internal.mongo.ReminderDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the scheduler store.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code guildcron.ensure-indexes-on-startup=true};
 * in production they usually come from migrations.
 *
 * <h3>Collection {@code reminders}</h3>
 * <ul>
 *   <li><b>idx_active_tenant</b>: { active: 1, tenantId: 1 }
 *       <br/>Startup load of active reminders and tenant-scoped deletes.</li>
 * </ul>
 *
 * <h3>Collection {@code event_configs}</h3>
 * <ul>
 *   <li><b>ux_tenant</b> (unique): { tenantId: 1 }
 *       <br/>One announcement config per tenant; upserts rely on it.</li>
 *   <li><b>idx_enabled</b>: { enabled: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.reminders.createIndex({ active: 1, tenantId: 1 }, { name: "idx_active_tenant" });
 * db.event_configs.createIndex({ tenantId: 1 }, { name: "ux_tenant", unique: true });
 * db.event_configs.createIndex({ enabled: 1 }, { name: "idx_enabled" });
 * </pre>
 */
public class SchedulerMongoIndexConfig {

    public static final String IDX_ACTIVE_TENANT = "idx_active_tenant";
    public static final String UX_TENANT = "ux_tenant";
    public static final String IDX_ENABLED = "idx_enabled";

    private final MongoTemplate mongoTemplate;

    public SchedulerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ReminderDocument.class).ensureIndex(activeTenantIndex());
        mongoTemplate.indexOps(EventConfigDocument.class).ensureIndex(tenantUniqueIndex());
        mongoTemplate.indexOps(EventConfigDocument.class).ensureIndex(enabledIndex());
    }

    public static Index activeTenantIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("tenantId", Sort.Direction.ASC)
                .named(IDX_ACTIVE_TENANT);
    }

    public static Index tenantUniqueIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .unique()
                .named(UX_TENANT);
    }

    public static Index enabledIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_ENABLED);
    }
}
