package io.guildcron.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.guildcron.SchedulerStore;
import io.guildcron.core.AnnouncementConfig;
import io.guildcron.core.Cadence;
import io.guildcron.core.ReminderJob;
import io.guildcron.core.StoreException;
import io.guildcron.core.ValidationException;
import io.guildcron.utils.CronExpressionBuilder;
import io.guildcron.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for reminders and announcement configs.
 *
 * <p>Semantics:
 * <ul>
 *   <li>reminders are soft-deleted ({@code active=false}); only active ones are loaded or returned</li>
 *   <li>one {@code event_configs} document per tenant, upserted by {@code tenantId}</li>
 *   <li>recurring {@code nextTriggerAt} is bookkeeping, recomputed in the reminder timezone</li>
 * </ul>
 * Every Spring {@link DataAccessException} is rethrown as {@link StoreException}.
 */
public class MongoSchedulerStore implements SchedulerStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSchedulerStore.class);

    private final MongoTemplate mongoTemplate;
    private final ZoneId reminderZone;
    private final Clock clock;

    public MongoSchedulerStore(MongoTemplate mongoTemplate, ZoneId reminderZone, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.reminderZone = Objects.requireNonNull(reminderZone, "reminderZone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public MongoSchedulerStore(MongoTemplate mongoTemplate, ZoneId reminderZone) {
        this(mongoTemplate, reminderZone, Clock.systemUTC());
    }

    /* ================= scheduler port ================= */

    @Override
    public List<ReminderJob> loadActiveReminders() {
        List<ReminderDocument> docs = execute("load active reminders", () ->
                mongoTemplate.find(new Query(Criteria.where("active").is(true)), ReminderDocument.class));

        List<ReminderJob> jobs = new ArrayList<>(docs.size());
        for (ReminderDocument doc : docs) {
            try {
                jobs.add(toJob(doc));
            } catch (ValidationException e) {
                log.warn("guildcron skipping unreadable reminder id={} tenant={} msg={}",
                        doc.getId(), doc.getTenantId(), e.getMessage());
            }
        }
        return jobs;
    }

    @Override
    public List<AnnouncementConfig> loadEnabledAnnouncementConfigs() {
        List<EventConfigDocument> docs = execute("load enabled announcement configs", () ->
                mongoTemplate.find(new Query(Criteria.where("enabled").is(true)), EventConfigDocument.class));
        return docs.stream().map(MongoSchedulerStore::toConfig).toList();
    }

    @Override
    public Optional<ReminderJob> getReminder(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ReminderDocument doc = execute("get reminder", () -> mongoTemplate.findOne(
                new Query(Criteria.where("_id").is(id).and("active").is(true)), ReminderDocument.class));
        return Optional.ofNullable(doc).map(MongoSchedulerStore::toJob);
    }

    @Override
    public Optional<AnnouncementConfig> getAnnouncementConfig(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        EventConfigDocument doc = execute("get announcement config", () -> mongoTemplate.findOne(
                byTenant(tenantId), EventConfigDocument.class));
        return Optional.ofNullable(doc).map(MongoSchedulerStore::toConfig);
    }

    /**
     * Soft delete, scoped to the owning tenant.
     */
    @Override
    public void deleteReminder(String id, String tenantId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("tenantId").is(tenantId));
        UpdateResult r = execute("delete reminder", () ->
                mongoTemplate.updateFirst(q, new Update().set("active", false), ReminderDocument.class));
        if (r.getMatchedCount() == 0) {
            log.warn("guildcron reminder to delete not found id={} tenant={}", id, tenantId);
        }
    }

    @Override
    public void markAnnounced(String tenantId, Instant announcedAt) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(announcedAt, "announcedAt must not be null");

        Update u = new Update()
                .set("lastAnnouncedAt", announcedAt)
                .set("updatedAt", clock.instant());
        execute("mark announced", () -> mongoTemplate.updateFirst(byTenant(tenantId), u, EventConfigDocument.class));
    }

    /**
     * Recompute {@code nextTriggerAt} for a recurring reminder. A one-time reminder has no next
     * occurrence and is deactivated instead.
     */
    @Override
    public void advanceRecurrence(String id) {
        Objects.requireNonNull(id, "id must not be null");

        ReminderDocument doc = execute("load reminder for recurrence", () ->
                mongoTemplate.findById(id, ReminderDocument.class));
        if (doc == null) {
            return;
        }

        ReminderJob job = toJob(doc);
        Update u = new Update();
        if (!job.cadence().isRecurring()) {
            u.set("active", false);
        } else {
            u.set("nextTriggerAt", nextOccurrence(job, clock.instant()));
        }
        execute("advance recurrence", () ->
                mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(id)), u, ReminderDocument.class));
    }

    /* ================= command side ================= */

    /**
     * Insert a new active reminder. Recurring reminders without {@code nextTriggerAt} get their first
     * occurrence computed.
     *
     * @return the stored reminder, carrying its generated id
     */
    public ReminderJob saveReminder(ReminderJob job) {
        Objects.requireNonNull(job, "job must not be null");

        ReminderDocument doc = toDocument(job);
        if (doc.getId() == null) {
            // validate needs an id; the generated one is assigned on insert
            withId(job, "pending").validate();
        } else {
            job.validate();
        }

        if (job.cadence().isRecurring() && doc.getNextTriggerAt() == null) {
            doc.setNextTriggerAt(nextOccurrence(job, clock.instant()));
        }
        doc.setActive(true);
        doc.setCreatedAt(clock.instant());

        ReminderDocument saved = execute("save reminder", () -> mongoTemplate.insert(doc));
        log.info("guildcron reminder stored id={} tenant={} cadence={} nextTriggerAt={}",
                saved.getId(), saved.getTenantId(), saved.getCadence(), saved.getNextTriggerAt());
        return toJob(saved);
    }

    /**
     * Create or update the tenant's announcement config. Schedule fields left {@code null} keep their
     * stored value, or take the defaults (Monday 12:00 America/Los_Angeles, enabled) on creation.
     */
    public AnnouncementConfig upsertAnnouncementConfig(String tenantId, String channelId, String location,
                                                       Integer scheduleDay, Integer scheduleHour,
                                                       Integer scheduleMinute, String timezone) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(channelId, "channelId must not be null");
        Objects.requireNonNull(location, "location must not be null");

        CronExpressionBuilder.buildWeekly(
                scheduleMinute == null ? AnnouncementConfig.DEFAULT_MINUTE : scheduleMinute,
                scheduleHour == null ? AnnouncementConfig.DEFAULT_HOUR : scheduleHour,
                scheduleDay == null ? AnnouncementConfig.DEFAULT_DAY : scheduleDay);
        if (timezone != null) {
            CronExpressionBuilder.requireZone(timezone);
        }

        Instant now = clock.instant();
        Update u = new Update()
                .set("tenantId", tenantId)
                .set("channelId", channelId)
                .set("location", location)
                .set("updatedAt", now)
                .setOnInsert("enabled", true)
                .setOnInsert("createdAt", now);
        setOrDefault(u, "scheduleDay", scheduleDay, AnnouncementConfig.DEFAULT_DAY);
        setOrDefault(u, "scheduleHour", scheduleHour, AnnouncementConfig.DEFAULT_HOUR);
        setOrDefault(u, "scheduleMinute", scheduleMinute, AnnouncementConfig.DEFAULT_MINUTE);
        setOrDefault(u, "timezone", timezone, AnnouncementConfig.DEFAULT_TIMEZONE);

        EventConfigDocument doc = execute("upsert announcement config", () -> mongoTemplate.findAndModify(
                byTenant(tenantId), u, FindAndModifyOptions.options().upsert(true).returnNew(true),
                EventConfigDocument.class));

        log.info("guildcron announcement config stored tenant={} location={} day={} time={}:{} timezone={}",
                tenantId, location, doc.getScheduleDay(), doc.getScheduleHour(), doc.getScheduleMinute(),
                doc.getTimezone());
        return toConfig(doc);
    }

    /**
     * @return false if the tenant has no config
     */
    public boolean setAnnouncementEnabled(String tenantId, boolean enabled) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Update u = new Update()
                .set("enabled", enabled)
                .set("updatedAt", clock.instant());
        UpdateResult r = execute("set announcement enabled", () ->
                mongoTemplate.updateFirst(byTenant(tenantId), u, EventConfigDocument.class));
        return r.getMatchedCount() > 0;
    }

    /* ================= mapping ================= */

    static ReminderJob toJob(ReminderDocument doc) {
        return new ReminderJob(
                doc.getId(),
                doc.getTenantId(),
                doc.getChannelId(),
                doc.getUserId(),
                doc.getMessage(),
                Cadence.fromValue(doc.getCadence()),
                doc.getHour(),
                doc.getMinute(),
                doc.getDayOfWeek(),
                doc.getDayOfMonth(),
                doc.getMonth(),
                doc.getNextTriggerAt()
        );
    }

    static ReminderDocument toDocument(ReminderJob job) {
        ReminderDocument doc = new ReminderDocument();
        doc.setId(job.id());
        doc.setTenantId(job.tenantId());
        doc.setChannelId(job.channelId());
        doc.setUserId(job.userId());
        doc.setMessage(job.message());
        doc.setCadence(job.cadence() == null ? null : job.cadence().value());
        doc.setHour(job.hour());
        doc.setMinute(job.minute());
        doc.setDayOfWeek(job.dayOfWeek());
        doc.setDayOfMonth(job.dayOfMonth());
        doc.setMonth(job.month());
        doc.setNextTriggerAt(job.nextTriggerAt());
        return doc;
    }

    static AnnouncementConfig toConfig(EventConfigDocument doc) {
        return new AnnouncementConfig(
                doc.getTenantId(),
                doc.getChannelId(),
                doc.getLocation(),
                doc.getScheduleDay(),
                doc.getScheduleHour(),
                doc.getScheduleMinute(),
                doc.getTimezone(),
                doc.isEnabled(),
                doc.getLastAnnouncedAt()
        );
    }

    /* ================= helper ================= */

    private Instant nextOccurrence(ReminderJob job, Instant after) {
        return CronSchedules.nextFireTime(CronExpressionBuilder.forReminder(job), reminderZone, after);
    }

    private static ReminderJob withId(ReminderJob job, String id) {
        return new ReminderJob(id, job.tenantId(), job.channelId(), job.userId(), job.message(), job.cadence(),
                job.hour(), job.minute(), job.dayOfWeek(), job.dayOfMonth(), job.month(), job.nextTriggerAt());
    }

    private static Query byTenant(String tenantId) {
        return new Query(Criteria.where("tenantId").is(tenantId));
    }

    private static void setOrDefault(Update u, String field, Object value, Object defaultValue) {
        if (value != null) {
            u.set(field, value);
        } else {
            u.setOnInsert(field, defaultValue);
        }
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
