package io.guildcron.internal.mongo;

import com.mongodb.client.MongoClients;
import io.guildcron.EventDiscovery;
import io.guildcron.Notifier;
import io.guildcron.core.AnnouncementConfig;
import io.guildcron.core.AnnouncementPayload;
import io.guildcron.core.ReminderJob;
import io.guildcron.core.SchedulerSettings;
import io.guildcron.core.ValidationException;
import io.guildcron.internal.DefaultGuildScheduler;
import io.guildcron.internal.ScheduledExecutorJobTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoSchedulerStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Sunday
    private static final Instant NOW = Instant.parse("2026-01-04T00:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoSchedulerStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "guildcron_test");
        dropCollections();
        store = new MongoSchedulerStore(mongoTemplate, ZoneOffset.UTC, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dropCollections();
    }

    @Test
    void saveReminderShouldAssignIdAndComputeFirstOccurrence() {
        ReminderJob saved = store.saveReminder(
                ReminderJob.weekly(null, "guild-1", "chan-1", "user-1", "standup", 12, 0, 1));

        assertNotNull(saved.id());
        assertEquals(Instant.parse("2026-01-05T12:00:00Z"), saved.nextTriggerAt());
        assertEquals(Optional.of(saved), store.getReminder(saved.id()));
    }

    @Test
    void saveReminderShouldRejectBrokenCadence() {
        ReminderJob broken = new ReminderJob(null, "guild-1", "chan-1", "user-1", "m",
                io.guildcron.core.Cadence.MONTHLY, 9, 0, null, null, null, null);

        assertThrows(ValidationException.class, () -> store.saveReminder(broken));
        assertTrue(store.loadActiveReminders().isEmpty());
    }

    @Test
    void deleteReminderShouldSoftDeleteWithinTenantOnly() {
        ReminderJob saved = store.saveReminder(
                ReminderJob.once(null, "guild-1", "chan-1", "user-1", "dentist", 9, 0, NOW.plusSeconds(3600)));

        store.deleteReminder(saved.id(), "guild-other");
        assertTrue(store.getReminder(saved.id()).isPresent());

        store.deleteReminder(saved.id(), "guild-1");
        assertTrue(store.getReminder(saved.id()).isEmpty());
        assertTrue(store.loadActiveReminders().isEmpty());

        ReminderDocument doc = mongoTemplate.findById(saved.id(), ReminderDocument.class);
        assertNotNull(doc);
        assertFalse(doc.isActive());
    }

    @Test
    void advanceRecurrenceShouldMoveMonthlyReminderAndDeactivateOneTime() {
        ReminderJob monthly = store.saveReminder(
                ReminderJob.monthly(null, "guild-1", "chan-1", "user-1", "rent", 9, 0, 31));
        assertEquals(Instant.parse("2026-01-31T09:00:00Z"), monthly.nextTriggerAt());

        MongoSchedulerStore later = new MongoSchedulerStore(mongoTemplate, ZoneOffset.UTC,
                Clock.fixed(Instant.parse("2026-01-31T09:00:00Z"), ZoneOffset.UTC));
        later.advanceRecurrence(monthly.id());
        assertEquals(Instant.parse("2026-03-31T09:00:00Z"), store.getReminder(monthly.id()).orElseThrow().nextTriggerAt());

        ReminderJob once = store.saveReminder(
                ReminderJob.once(null, "guild-1", "chan-1", "user-1", "once", 9, 0, NOW.plusSeconds(60)));
        store.advanceRecurrence(once.id());
        assertTrue(store.getReminder(once.id()).isEmpty());
    }

    @Test
    void upsertAnnouncementConfigShouldApplyDefaultsAndKeepStoredValues() {
        AnnouncementConfig created = store.upsertAnnouncementConfig(
                "guild-1", "chan-events", "Los Angeles, CA", null, null, null, null);

        assertEquals(1, created.scheduleDay());
        assertEquals(12, created.scheduleHour());
        assertEquals(0, created.scheduleMinute());
        assertEquals("America/Los_Angeles", created.timezone());
        assertTrue(created.enabled());

        AnnouncementConfig updated = store.upsertAnnouncementConfig(
                "guild-1", "chan-events", "Seattle, WA", 5, 18, null, "America/New_York");

        assertEquals("Seattle, WA", updated.location());
        assertEquals(5, updated.scheduleDay());
        assertEquals(18, updated.scheduleHour());
        assertEquals(0, updated.scheduleMinute());
        assertEquals("America/New_York", updated.timezone());
        assertEquals(1, mongoTemplate.findAll(EventConfigDocument.class).size());
    }

    @Test
    void upsertAnnouncementConfigShouldRejectInvalidInput() {
        assertThrows(ValidationException.class, () -> store.upsertAnnouncementConfig(
                "guild-1", "chan", "LA", 1, 12, 0, "Mars/Olympus_Mons"));
        assertThrows(ValidationException.class, () -> store.upsertAnnouncementConfig(
                "guild-1", "chan", "LA", 9, 12, 0, null));
        assertTrue(store.getAnnouncementConfig("guild-1").isEmpty());
    }

    @Test
    void disabledConfigsShouldNotBeLoadedAndMarkAnnouncedShouldPersist() {
        store.upsertAnnouncementConfig("guild-1", "chan-1", "Los Angeles, CA", null, null, null, null);
        store.upsertAnnouncementConfig("guild-2", "chan-2", "Portland, OR", null, null, null, null);

        assertTrue(store.setAnnouncementEnabled("guild-2", false));
        assertFalse(store.setAnnouncementEnabled("guild-404", false));

        List<AnnouncementConfig> enabled = store.loadEnabledAnnouncementConfigs();
        assertEquals(1, enabled.size());
        assertEquals("guild-1", enabled.get(0).tenantId());

        Instant announcedAt = Instant.parse("2026-01-05T20:00:00Z");
        store.markAnnounced("guild-1", announcedAt);
        assertEquals(announcedAt, store.getAnnouncementConfig("guild-1").orElseThrow().lastAnnouncedAt());
    }

    @Test
    void unreadableReminderShouldBeSkippedOnLoad() {
        ReminderDocument bad = MongoSchedulerStore.toDocument(
                ReminderJob.daily(null, "guild-1", "chan-1", "user-1", "m", 9, 0));
        bad.setCadence("fortnightly");
        mongoTemplate.insert(bad);
        store.saveReminder(ReminderJob.daily(null, "guild-1", "chan-1", "user-1", "ok", 9, 0));

        List<ReminderJob> loaded = store.loadActiveReminders();
        assertEquals(1, loaded.size());
        assertEquals("ok", loaded.get(0).message());
    }

    @Test
    void oneTimeReminderShouldBeDeliveredAndSoftDeletedThroughScheduler() throws Exception {
        MongoSchedulerStore liveStore = new MongoSchedulerStore(mongoTemplate, ZoneId.of("UTC"));
        ReminderJob saved = liveStore.saveReminder(ReminderJob.once(null, "guild-1", "chan-1", "user-7",
                "stand up", 0, 0, Instant.now().plusMillis(500)));

        List<String> delivered = new CopyOnWriteArrayList<>();
        Notifier notifier = new Notifier() {
            @Override
            public void send(String channelId, String content) {
                delivered.add(content);
            }

            @Override
            public void send(String channelId, AnnouncementPayload payload) {
                delivered.add(payload.title());
            }
        };

        try (ScheduledExecutorJobTimer timer = new ScheduledExecutorJobTimer(1)) {
            DefaultGuildScheduler scheduler = new DefaultGuildScheduler(liveStore, notifier, EventDiscovery.none(),
                    timer, SchedulerSettings.defaults());
            scheduler.initialize();

            boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> liveStore.getReminder(saved.id()).isEmpty());
            scheduler.shutdown();

            assertTrue(reached);
            assertEquals(List.of("<@user-7> ⏰ Reminder: **stand up**"), delivered);
        }
    }

    private void dropCollections() {
        mongoTemplate.dropCollection(ReminderDocument.class);
        mongoTemplate.dropCollection(EventConfigDocument.class);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
