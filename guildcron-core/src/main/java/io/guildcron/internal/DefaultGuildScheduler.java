package io.guildcron.internal;

import io.guildcron.EventDiscovery;
import io.guildcron.GuildScheduler;
import io.guildcron.JobTimer;
import io.guildcron.Notifier;
import io.guildcron.SchedulerStore;
import io.guildcron.core.AnnouncementConfig;
import io.guildcron.core.AnnouncementPayload;
import io.guildcron.core.EventWindow;
import io.guildcron.core.JobKeys;
import io.guildcron.core.JobRegistry;
import io.guildcron.core.LocalEvent;
import io.guildcron.core.ReminderJob;
import io.guildcron.core.ScheduledHandle;
import io.guildcron.core.SchedulerSettings;
import io.guildcron.core.StaleJobException;
import io.guildcron.core.ValidationException;
import io.guildcron.utils.CronExpressionBuilder;
import io.guildcron.utils.TimeWindowCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link GuildScheduler}: registers reminders and weekly event announcements on a {@link JobTimer}.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>One-time reminders arm a single timer for {@code nextTriggerAt - now}; already elapsed ones are
 *       stale and skipped</li>
 *   <li>Recurring reminders and announcements run on cron expressions evaluated in civil time</li>
 *   <li>Jobs are re-read from the {@link SchedulerStore} when they fire; the registry only holds
 *       timer handles</li>
 *   <li>Every failure inside a firing is logged and contained; future occurrences are unaffected</li>
 * </ul>
 */
public class DefaultGuildScheduler implements GuildScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultGuildScheduler.class);

    private final SchedulerStore store;
    private final Notifier notifier;
    private final EventDiscovery eventDiscovery;
    private final JobTimer timer;
    private final SchedulerSettings settings;
    private final Clock clock;
    private final TimeWindowCalculator windows;

    private final JobRegistry registry = new JobRegistry();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public DefaultGuildScheduler(SchedulerStore store, Notifier notifier, EventDiscovery eventDiscovery,
                                 JobTimer timer, SchedulerSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.eventDiscovery = Objects.requireNonNull(eventDiscovery, "eventDiscovery must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windows = new TimeWindowCalculator(clock);
    }

    public DefaultGuildScheduler(SchedulerStore store, Notifier notifier, EventDiscovery eventDiscovery,
                                 JobTimer timer, SchedulerSettings settings) {
        this(store, notifier, eventDiscovery, timer, settings, Clock.systemUTC());
    }

    @Override
    public void initialize() {
        ensureRunning();
        if (!started.compareAndSet(false, true)) {
            return;
        }

        int reminders = loadReminders();
        int announcements = loadAnnouncements();

        log.info("guildcron scheduler initialized reminders={} announcements={} registered={}",
                reminders, announcements, registry.size());
    }

    @Override
    public void addReminder(String reminderId) {
        Objects.requireNonNull(reminderId, "reminderId must not be null");
        ensureRunning();

        Optional<ReminderJob> job;
        try {
            job = store.getReminder(reminderId);
        } catch (RuntimeException e) {
            log.error("guildcron failed to load reminder id={} msg={}", reminderId, e.getMessage(), e);
            return;
        }

        if (job.isEmpty()) {
            log.warn("guildcron reminder not found id={}", reminderId);
            return;
        }

        try {
            scheduleReminder(job.get());
        } catch (StaleJobException e) {
            logStale(job.get(), e);
        }
    }

    @Override
    public void removeReminder(String reminderId) {
        Objects.requireNonNull(reminderId, "reminderId must not be null");
        if (registry.remove(JobKeys.reminder(reminderId))) {
            log.info("guildcron reminder unscheduled id={}", reminderId);
        }
    }

    @Override
    public void upsertEventConfig(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        ensureRunning();

        Optional<AnnouncementConfig> config;
        try {
            config = store.getAnnouncementConfig(tenantId);
        } catch (RuntimeException e) {
            log.error("guildcron failed to load announcement config tenant={} msg={}", tenantId, e.getMessage(), e);
            return;
        }

        if (config.isEmpty() || !config.get().enabled()) {
            boolean removed = registry.remove(JobKeys.events(tenantId));
            log.info("guildcron announcement config missing or disabled tenant={} unscheduled={}", tenantId, removed);
            return;
        }

        try {
            scheduleAnnouncement(config.get());
        } catch (ValidationException e) {
            // an unusable config must not leave the previous schedule firing
            boolean removed = registry.remove(JobKeys.events(tenantId));
            log.warn("guildcron announcement config rejected tenant={} unscheduled={} msg={}",
                    tenantId, removed, e.getMessage());
            throw e;
        }
    }

    @Override
    public void removeEventConfig(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (registry.remove(JobKeys.events(tenantId))) {
            log.info("guildcron announcement unscheduled tenant={}", tenantId);
        }
    }

    @Override
    public Set<String> scheduledKeys() {
        return registry.keys();
    }

    @Override
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("guildcron scheduler stopping registered={}", registry.size());
        registry.stopAll();
        log.info("guildcron scheduler stopped");
    }

    /**
     * Register one reminder according to its cadence, replacing any earlier registration.
     *
     * @return true if a registration was installed
     * @throws StaleJobException                       for a one-time reminder whose trigger time has passed
     * @throws ValidationException if the reminder breaks the cadence invariant
     */
    public boolean scheduleReminder(ReminderJob job) {
        Objects.requireNonNull(job, "job must not be null");
        job.validate();

        if (!job.cadence().isRecurring()) {
            scheduleOneTimeReminder(job);
            return true;
        }

        String key = JobKeys.reminder(job.id());
        String cron = CronExpressionBuilder.forReminder(job);
        String reminderId = job.id();
        ZoneId zone = settings.defaultTimezone();

        ScheduledHandle handle = registry.replace(key, () -> RecurringCronHandle.start(
                key, cron, zone, timer, clock, self -> executeRecurringReminder(key, reminderId, self)));

        if (handle == null) {
            log.warn("guildcron reminder has no future occurrence id={} tenant={} cadence={} cron={}",
                    job.id(), job.tenantId(), job.cadence().value(), cron);
            return false;
        }

        log.info("guildcron reminder scheduled id={} tenant={} cadence={} cron={} timezone={} nextFireAt={}",
                job.id(), job.tenantId(), job.cadence().value(), cron, zone,
                ((RecurringCronHandle) handle).nextFireAt());
        return true;
    }

    /**
     * Register the weekly announcement for {@code config.tenantId()}, replacing any earlier registration.
     * Only the tenant id is captured; the config is re-read when the job fires.
     *
     * @throws ValidationException for an invalid timezone or schedule
     */
    public boolean scheduleAnnouncement(AnnouncementConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        ZoneId zone = CronExpressionBuilder.requireZone(config.timezone());
        String cron = CronExpressionBuilder.buildWeekly(
                config.scheduleMinute(), config.scheduleHour(), config.scheduleDay());
        String tenantId = config.tenantId();
        String key = JobKeys.events(tenantId);

        ScheduledHandle handle = registry.replace(key, () -> RecurringCronHandle.start(
                key, cron, zone, timer, clock, self -> executeAnnouncement(tenantId)));

        if (handle == null) {
            log.warn("guildcron announcement has no future occurrence tenant={} cron={}", tenantId, cron);
            return false;
        }

        log.info("guildcron announcement scheduled tenant={} day={} cron={} timezone={} nextFireAt={}",
                tenantId, CronExpressionBuilder.formatDayName(config.scheduleDay()), cron, zone,
                ((RecurringCronHandle) handle).nextFireAt());
        return true;
    }

    /* ================= loading ================= */

    private int loadReminders() {
        List<ReminderJob> jobs;
        try {
            jobs = store.loadActiveReminders();
        } catch (RuntimeException e) {
            log.error("guildcron failed to load reminders msg={}", e.getMessage(), e);
            return 0;
        }

        int scheduled = 0;
        for (ReminderJob job : jobs) {
            try {
                if (scheduleReminder(job)) {
                    scheduled++;
                }
            } catch (StaleJobException e) {
                logStale(job, e);
            } catch (RuntimeException e) {
                log.error("guildcron failed to schedule reminder id={} tenant={} cadence={} msg={}",
                        job.id(), job.tenantId(), job.cadence() == null ? null : job.cadence().value(),
                        e.getMessage(), e);
            }
        }
        return scheduled;
    }

    private int loadAnnouncements() {
        List<AnnouncementConfig> configs;
        try {
            configs = store.loadEnabledAnnouncementConfigs();
        } catch (RuntimeException e) {
            log.error("guildcron failed to load announcement configs msg={}", e.getMessage(), e);
            return 0;
        }

        int scheduled = 0;
        for (AnnouncementConfig config : configs) {
            try {
                if (scheduleAnnouncement(config)) {
                    scheduled++;
                }
            } catch (RuntimeException e) {
                log.error("guildcron failed to schedule announcement tenant={} timezone={} msg={}",
                        config.tenantId(), config.timezone(), e.getMessage(), e);
            }
        }
        return scheduled;
    }

    /* ================= one-time reminders ================= */

    private void scheduleOneTimeReminder(ReminderJob job) {
        String key = JobKeys.reminder(job.id());
        Instant now = clock.instant();
        Instant triggerAt = job.nextTriggerAt();
        Duration delay = Duration.between(now, triggerAt);

        if (delay.isZero() || delay.isNegative()) {
            Duration overdue = delay.negated();
            if (overdue.compareTo(settings.misfireGrace()) >= 0) {
                registry.remove(key);
                throw new StaleJobException(job.id(), triggerAt, now);
            }
            log.info("guildcron one-time reminder misfired within grace; firing now id={} overdueMs={}",
                    job.id(), overdue.toMillis());
            delay = Duration.ZERO;
        }

        String reminderId = job.id();
        Duration armDelay = delay;
        registry.replace(key, () -> OneShotHandle.arm(
                key, timer, armDelay, self -> executeOneTimeReminder(key, reminderId, self)));

        log.info("guildcron one-time reminder scheduled id={} tenant={} triggerAt={} delayMs={}",
                job.id(), job.tenantId(), triggerAt, armDelay.toMillis());
    }

    private void executeOneTimeReminder(String key, String reminderId, ScheduledHandle self) {
        try {
            Optional<ReminderJob> current = store.getReminder(reminderId);
            if (current.isEmpty()) {
                log.info("guildcron one-time reminder no longer exists id={}", reminderId);
                return;
            }

            ReminderJob job = current.get();
            if (!deliver(job)) {
                // kept in the store so the failure stays visible
                return;
            }

            store.deleteReminder(job.id(), job.tenantId());
            log.info("guildcron one-time reminder deleted after execution id={} tenant={}", job.id(), job.tenantId());
        } catch (RuntimeException e) {
            log.error("guildcron one-time reminder failed id={} msg={}", reminderId, e.getMessage(), e);
        } finally {
            registry.unregister(key, self);
        }
    }

    /* ================= recurring reminders ================= */

    private void executeRecurringReminder(String key, String reminderId, ScheduledHandle self) {
        try {
            Optional<ReminderJob> current = store.getReminder(reminderId);
            if (current.isEmpty()) {
                log.info("guildcron recurring reminder no longer exists; unscheduling id={}", reminderId);
                self.cancel();
                registry.unregister(key, self);
                return;
            }

            ReminderJob job = current.get();
            if (deliver(job)) {
                store.advanceRecurrence(job.id());
            }
        } catch (RuntimeException e) {
            log.error("guildcron recurring reminder failed id={} msg={}", reminderId, e.getMessage(), e);
        }
    }

    private boolean deliver(ReminderJob job) {
        log.debug("guildcron executing reminder id={} tenant={} channel={} cadence={}",
                job.id(), job.tenantId(), job.channelId(), job.cadence().value());
        try {
            notifier.send(job.channelId(), formatReminder(job));
        } catch (RuntimeException e) {
            log.error("guildcron failed to deliver reminder id={} tenant={} channel={} cadence={} msg={}",
                    job.id(), job.tenantId(), job.channelId(), job.cadence().value(), e.getMessage(), e);
            return false;
        }
        log.info("guildcron reminder executed id={} tenant={} channel={}", job.id(), job.tenantId(), job.channelId());
        return true;
    }

    static String formatReminder(ReminderJob job) {
        return "<@" + job.userId() + "> ⏰ Reminder: **" + job.message() + "**";
    }

    /* ================= announcements ================= */

    private void executeAnnouncement(String tenantId) {
        try {
            Optional<AnnouncementConfig> found = store.getAnnouncementConfig(tenantId);
            if (found.isEmpty() || !found.get().enabled()) {
                log.info("guildcron announcement skipped; config missing or disabled tenant={}", tenantId);
                return;
            }

            AnnouncementConfig config = found.get();
            EventWindow window = windows.eventWindow(config.timezone());

            List<LocalEvent> events = eventDiscovery.discover(config.location(), window.start(), window.end());
            AnnouncementPayload payload = eventDiscovery.format(events, config.location());
            notifier.send(config.channelId(), payload);

            store.markAnnounced(tenantId, clock.instant());
            log.info("guildcron announcement sent tenant={} channel={} location={} events={} provider={}",
                    tenantId, config.channelId(), config.location(), events.size(), eventDiscovery.name());
        } catch (RuntimeException e) {
            log.error("guildcron announcement failed tenant={} msg={}", tenantId, e.getMessage(), e);
        }
    }

    /* ================= helper ================= */

    private void logStale(ReminderJob job, StaleJobException e) {
        log.warn("guildcron one-time reminder trigger time has already passed; skipping id={} tenant={} triggerAt={}",
                job.id(), job.tenantId(), e.getTriggerAt());
    }

    private void ensureRunning() {
        if (stopped.get()) {
            throw new IllegalStateException("guildcron scheduler has been shut down");
        }
    }
}
