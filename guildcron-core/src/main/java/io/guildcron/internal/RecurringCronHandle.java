package io.guildcron.internal;

import io.guildcron.JobTimer;
import io.guildcron.core.ScheduledHandle;
import io.guildcron.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Cron trigger built from single-shot timers: each firing arms the next occurrence after the callback
 * has returned, so two firings of one handle never overlap.
 */
final class RecurringCronHandle implements ScheduledHandle {
    private static final Logger log = LoggerFactory.getLogger(RecurringCronHandle.class);

    private final String id;
    private final String cron;
    private final ZoneId zone;
    private final JobTimer timer;
    private final Clock clock;
    private final Consumer<ScheduledHandle> callback;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private ScheduledHandle current;
    private volatile Instant nextFireAt;

    private RecurringCronHandle(String id, String cron, ZoneId zone, JobTimer timer, Clock clock,
                                Consumer<ScheduledHandle> callback) {
        this.id = id;
        this.cron = cron;
        this.zone = zone;
        this.timer = timer;
        this.clock = clock;
        this.callback = callback;
    }

    /**
     * Arm the first occurrence.
     *
     * @return the handle, or {@code null} if the expression has no future occurrence
     */
    static RecurringCronHandle start(String id, String cron, ZoneId zone, JobTimer timer, Clock clock,
                                     Consumer<ScheduledHandle> callback) {
        RecurringCronHandle handle = new RecurringCronHandle(id, cron, zone, timer, clock, callback);
        return handle.armNext(clock.instant()) ? handle : null;
    }

    Instant nextFireAt() {
        return nextFireAt;
    }

    private boolean armNext(Instant now) {
        // The timer may wake slightly before the wall-clock instant; never re-pick the occurrence just fired.
        Instant previous = nextFireAt;
        Instant base = (previous != null && previous.isAfter(now)) ? previous : now;

        Instant next = CronSchedules.nextFireTime(cron, zone, base);
        if (next == null) {
            return false;
        }

        synchronized (this) {
            if (cancelled.get()) {
                return false;
            }
            nextFireAt = next;
            current = timer.arm(id, Duration.between(now, next), this::fire);
        }
        log.debug("guildcron cron armed id={} cron={} timezone={} nextFireAt={}", id, cron, zone, next);
        return true;
    }

    private void fire() {
        if (cancelled.get()) {
            return;
        }
        try {
            callback.accept(this);
        } finally {
            if (!cancelled.get() && !armNext(clock.instant()) && !cancelled.get()) {
                log.warn("guildcron cron has no further occurrences id={} cron={}", id, cron);
            }
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (current != null) {
                current.cancel();
            }
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
