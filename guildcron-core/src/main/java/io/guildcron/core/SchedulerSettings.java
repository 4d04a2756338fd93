package io.guildcron.core;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime options for the scheduler.
 * <ul>
 *   <li>defaultTimezone: zone reminder cron expressions are evaluated in</li>
 *   <li>misfireGrace: a one-time reminder overdue by less than this at load time fires immediately
 *       instead of being dropped as stale; zero disables the grace</li>
 * </ul>
 */
public record SchedulerSettings(ZoneId defaultTimezone, Duration misfireGrace) {

    public SchedulerSettings {
        Objects.requireNonNull(defaultTimezone, "defaultTimezone must not be null");
        Objects.requireNonNull(misfireGrace, "misfireGrace must not be null");
        if (misfireGrace.isNegative()) {
            throw new IllegalArgumentException("misfireGrace must not be negative");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(ZoneId.of(AnnouncementConfig.DEFAULT_TIMEZONE), Duration.ZERO);
    }
}
