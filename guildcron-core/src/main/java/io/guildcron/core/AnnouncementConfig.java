package io.guildcron.core;

import java.time.Instant;

/**
 * Per-tenant settings for the weekly local events broadcast.
 *
 * @param scheduleDay day of week, 0=Sunday .. 6=Saturday
 * @param timezone    IANA zone id the schedule is evaluated in
 */
public record AnnouncementConfig(
        String tenantId,
        String channelId,
        String location,
        int scheduleDay,
        int scheduleHour,
        int scheduleMinute,
        String timezone,
        boolean enabled,
        Instant lastAnnouncedAt
) {

    public static final int DEFAULT_DAY = 1;
    public static final int DEFAULT_HOUR = 12;
    public static final int DEFAULT_MINUTE = 0;
    public static final String DEFAULT_TIMEZONE = "America/Los_Angeles";
}
