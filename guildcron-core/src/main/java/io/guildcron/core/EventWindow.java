package io.guildcron.core;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Monday 12:00 to the following Monday 11:59, local to {@code zone}.
 */
public record EventWindow(
        Instant start,
        Instant end,
        ZoneId zone
) {
}
