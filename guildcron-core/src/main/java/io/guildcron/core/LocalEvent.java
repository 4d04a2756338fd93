package io.guildcron.core;

import java.time.Instant;

/**
 * One event returned by an event discovery provider.
 */
public record LocalEvent(
        String title,
        String description,
        Instant startDate,
        Instant endDate,
        String location,
        String url,
        String source
) {
}
