package io.guildcron;

import io.guildcron.core.AnnouncementPayload;
import io.guildcron.core.LocalEvent;
import io.guildcron.events.AnnouncementFormatter;

import java.time.Instant;
import java.util.List;

/**
 * Finds local events for the announcement path.
 */
public interface EventDiscovery {

    List<LocalEvent> discover(String location, Instant windowStart, Instant windowEnd);

    default AnnouncementPayload format(List<LocalEvent> events, String location) {
        return new AnnouncementFormatter(name()).format(events, location);
    }

    /**
     * Provider name shown in announcement footers and logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * A provider that never finds anything.
     */
    static EventDiscovery none() {
        return new EventDiscovery() {
            @Override
            public List<LocalEvent> discover(String location, Instant windowStart, Instant windowEnd) {
                return List.of();
            }

            @Override
            public String name() {
                return "none";
            }
        };
    }
}
