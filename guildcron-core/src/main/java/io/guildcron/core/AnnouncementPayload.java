package io.guildcron.core;

import java.util.List;

/**
 * Rich message content for a weekly events announcement.
 */
public record AnnouncementPayload(
        String title,
        String description,
        List<Field> fields,
        String footer,
        int color
) {

    public AnnouncementPayload {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String name, String value) {
    }
}
