package io.guildcron.events;

import io.guildcron.core.AnnouncementPayload;
import io.guildcron.core.LocalEvent;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Lays out discovered events as an announcement: one field per event, earliest first.
 */
public class AnnouncementFormatter {

    public static final int COLOR_EVENTS = 0x5865F2;
    public static final int COLOR_EMPTY = 0x9CA3AF;
    public static final int MAX_FIELDS = 25;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEE, MMM d", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private final String providerName;
    private final ZoneId zone;

    public AnnouncementFormatter(String providerName, ZoneId zone) {
        this.providerName = Objects.requireNonNull(providerName, "providerName must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public AnnouncementFormatter(String providerName) {
        this(providerName, ZoneOffset.UTC);
    }

    public AnnouncementPayload format(List<LocalEvent> events, String location) {
        String title = "📅 Local Events in " + location;

        if (events == null || events.isEmpty()) {
            return new AnnouncementPayload(
                    title,
                    "🔍 No upcoming events found for this location.\n\n"
                            + "Try checking back later or adjusting your location settings.",
                    List.of(),
                    null,
                    COLOR_EMPTY
            );
        }

        List<LocalEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(LocalEvent::startDate, Comparator.nullsLast(Comparator.naturalOrder())));

        int count = Math.min(sorted.size(), MAX_FIELDS);
        List<AnnouncementPayload.Field> fields = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LocalEvent event = sorted.get(i);
            fields.add(new AnnouncementPayload.Field(
                    (i + 1) + ". " + truncate(event.title(), 80),
                    fieldValue(event)
            ));
        }

        return new AnnouncementPayload(
                title,
                null,
                fields,
                "Powered by " + providerName + " • " + events.size() + " events found",
                COLOR_EVENTS
        );
    }

    private String fieldValue(LocalEvent event) {
        StringBuilder value = new StringBuilder();
        value.append("📍 ").append(truncate(event.location(), 50)).append('\n');
        if (event.startDate() != null) {
            ZonedDateTime start = event.startDate().atZone(zone);
            value.append("🕐 ").append(DATE.format(start)).append(" at ").append(TIME.format(start)).append('\n');
        }
        value.append(truncate(event.description(), 100));
        if (event.url() != null && !event.url().isBlank()) {
            value.append("\n[More info](").append(event.url()).append(')');
        }
        return value.toString();
    }

    static String truncate(String s, int maxLength) {
        if (s == null) {
            return "";
        }
        if (s.length() <= maxLength) {
            return s;
        }
        return s.substring(0, maxLength - 3) + "...";
    }
}
