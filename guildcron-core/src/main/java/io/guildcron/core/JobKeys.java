package io.guildcron.core;

public final class JobKeys {
    private static final String REMINDER_PREFIX = "reminder_";
    private static final String EVENTS_PREFIX = "events_";

    private JobKeys() {
    }

    public static String reminder(String reminderId) {
        return REMINDER_PREFIX + reminderId;
    }

    public static String events(String tenantId) {
        return EVENTS_PREFIX + tenantId;
    }
}
