package io.guildcron.core;

import java.time.Instant;

/**
 * A one-time reminder whose trigger time had already elapsed when it was loaded.
 */
public class StaleJobException extends GuildCronException {

    private final String reminderId;
    private final Instant triggerAt;

    public StaleJobException(String reminderId, Instant triggerAt, Instant now) {
        super("One-time reminder " + reminderId + " was due at " + triggerAt + " (now " + now + ")");
        this.reminderId = reminderId;
        this.triggerAt = triggerAt;
    }

    public String getReminderId() {
        return reminderId;
    }

    public Instant getTriggerAt() {
        return triggerAt;
    }
}
