package io.guildcron;

import java.util.Set;

/**
 * Scheduler API used by command handlers.
 *
 * <p>Reminders and event announcements are registered from the {@link SchedulerStore} at
 * {@link #initialize()}. Afterwards command handlers tell the scheduler about single changes:
 * <pre>{@code
 * scheduler.initialize();
 *
 * scheduler.addReminder("42");            // user created a reminder
 * scheduler.upsertEventConfig("guild-1"); // user changed the events schedule
 * scheduler.removeEventConfig("guild-1"); // user turned announcements off
 *
 * scheduler.shutdown();
 * }</pre>
 */
public interface GuildScheduler {

    /**
     * Load all active reminders and enabled announcement configs and register them.
     * A failure for one job never prevents the others from being registered. Should be idempotent.
     */
    void initialize();

    /**
     * Re-read one reminder from the store and (re)register it.
     *
     * @throws io.guildcron.core.ValidationException if the stored reminder is malformed
     */
    void addReminder(String reminderId);

    /**
     * Cancel a reminder's registration. No-op when it is not registered.
     */
    void removeReminder(String reminderId);

    /**
     * Re-read the tenant's announcement config and replace its registration, or unregister it
     * when the config is missing or disabled.
     *
     * @throws io.guildcron.core.ValidationException if the stored schedule or timezone is invalid
     */
    void upsertEventConfig(String tenantId);

    /**
     * Cancel the tenant's announcement registration. No-op when it is not registered.
     */
    void removeEventConfig(String tenantId);

    /**
     * Snapshot of the currently registered job keys.
     */
    Set<String> scheduledKeys();

    /**
     * Stop every registration. Should be idempotent.
     */
    void shutdown();
}
