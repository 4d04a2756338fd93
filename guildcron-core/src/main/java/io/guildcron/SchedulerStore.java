package io.guildcron;

import io.guildcron.core.AnnouncementConfig;
import io.guildcron.core.ReminderJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent source of truth for reminders and announcement configs.
 *
 * <p>Implementations report failures as {@link io.guildcron.core.StoreException}.
 */
public interface SchedulerStore {

    List<ReminderJob> loadActiveReminders();

    List<AnnouncementConfig> loadEnabledAnnouncementConfigs();

    /**
     * @return the reminder if it exists and is still active
     */
    Optional<ReminderJob> getReminder(String id);

    Optional<AnnouncementConfig> getAnnouncementConfig(String tenantId);

    void deleteReminder(String id, String tenantId);

    void markAnnounced(String tenantId, Instant announcedAt);

    /**
     * Move a recurring reminder's {@code nextTriggerAt} to its next occurrence.
     */
    void advanceRecurrence(String id);
}
