package io.guildcron.core;

import java.time.Instant;

/**
 * One user's scheduled notification.
 *
 * <p>Exactly one of the calendar fields is populated, matching {@link #cadence()}:
 * <ul>
 *   <li>{@code ONCE}: {@code nextTriggerAt}</li>
 *   <li>{@code DAILY}: none</li>
 *   <li>{@code WEEKLY}: {@code dayOfWeek} (0=Sunday .. 6=Saturday)</li>
 *   <li>{@code MONTHLY}: {@code dayOfMonth}</li>
 *   <li>{@code YEARLY}: {@code dayOfMonth} and {@code month}</li>
 * </ul>
 * Recurring reminders may also carry {@code nextTriggerAt} as bookkeeping.
 */
public record ReminderJob(

        // identity
        String id,
        String tenantId,
        String channelId,
        String userId,

        // payload
        String message,

        // scheduling
        Cadence cadence,
        int hour,
        int minute,
        Integer dayOfWeek,
        Integer dayOfMonth,
        Integer month,
        Instant nextTriggerAt
) {

    public static ReminderJob once(String id, String tenantId, String channelId, String userId,
                                   String message, int hour, int minute, Instant triggerAt) {
        return new ReminderJob(id, tenantId, channelId, userId, message, Cadence.ONCE,
                hour, minute, null, null, null, triggerAt);
    }

    public static ReminderJob daily(String id, String tenantId, String channelId, String userId,
                                    String message, int hour, int minute) {
        return new ReminderJob(id, tenantId, channelId, userId, message, Cadence.DAILY,
                hour, minute, null, null, null, null);
    }

    public static ReminderJob weekly(String id, String tenantId, String channelId, String userId,
                                     String message, int hour, int minute, int dayOfWeek) {
        return new ReminderJob(id, tenantId, channelId, userId, message, Cadence.WEEKLY,
                hour, minute, dayOfWeek, null, null, null);
    }

    public static ReminderJob monthly(String id, String tenantId, String channelId, String userId,
                                      String message, int hour, int minute, int dayOfMonth) {
        return new ReminderJob(id, tenantId, channelId, userId, message, Cadence.MONTHLY,
                hour, minute, null, dayOfMonth, null, null);
    }

    public static ReminderJob yearly(String id, String tenantId, String channelId, String userId,
                                     String message, int hour, int minute, int dayOfMonth, int month) {
        return new ReminderJob(id, tenantId, channelId, userId, message, Cadence.YEARLY,
                hour, minute, null, dayOfMonth, month, null);
    }

    /**
     * Checks identity, time of day and the cadence/calendar-field invariant.
     *
     * @throws ValidationException on the first violation found
     */
    public void validate() {
        requireText(id, "id");
        requireText(tenantId, "tenantId");
        requireText(channelId, "channelId");
        if (cadence == null) {
            throw new ValidationException("Reminder " + id + " has no cadence");
        }
        if (hour < 0 || hour > 23) {
            throw new ValidationException("Invalid hour: " + hour + ". Must be between 0-23.");
        }
        if (minute < 0 || minute > 59) {
            throw new ValidationException("Invalid minute: " + minute + ". Must be between 0-59.");
        }

        switch (cadence) {
            case ONCE -> {
                if (nextTriggerAt == null) {
                    throw new ValidationException("One-time reminder " + id + " has no nextTriggerAt");
                }
                requireAbsent(dayOfWeek, "dayOfWeek");
                requireAbsent(dayOfMonth, "dayOfMonth");
                requireAbsent(month, "month");
            }
            case DAILY -> {
                requireAbsent(dayOfWeek, "dayOfWeek");
                requireAbsent(dayOfMonth, "dayOfMonth");
                requireAbsent(month, "month");
            }
            case WEEKLY -> {
                requireRange(dayOfWeek, "dayOfWeek", 0, 6);
                requireAbsent(dayOfMonth, "dayOfMonth");
                requireAbsent(month, "month");
            }
            case MONTHLY -> {
                requireRange(dayOfMonth, "dayOfMonth", 1, 31);
                requireAbsent(dayOfWeek, "dayOfWeek");
                requireAbsent(month, "month");
            }
            case YEARLY -> {
                requireRange(dayOfMonth, "dayOfMonth", 1, 31);
                requireRange(month, "month", 1, 12);
                requireAbsent(dayOfWeek, "dayOfWeek");
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Reminder " + field + " must not be blank");
        }
    }

    private void requireAbsent(Integer value, String field) {
        if (value != null) {
            throw new ValidationException(
                    "Reminder " + id + " with cadence " + cadence.value() + " must not set " + field);
        }
    }

    private void requireRange(Integer value, String field, int min, int max) {
        if (value == null) {
            throw new ValidationException(
                    "Reminder " + id + " with cadence " + cadence.value() + " requires " + field);
        }
        if (value < min || value > max) {
            throw new ValidationException(
                    "Invalid " + field + ": " + value + ". Must be between " + min + "-" + max + ".");
        }
    }
}
