package io.guildcron.utils;

import io.guildcron.core.ReminderJob;
import io.guildcron.core.ValidationException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Builds 5-field cron expressions ({@code minute hour day-of-month month day-of-week}) from schedule
 * fields, and parses the user-facing time and day inputs those fields come from.
 * <p>
 * Day of week is 0=Sunday .. 6=Saturday.
 * <p>
 * Note: day-of-month is accepted in [1, 31] for every month. A month without that day simply has no
 * occurrence; nothing is clamped.
 */
public final class CronExpressionBuilder {
    private CronExpressionBuilder() {
    }

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private static final String[] DAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private static final Map<String, Integer> DAY_LOOKUP = Map.ofEntries(
            entry("sunday", 0), entry("sun", 0),
            entry("monday", 1), entry("mon", 1),
            entry("tuesday", 2), entry("tue", 2), entry("tues", 2),
            entry("wednesday", 3), entry("wed", 3),
            entry("thursday", 4), entry("thu", 4), entry("thur", 4), entry("thurs", 4),
            entry("friday", 5), entry("fri", 5),
            entry("saturday", 6), entry("sat", 6)
    );

    /**
     * Hour and minute parsed from "H:MM" / "HH:MM".
     */
    public record TimeOfDay(int hour, int minute) {
    }

    /**
     * Every day at hour:minute, e.g. {@code buildDaily(30, 9)} = "30 9 * * *".
     */
    public static String buildDaily(int minute, int hour) {
        checkMinute(minute);
        checkHour(hour);
        return minute + " " + hour + " * * *";
    }

    /**
     * Every week, e.g. {@code buildWeekly(0, 12, 1)} = "0 12 * * 1" (Monday noon).
     */
    public static String buildWeekly(int minute, int hour, int dayOfWeek) {
        checkMinute(minute);
        checkHour(hour);
        checkDayOfWeek(dayOfWeek);
        return minute + " " + hour + " * * " + dayOfWeek;
    }

    /**
     * Every month, e.g. {@code buildMonthly(30, 14, 15)} = "30 14 15 * *".
     */
    public static String buildMonthly(int minute, int hour, int dayOfMonth) {
        checkMinute(minute);
        checkHour(hour);
        checkDayOfMonth(dayOfMonth);
        return minute + " " + hour + " " + dayOfMonth + " * *";
    }

    /**
     * Every year, e.g. {@code buildYearly(0, 0, 31, 12)} = "0 0 31 12 *".
     */
    public static String buildYearly(int minute, int hour, int dayOfMonth, int month) {
        checkMinute(minute);
        checkHour(hour);
        checkDayOfMonth(dayOfMonth);
        if (month < 1 || month > 12) {
            throw new ValidationException("Invalid month: " + month + ". Must be between 1-12.");
        }
        return minute + " " + hour + " " + dayOfMonth + " " + month + " *";
    }

    /**
     * Cron expression for a recurring reminder's cadence.
     *
     * @throws ValidationException for one-time reminders, which have no cron expression
     */
    public static String forReminder(ReminderJob job) {
        return switch (job.cadence()) {
            case DAILY -> buildDaily(job.minute(), job.hour());
            case WEEKLY -> buildWeekly(job.minute(), job.hour(), required(job.dayOfWeek(), "dayOfWeek", job));
            case MONTHLY -> buildMonthly(job.minute(), job.hour(), required(job.dayOfMonth(), "dayOfMonth", job));
            case YEARLY -> buildYearly(job.minute(), job.hour(),
                    required(job.dayOfMonth(), "dayOfMonth", job),
                    required(job.month(), "month", job));
            case ONCE -> throw new ValidationException("One-time reminder " + job.id() + " has no cron expression");
        };
    }

    /**
     * Parse "14:30" or "9:00".
     */
    public static TimeOfDay parseTimeString(String timeString) {
        if (timeString == null) {
            throw new ValidationException("Invalid time format: null. Expected HH:MM format (e.g., \"14:30\" or \"9:00\").");
        }
        Matcher m = TIME_PATTERN.matcher(timeString);
        if (!m.matches()) {
            throw new ValidationException("Invalid time format: \"" + timeString
                    + "\". Expected HH:MM format (e.g., \"14:30\" or \"9:00\").");
        }

        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        checkHour(hour);
        checkMinute(minute);
        return new TimeOfDay(hour, minute);
    }

    /**
     * Full or abbreviated day name, case-insensitive: "Monday", "mon", "THURS" ...
     */
    public static int parseDayName(String dayName) {
        if (dayName == null) {
            throw new ValidationException("Invalid day name: null");
        }
        Integer day = DAY_LOOKUP.get(dayName.trim().toLowerCase(Locale.ROOT));
        if (day == null) {
            throw new ValidationException("Invalid day name: \"" + dayName
                    + "\". Expected day name like \"Monday\", \"mon\", \"Friday\", etc.");
        }
        return day;
    }

    public static String formatDayName(int dayOfWeek) {
        checkDayOfWeek(dayOfWeek);
        return DAY_NAMES[dayOfWeek];
    }

    /**
     * Returns true if the runtime's zone database knows {@code timezone}.
     */
    public static boolean isValidTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return false;
        }
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * Resolve {@code timezone}, failing with {@link ValidationException} for unknown ids.
     */
    public static ZoneId requireZone(String timezone) {
        if (!isValidTimezone(timezone)) {
            throw new ValidationException("Invalid timezone: " + timezone);
        }
        return ZoneId.of(timezone);
    }

    /* ================= helper ================= */

    private static int required(Integer value, String field, ReminderJob job) {
        if (value == null) {
            throw new ValidationException("Reminder " + job.id() + " with cadence "
                    + job.cadence().value() + " requires " + field);
        }
        return value;
    }

    private static void checkMinute(int minute) {
        if (minute < 0 || minute > 59) {
            throw new ValidationException("Invalid minute: " + minute + ". Must be between 0-59.");
        }
    }

    private static void checkHour(int hour) {
        if (hour < 0 || hour > 23) {
            throw new ValidationException("Invalid hour: " + hour + ". Must be between 0-23.");
        }
    }

    private static void checkDayOfWeek(int dayOfWeek) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new ValidationException("Invalid dayOfWeek: " + dayOfWeek
                    + ". Must be between 0-6 (0=Sunday, 6=Saturday).");
        }
    }

    private static void checkDayOfMonth(int dayOfMonth) {
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new ValidationException("Invalid dayOfMonth: " + dayOfMonth + ". Must be between 1-31.");
        }
    }
}
