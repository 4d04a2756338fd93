package io.guildcron.utils;

import io.guildcron.core.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Evaluates standard 5-field cron expressions with Quartz.
 * <p>
 * Quartz differs from standard cron in two ways that are translated here:
 * <ul>
 *   <li>it has a leading seconds field and numbers days of week 1=Sunday .. 7=Saturday</li>
 *   <li>one of day-of-month / day-of-week must be "?"</li>
 * </ul>
 * Expressions restricting both day-of-month and day-of-week are rejected; Quartz cannot express
 * the standard "either matches" rule.
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    /**
     * Translate "m h dom mon dow" into Quartz's "s m h dom mon dow".
     */
    public static String toQuartz(String cron) {
        if (cron == null) {
            throw new ValidationException("cron expression must not be null");
        }
        String[] parts = cron.trim().split("\\s+");
        if (parts.length != 5) {
            throw new ValidationException("Expected a 5-field cron expression: " + cron);
        }

        String minute = parts[0];
        String hour = parts[1];
        String dayOfMonth = parts[2];
        String month = parts[3];
        String dayOfWeek = parts[4];

        boolean anyDayOfMonth = "*".equals(dayOfMonth) || "?".equals(dayOfMonth);
        boolean anyDayOfWeek = "*".equals(dayOfWeek) || "?".equals(dayOfWeek);

        if (!anyDayOfMonth && !anyDayOfWeek) {
            throw new ValidationException("Restricting both day-of-month and day-of-week is not supported: " + cron);
        }

        String dom;
        String dow;
        if (anyDayOfWeek) {
            dom = anyDayOfMonth ? "*" : dayOfMonth;
            dow = "?";
        } else {
            dom = "?";
            dow = toQuartzDayOfWeek(dayOfWeek, cron);
        }

        return String.join(" ", "0", minute, hour, dom, month, dow);
    }

    /**
     * Returns true if {@code cron} is a 5-field expression Quartz accepts after translation.
     */
    public static boolean isValid(String cron) {
        try {
            return CronExpression.isValidExpression(toQuartz(cron));
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code after}, evaluated in civil time of {@code zone}.
     *
     * @return the next occurrence, or {@code null} if the expression never fires again
     *         (e.g. 30 February)
     */
    public static Instant nextFireTime(String cron, ZoneId zone, Instant after) {
        if (zone == null) {
            throw new IllegalArgumentException("zone must not be null");
        }
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }

        CronExpression exp = parse(cron);
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    private static CronExpression parse(String cron) {
        String quartz = toQuartz(cron);
        try {
            return new CronExpression(quartz);
        } catch (ParseException e) {
            throw new ValidationException("Invalid cron expression: " + cron + " (" + e.getMessage() + ")");
        }
    }

    private static String toQuartzDayOfWeek(String field, String cron) {
        if (field.contains("/")) {
            throw new ValidationException("Step values in day-of-week are not supported: " + cron);
        }

        List<String> out = new ArrayList<>();
        for (String token : field.split(",")) {
            if (token.contains("-")) {
                String[] range = token.split("-", 2);
                out.add(shiftDay(range[0], cron) + "-" + shiftDay(range[1], cron));
            } else {
                out.add(shiftDay(token, cron));
            }
        }
        return String.join(",", out);
    }

    // 0..7 (0 and 7 = Sunday) -> 1..7; names pass through for Quartz to resolve.
    private static String shiftDay(String token, String cron) {
        if (token.isEmpty()) {
            throw new ValidationException("Invalid day-of-week in cron expression: " + cron);
        }
        if (!token.chars().allMatch(Character::isDigit)) {
            return token.toUpperCase(Locale.ROOT);
        }
        int day = Integer.parseInt(token);
        if (day > 7) {
            throw new ValidationException("Invalid day-of-week " + day + " in cron expression: " + cron);
        }
        return String.valueOf(day % 7 + 1);
    }
}
