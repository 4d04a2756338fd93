package io.guildcron.utils;

import io.guildcron.core.EventWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Monday-to-Monday event window arithmetic in civil (wall-clock) time, so DST transitions are resolved
 * by the zone rules rather than by fixed offsets.
 */
public class TimeWindowCalculator {
    private static final Logger log = LoggerFactory.getLogger(TimeWindowCalculator.class);

    private static final LocalTime WINDOW_START = LocalTime.NOON;
    private static final LocalTime WINDOW_END = LocalTime.of(11, 59);

    private final Clock clock;

    public TimeWindowCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Today at 12:00 if it is Monday and local time is still within the 12:00 minute; otherwise the
     * upcoming Monday at 12:00. A timer due at noon wakes slightly late, so seconds are ignored.
     */
    public Instant nextMondayNoon(ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));

        LocalDate date = now.toLocalDate();
        boolean useToday = now.getDayOfWeek() == DayOfWeek.MONDAY
                && !now.toLocalTime().truncatedTo(ChronoUnit.MINUTES).isAfter(WINDOW_START);
        if (!useToday) {
            date = date.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
        }

        ZonedDateTime target = ZonedDateTime.of(date, WINDOW_START, zone);
        log.debug("guildcron next Monday noon now={} target={}", now, target);
        return target.toInstant();
    }

    public Instant nextMondayNoon(String timezone) {
        return nextMondayNoon(CronExpressionBuilder.requireZone(timezone));
    }

    /**
     * {@code start} plus 7 civil days, at 11:59:00 local.
     */
    public Instant followingMondayEnd(Instant start, ZoneId zone) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        LocalDate endDate = start.atZone(zone).toLocalDate().plusDays(7);
        return ZonedDateTime.of(endDate, WINDOW_END, zone).toInstant();
    }

    public Instant followingMondayEnd(Instant start, String timezone) {
        return followingMondayEnd(start, CronExpressionBuilder.requireZone(timezone));
    }

    public EventWindow eventWindow(ZoneId zone) {
        Instant start = nextMondayNoon(zone);
        Instant end = followingMondayEnd(start, zone);
        log.info("guildcron event window calculated start={} end={} timezone={}", start, end, zone);
        return new EventWindow(start, end, zone);
    }

    public EventWindow eventWindow(String timezone) {
        return eventWindow(CronExpressionBuilder.requireZone(timezone));
    }
}
