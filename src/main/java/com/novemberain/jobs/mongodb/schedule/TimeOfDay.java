package com.novemberain.jobs.mongodb.schedule;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A wall clock time such as {@code "3:30pm"}, {@code "15:00"}, {@code "noon"} or {@code "midnight"}.
 */
public final class TimeOfDay {

    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(?::(\\d{2}))?(am|pm)$");
    private static final Pattern TWENTY_FOUR = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");

    private final LocalTime time;

    private TimeOfDay(LocalTime time) {
        this.time = time;
    }

    /**
     * @throws IllegalArgumentException if the value is not a time of day
     */
    public static TimeOfDay parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("time of day is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (normalized.startsWith("at")) {
            normalized = normalized.substring(2);
        }
        if ("noon".equals(normalized)) {
            return new TimeOfDay(LocalTime.NOON);
        }
        if ("midnight".equals(normalized)) {
            return new TimeOfDay(LocalTime.MIDNIGHT);
        }

        Matcher meridiem = MERIDIEM.matcher(normalized);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1));
            if (hour < 1 || hour > 12) {
                throw new IllegalArgumentException("invalid hour in time of day: " + value);
            }
            hour = hour % 12;
            if ("pm".equals(meridiem.group(4))) {
                hour += 12;
            }
            return of(hour, meridiem.group(2), meridiem.group(3), value);
        }

        Matcher twentyFour = TWENTY_FOUR.matcher(normalized);
        if (twentyFour.matches()) {
            return of(Integer.parseInt(twentyFour.group(1)), twentyFour.group(2), twentyFour.group(3), value);
        }
        throw new IllegalArgumentException("invalid time of day: " + value);
    }

    public LocalTime getTime() {
        return time;
    }

    /**
     * @return the first moment strictly after {@code base} at this time of day in {@code zone}
     */
    public Date nextAfter(Date base, ZoneId zone) {
        ZonedDateTime from = base.toInstant().atZone(zone);
        ZonedDateTime candidate = on(from.toLocalDate(), zone);
        if (!candidate.isAfter(from)) {
            candidate = on(from.toLocalDate().plusDays(1), zone);
        }
        return Date.from(candidate.toInstant());
    }

    /**
     * @return this time of day on the given date
     */
    public Date atDate(LocalDate date, ZoneId zone) {
        return Date.from(on(date, zone).toInstant());
    }

    private ZonedDateTime on(LocalDate date, ZoneId zone) {
        return date.atTime(time).atZone(zone);
    }

    private static TimeOfDay of(int hour, String minutes, String seconds, String value) {
        int minute = minutes == null ? 0 : Integer.parseInt(minutes);
        int second = seconds == null ? 0 : Integer.parseInt(seconds);
        if (hour > 23 || minute > 59 || second > 59) {
            throw new IllegalArgumentException("invalid time of day: " + value);
        }
        return new TimeOfDay(LocalTime.of(hour, minute, second));
    }
}
