package com.novemberain.jobs.mongodb.schedule;

import com.novemberain.jobs.mongodb.util.Clock;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the "when" of {@code Job.schedule(String)} to an absolute date.
 *
 * <p>Understands {@code now}, {@code in 5 minutes}, {@code 2 hours from now},
 * {@code today at noon}, {@code tomorrow at 9am}, {@code tomorrow}, a bare time of
 * day (next occurrence), ISO-8601 instants and offset date-times, and local
 * {@code yyyy-MM-dd HH:mm}, {@code yyyy-MM-ddTHH:mm[:ss]} and {@code yyyy-MM-dd}
 * values interpreted in the given zone.</p>
 */
public final class DateExpression {

    private static final Pattern IN_PATTERN = Pattern.compile("^in\\s+(.+)$");
    private static final Pattern FROM_NOW_PATTERN = Pattern.compile("^(.+)\\s+from\\s+now$");
    private static final Pattern DAY_AT_PATTERN = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private DateExpression() {
    }

    /**
     * @throws IllegalArgumentException if the expression cannot be resolved
     */
    public static Date parse(String expression, Clock clock, ZoneId zone) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new IllegalArgumentException("time expression is required");
        }
        String trimmed = expression.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        Date now = clock.now();

        if ("now".equals(normalized)) {
            return now;
        }

        Matcher inMatcher = IN_PATTERN.matcher(normalized);
        if (inMatcher.matches()) {
            return NextRunCalculator.after(now, HumanInterval.parse(inMatcher.group(1)));
        }

        Matcher fromNowMatcher = FROM_NOW_PATTERN.matcher(normalized);
        if (fromNowMatcher.matches()) {
            return NextRunCalculator.after(now, HumanInterval.parse(fromNowMatcher.group(1)));
        }

        Matcher dayMatcher = DAY_AT_PATTERN.matcher(normalized);
        if (dayMatcher.matches()) {
            boolean tomorrow = "tomorrow".equals(dayMatcher.group(1));
            if (dayMatcher.group(2) == null) {
                return tomorrow ? Date.from(now.toInstant().atZone(zone).plusDays(1).toInstant()) : now;
            }
            LocalDate day = now.toInstant().atZone(zone).toLocalDate();
            if (tomorrow) {
                day = day.plusDays(1);
            }
            return TimeOfDay.parse(dayMatcher.group(2)).atDate(day, zone);
        }

        Date absolute = parseAbsolute(trimmed, zone);
        if (absolute != null) {
            return absolute;
        }

        try {
            return TimeOfDay.parse(normalized).nextAfter(now, zone);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unable to parse time expression: " + expression, e);
        }
    }

    private static Date parseAbsolute(String value, ZoneId zone) {
        try {
            return Date.from(Instant.parse(value));
        } catch (DateTimeParseException ignored) {
            // not an instant
        }
        try {
            return Date.from(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset
        }
        try {
            return Date.from(LocalDateTime.parse(value, DATE_TIME_SPACE).atZone(zone).toInstant());
        } catch (DateTimeParseException ignored) {
            // not space separated
        }
        try {
            return Date.from(LocalDateTime.parse(value).atZone(zone).toInstant());
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return Date.from(LocalDate.parse(value).atStartOfDay(zone).toInstant());
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
