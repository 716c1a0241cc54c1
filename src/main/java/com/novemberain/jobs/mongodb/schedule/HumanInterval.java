package com.novemberain.jobs.mongodb.schedule;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses human readable durations such as {@code "1 day"}, {@code "3 days and 4 hours"},
 * {@code "1.5 hours"} or {@code "one minute"} into milliseconds. A bare number is
 * taken as milliseconds.
 */
public final class HumanInterval {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long YEAR = 365 * DAY;

    /**
     * Longest accepted duration. Dates a thousand years out are well inside the range of {@link java.util.Date}.
     */
    public static final long MAX_MILLIS = 1000 * YEAR;

    private static final Pattern MILLIS = Pattern.compile("^\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern SEPARATORS = Pattern.compile("(,|\\band\\b)");

    private static final Map<String, Long> UNITS = new HashMap<>();
    private static final Map<String, Integer> NUMBERS = new HashMap<>();

    static {
        unit(1L, "millisecond", "ms");
        unit(SECOND, "second", "sec");
        unit(MINUTE, "minute", "min");
        unit(HOUR, "hour", "hr");
        unit(DAY, "day");
        unit(7 * DAY, "week");
        unit(30 * DAY, "month");
        unit(YEAR, "year");

        String[] words = {"zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
                "ten", "eleven", "twelve"};
        for (int i = 0; i < words.length; i++) {
            NUMBERS.put(words[i], i);
        }
        NUMBERS.put("a", 1);
        NUMBERS.put("an", 1);
    }

    private HumanInterval() {
    }

    /**
     * @param interval duration expression
     * @return positive duration in milliseconds, at most {@link #MAX_MILLIS}
     * @throws IllegalArgumentException if the expression is not a duration or is out of range
     */
    public static long parse(String interval) {
        if (interval == null || interval.trim().isEmpty()) {
            throw new IllegalArgumentException("interval is required");
        }
        String normalized = interval.trim().toLowerCase(Locale.ROOT);
        if (MILLIS.matcher(normalized).matches()) {
            return positive(Double.parseDouble(normalized), interval);
        }

        String[] tokens = SEPARATORS.matcher(normalized).replaceAll(" ").trim().split("\\s+");
        if (tokens.length % 2 != 0) {
            throw new IllegalArgumentException("unbalanced duration expression: " + interval);
        }
        double total = 0;
        for (int i = 0; i < tokens.length; i += 2) {
            total += amount(tokens[i], interval) * unitMillis(tokens[i + 1], interval);
        }
        return positive(total, interval);
    }

    private static void unit(long millis, String... names) {
        for (String name : names) {
            UNITS.put(name, millis);
            UNITS.put(name + "s", millis);
        }
    }

    private static double amount(String token, String interval) {
        if (DECIMAL.matcher(token).matches()) {
            return Double.parseDouble(token);
        }
        Integer word = NUMBERS.get(token);
        if (word == null) {
            throw new IllegalArgumentException("not a number '" + token + "' in: " + interval);
        }
        return word;
    }

    private static long unitMillis(String token, String interval) {
        Long millis = UNITS.get(token);
        if (millis == null) {
            throw new IllegalArgumentException("unknown time unit '" + token + "' in: " + interval);
        }
        return millis;
    }

    private static long positive(double millis, String interval) {
        if (millis <= 0) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        if (millis > MAX_MILLIS) {
            throw new IllegalArgumentException("interval is longer than 1000 years: " + interval);
        }
        return Math.round(millis);
    }
}
