package com.novemberain.jobs.mongodb.schedule;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.util.Date;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron recurrence evaluated with Quartz's {@link CronExpression}.
 *
 * <p>Accepts classic 5-field Unix expressions (minute precision, day-of-week {@code 0-7}
 * with Sunday as 0 or 7) and native 6- or 7-field Quartz expressions, whose
 * day-of-week keeps Quartz numbering (Sunday is 1). A {@code *} day-of-month or
 * day-of-week becomes {@code ?} where Quartz needs one. Expressions restricting both
 * day-of-month and day-of-week are rejected, Quartz cannot evaluate them.</p>
 */
public final class CronInterval {

    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+)(.*)$");

    private final CronExpression expression;

    private CronInterval(CronExpression expression) {
        this.expression = expression;
    }

    /**
     * @throws IllegalArgumentException if the spec is not a cron expression
     */
    public static CronInterval parse(String spec, TimeZone timeZone) {
        String quartzSpec = toQuartz(spec);
        try {
            CronExpression expression = new CronExpression(quartzSpec);
            expression.setTimeZone(timeZone);
            return new CronInterval(expression);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid cron expression '" + spec + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return first fire time strictly after {@code base}, or {@code null} if there is none
     */
    public Date nextAfter(Date base) {
        return expression.getNextValidTimeAfter(base);
    }

    public String getExpression() {
        return expression.getCronExpression();
    }

    static String toQuartz(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String[] parsed = spec.trim().split("\\s+");
        String[] fields;
        if (parsed.length == 5) {
            fields = new String[6];
            fields[0] = "0";
            System.arraycopy(parsed, 0, fields, 1, 5);
            fields[DAY_OF_WEEK] = toQuartzDayOfWeek(fields[DAY_OF_WEEK]);
        } else if (parsed.length == 6 || parsed.length == 7) {
            fields = parsed;
        } else {
            throw new IllegalArgumentException("cron expression needs 5 to 7 fields: " + spec);
        }

        String dayOfMonth = fields[DAY_OF_MONTH];
        String dayOfWeek = fields[DAY_OF_WEEK];
        if (!"?".equals(dayOfMonth) && !"?".equals(dayOfWeek)) {
            if ("*".equals(dayOfWeek)) {
                dayOfWeek = "?";
            } else if ("*".equals(dayOfMonth)) {
                dayOfMonth = "?";
            } else {
                throw new IllegalArgumentException(
                        "cron expressions restricting both day-of-month and day-of-week are not supported: " + spec);
            }
        }
        fields[DAY_OF_MONTH] = dayOfMonth;
        fields[DAY_OF_WEEK] = dayOfWeek;
        return String.join(" ", fields);
    }

    // Unix cron numbers Sunday as 0 (or 7), Quartz as 1.
    private static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            String item = items[i];
            String step = "";
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = item.substring(slash);
                item = item.substring(0, slash);
            }
            String[] bounds = item.split("-", -1);
            for (int j = 0; j < bounds.length; j++) {
                bounds[j] = shiftDay(bounds[j]);
            }
            items[i] = String.join("-", bounds) + step;
        }
        return String.join(",", items);
    }

    private static String shiftDay(String token) {
        Matcher matcher = LEADING_NUMBER.matcher(token);
        if (!matcher.matches()) {
            return token;
        }
        int day = Integer.parseInt(matcher.group(1));
        if (day > 7) {
            throw new IllegalArgumentException("day of week out of range: " + token);
        }
        return (day % 7 + 1) + matcher.group(2);
    }
}
