package com.novemberain.jobs.mongodb.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;

/**
 * Computes the next occurrence of a recurring job from its stored recurrence.
 * Results depend only on the arguments, so equal inputs give equal dates.
 */
public final class NextRunCalculator {

    private static final Logger log = LoggerFactory.getLogger(NextRunCalculator.class);

    private NextRunCalculator() {
    }

    /**
     * Next occurrence of {@code repeatInterval} after {@code base}. The interval is tried
     * as a cron expression first and then as a human readable duration.
     *
     * @throws IllegalArgumentException if the interval or the timezone is invalid
     */
    public static Date fromInterval(String repeatInterval, String repeatTimezone, Date base) {
        ZoneId zone = resolveZone(repeatTimezone);
        CronInterval cron;
        try {
            cron = CronInterval.parse(repeatInterval, TimeZone.getTimeZone(zone));
        } catch (IllegalArgumentException notCron) {
            log.trace("'{}' is not a cron expression: {}", repeatInterval, notCron.getMessage());
            return after(base, HumanInterval.parse(repeatInterval));
        }
        Date next = cron.nextAfter(base);
        if (next == null) {
            throw new IllegalArgumentException("cron expression never fires after " + base + ": " + repeatInterval);
        }
        return next;
    }

    /**
     * Next time the wall clock shows {@code repeatAt} after {@code base}.
     *
     * @throws IllegalArgumentException if the time of day or the timezone is invalid
     */
    public static Date fromRepeatAt(String repeatAt, String repeatTimezone, Date base) {
        return TimeOfDay.parse(repeatAt).nextAfter(base, resolveZone(repeatTimezone));
    }

    /**
     * @throws IllegalArgumentException if the result does not fit in a date
     */
    static Date after(Date base, long millis) {
        try {
            return new Date(Math.addExact(base.getTime(), millis));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("date out of range: " + millis + " ms after " + base, e);
        }
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown timezone: " + timezone, e);
        }
    }
}
