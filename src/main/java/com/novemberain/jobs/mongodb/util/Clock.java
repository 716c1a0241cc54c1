package com.novemberain.jobs.mongodb.util;

import java.util.Date;

/**
 * Source of the current time for job timestamps, lock deadlines and recurrence.
 */
public abstract class Clock {

    /**
     * Return current time in millis.
     */
    public abstract long millis();

    /**
     * Return current Date.
     */
    public Date now() {
        return new Date(millis());
    }

    /**
     * Default implementation that returns system time.
     */
    public static final Clock SYSTEM_CLOCK = new Clock() {
        @Override
        public long millis() {
            return System.currentTimeMillis();
        }
    };

    /**
     * Clock frozen at the given instant.
     */
    public static Clock fixed(final Date instant) {
        final long millis = instant.getTime();
        return new Clock() {
            @Override
            public long millis() {
                return millis;
            }
        };
    }
}
