package com.novemberain.jobs.mongodb;

/**
 * Options of {@link Job#repeatEvery(String, RepeatOptions)}.
 */
public class RepeatOptions {

    private String timezone;
    private boolean skipImmediate;

    public static RepeatOptions defaults() {
        return new RepeatOptions();
    }

    /**
     * Zone in which cron expressions and times of day are evaluated, e.g. {@code "Europe/Berlin"}.
     */
    public RepeatOptions withTimezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    /**
     * Do not run right away, wait for the first occurrence of the interval instead.
     */
    public RepeatOptions skipImmediate(boolean skipImmediate) {
        this.skipImmediate = skipImmediate;
        return this;
    }

    public String getTimezone() {
        return timezone;
    }

    public boolean isSkipImmediate() {
        return skipImmediate;
    }
}
