package com.novemberain.jobs.mongodb.util;

import java.util.Date;

/**
 * Decides when a job's {@code lockedAt} claim is stale and may be taken over.
 */
public class ExpiryCalculator {

    private final Clock clock;
    private final long defaultLockLifetimeMillis;

    public ExpiryCalculator(Clock clock, long defaultLockLifetimeMillis) {
        this.clock = clock;
        this.defaultLockLifetimeMillis = defaultLockLifetimeMillis;
    }

    public long getDefaultLockLifetimeMillis() {
        return defaultLockLifetimeMillis;
    }

    /**
     * Locks taken at or before the returned date are expired.
     *
     * @param lockLifetimeMillis lifetime of a claim, non-positive means the default
     */
    public Date lockDeadline(long lockLifetimeMillis) {
        return new Date(clock.millis() - effectiveLifetime(lockLifetimeMillis));
    }

    private long effectiveLifetime(long lockLifetimeMillis) {
        return lockLifetimeMillis > 0 ? lockLifetimeMillis : defaultLockLifetimeMillis;
    }
}
