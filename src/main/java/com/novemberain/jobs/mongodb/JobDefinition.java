package com.novemberain.jobs.mongodb;

/**
 * Binds a job name to its handler, with defaults for jobs created under that name.
 */
public class JobDefinition {

    private final String name;
    private final JobHandler handler;
    private final int priority;
    private final long lockLifetimeMillis;

    public JobDefinition(String name, JobHandler handler) {
        this(name, handler, Priority.NORMAL.value(), Constants.DEFAULT_LOCK_LIFETIME_MILLIS);
    }

    /**
     * @param priority            priority given to jobs created by {@link JobScheduler#create(String, Object)}
     * @param lockLifetimeMillis  how long a claim stays valid before another worker may take the job over
     */
    public JobDefinition(String name, JobHandler handler, int priority, long lockLifetimeMillis) {
        if (name == null || handler == null) {
            throw new IllegalArgumentException("Job definition needs a name and a handler");
        }
        this.name = name;
        this.handler = handler;
        this.priority = priority;
        this.lockLifetimeMillis = lockLifetimeMillis;
    }

    public String getName() {
        return name;
    }

    public JobHandler getHandler() {
        return handler;
    }

    public int getPriority() {
        return priority;
    }

    public long getLockLifetimeMillis() {
        return lockLifetimeMillis;
    }

    @Override
    public String toString() {
        return "JobDefinition{name='" + name + "', priority=" + priority
                + ", lockLifetimeMillis=" + lockLifetimeMillis + '}';
    }
}
