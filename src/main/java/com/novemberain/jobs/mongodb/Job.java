package com.novemberain.jobs.mongodb;

import com.novemberain.jobs.mongodb.schedule.DateExpression;
import com.novemberain.jobs.mongodb.schedule.NextRunCalculator;
import com.novemberain.jobs.mongodb.util.Clock;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.novemberain.jobs.mongodb.Constants.*;

/**
 * A persistable unit of scheduled work.
 *
 * <p>State lives in {@link JobAttributes}, which records every attribute written since
 * the last {@link #save()} so that only those fields reach the store. The owning
 * {@link JobScheduler} supplies handlers, the store and the clock. It is held apart
 * from the attributes and is never persisted.</p>
 *
 * <p>A job is not thread safe. Each instance belongs to one worker at a time, and
 * exclusive execution across workers comes from the {@code lockedAt} claim made
 * through {@link JobScheduler#lockJob(Job)}.</p>
 */
public class Job {

    private static final Logger log = LoggerFactory.getLogger(Job.class);

    static final String UNKNOWN_FAILURE = "Unknown failure";
    static final String UNDEFINED_JOB = "Undefined job";
    static final String INVALID_REPEAT_INTERVAL = "failed to calculate nextRunAt due to invalid repeat interval";
    static final String INVALID_REPEAT_AT = "failed to calculate repeatAt time due to invalid format";

    private final JobScheduler scheduler;
    private final JobAttributes attrs;
    private boolean removed;

    public Job(JobScheduler scheduler, String name) {
        this(scheduler, Collections.singletonMap(JOB_NAME, name));
    }

    /**
     * Creates a new job. Priority is normalised with {@link Priority#parseOrDefault(Object)},
     * {@code nextRunAt} defaults to now and {@code type} to {@code once}. Every resulting
     * attribute is pending for the first save.
     *
     * @param scheduler owner of the job
     * @param fields    initial attributes
     */
    public Job(JobScheduler scheduler, Map<String, ?> fields) {
        this.scheduler = scheduler;
        Map<String, Object> initial = new LinkedHashMap<>(fields);

        Object requestedPriority = initial.get(JOB_PRIORITY);
        if (requestedPriority != null && Priority.parse(requestedPriority) == null) {
            log.debug("Unknown priority '{}' for job {}, using {}", requestedPriority,
                    initial.get(JOB_NAME), Priority.NORMAL.value());
        }
        initial.put(JOB_PRIORITY, Priority.parseOrDefault(requestedPriority));

        if (initial.get(JOB_NEXT_RUN_AT) == null) {
            initial.put(JOB_NEXT_RUN_AT, clock().now());
        }
        Object type = initial.get(JOB_TYPE);
        if (type == null) {
            initial.put(JOB_TYPE, JobType.ONCE.value());
        } else if (type instanceof JobType) {
            initial.put(JOB_TYPE, ((JobType) type).value());
        }
        this.attrs = JobAttributes.tracking(initial);
    }

    private Job(JobScheduler scheduler, JobAttributes attrs) {
        this.scheduler = scheduler;
        this.attrs = attrs;
    }

    /**
     * Rebuilds a job from its stored attributes, verbatim and with nothing pending.
     */
    public static Job restore(JobScheduler scheduler, Map<String, ?> stored) {
        return new Job(scheduler, JobAttributes.restored(stored));
    }

    public JobScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Direct access to the attributes. Writes made here are saved like any other change.
     */
    public JobAttributes attributes() {
        return attrs;
    }

    public Object getId() {
        return attrs.get(JOB_ID);
    }

    public String getName() {
        return attrs.get(JOB_NAME, String.class);
    }

    public JobType getType() {
        return JobType.fromValue(attrs.get(JOB_TYPE, String.class));
    }

    public int getPriority() {
        Number priority = attrs.get(JOB_PRIORITY, Number.class);
        return priority != null ? priority.intValue() : Priority.NORMAL.value();
    }

    public Object getData() {
        return attrs.get(JOB_DATA);
    }

    public Job setData(Object data) {
        attrs.set(JOB_DATA, data);
        return this;
    }

    public Date getNextRunAt() {
        return attrs.get(JOB_NEXT_RUN_AT, Date.class);
    }

    public Date getLastRunAt() {
        return attrs.get(JOB_LAST_RUN_AT, Date.class);
    }

    public Date getLastFinishedAt() {
        return attrs.get(JOB_LAST_FINISHED_AT, Date.class);
    }

    public Date getLockedAt() {
        return attrs.get(JOB_LOCKED_AT, Date.class);
    }

    public boolean isLocked() {
        return getLockedAt() != null;
    }

    public boolean isDisabled() {
        return Boolean.TRUE.equals(attrs.get(JOB_DISABLED));
    }

    public String getRepeatInterval() {
        return attrs.get(JOB_REPEAT_INTERVAL, String.class);
    }

    public String getRepeatTimezone() {
        return attrs.get(JOB_REPEAT_TIMEZONE, String.class);
    }

    public String getRepeatAt() {
        return attrs.get(JOB_REPEAT_AT, String.class);
    }

    public boolean isRecurring() {
        return getRepeatInterval() != null || getRepeatAt() != null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getUnique() {
        return attrs.get(JOB_UNIQUE, Map.class);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getUniqueOptions() {
        return attrs.get(JOB_UNIQUE_OPTS, Map.class);
    }

    public Date getFailedAt() {
        return attrs.get(JOB_FAILED_AT, Date.class);
    }

    public String getFailReason() {
        return attrs.get(JOB_FAIL_REASON, String.class);
    }

    public int getFailCount() {
        Number failCount = attrs.get(JOB_FAIL_COUNT, Number.class);
        return failCount != null ? failCount.intValue() : 0;
    }

    public boolean isRemoved() {
        return removed;
    }

    /**
     * Sets when the job becomes due. Does not save.
     */
    public Job schedule(Date when) {
        attrs.set(JOB_NEXT_RUN_AT, when);
        return this;
    }

    /**
     * Sets when the job becomes due from an expression such as {@code "in 10 minutes"},
     * {@code "tomorrow at 9am"} or an ISO-8601 date. An expression that cannot be resolved
     * is recorded with {@link #fail(Object)} and {@code nextRunAt} is left as it was.
     */
    public Job schedule(String when) {
        try {
            Date nextRunAt = DateExpression.parse(when, clock(), NextRunCalculator.resolveZone(getRepeatTimezone()));
            attrs.set(JOB_NEXT_RUN_AT, nextRunAt);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot schedule job {} at '{}': {}", getName(), when, e.getMessage());
            fail("failed to parse schedule '" + when + "': " + e.getMessage());
        }
        return this;
    }

    public Job repeatEvery(String interval) {
        return repeatEvery(interval, RepeatOptions.defaults());
    }

    /**
     * Makes the job recur on a cron expression or a human readable interval. Unless
     * {@link RepeatOptions#isSkipImmediate()} is set, the current {@code nextRunAt} is kept
     * so the first run happens right away. With it, the first occurrence is counted from
     * the current {@code nextRunAt}.
     */
    public Job repeatEvery(String interval, RepeatOptions options) {
        attrs.set(JOB_REPEAT_INTERVAL, interval);
        attrs.set(JOB_REPEAT_TIMEZONE, options.getTimezone());
        if (options.isSkipImmediate()) {
            Date nextRunAt = getNextRunAt();
            computeNextRunAt(nextRunAt != null ? nextRunAt : clock().now());
        }
        return this;
    }

    /**
     * Makes the job recur daily at a time of day such as {@code "3:30pm"}.
     */
    public Job repeatAt(String time) {
        attrs.set(JOB_REPEAT_AT, time);
        return this;
    }

    /**
     * Derives {@code nextRunAt} from the recurrence, counting from {@code lastRunAt} or, before
     * the first run, from now. {@code repeatInterval} wins over {@code repeatAt}; without either
     * nothing changes. A recurrence that cannot be evaluated clears {@code nextRunAt} and is
     * recorded with {@link #fail(Object)}.
     */
    public Job computeNextRunAt() {
        Date lastRunAt = getLastRunAt();
        return computeNextRunAt(lastRunAt != null ? lastRunAt : clock().now());
    }

    private Job computeNextRunAt(Date base) {
        String interval = getRepeatInterval();
        String repeatAt = getRepeatAt();
        if (interval != null) {
            try {
                attrs.set(JOB_NEXT_RUN_AT, NextRunCalculator.fromInterval(interval, getRepeatTimezone(), base));
            } catch (IllegalArgumentException e) {
                log.warn("Job {} has an invalid repeat interval '{}': {}", getName(), interval, e.getMessage());
                attrs.set(JOB_NEXT_RUN_AT, null);
                fail(INVALID_REPEAT_INTERVAL);
            }
        } else if (repeatAt != null) {
            try {
                attrs.set(JOB_NEXT_RUN_AT, NextRunCalculator.fromRepeatAt(repeatAt, getRepeatTimezone(), base));
            } catch (IllegalArgumentException e) {
                log.warn("Job {} has an invalid repeatAt '{}': {}", getName(), repeatAt, e.getMessage());
                attrs.set(JOB_NEXT_RUN_AT, null);
                fail(INVALID_REPEAT_AT);
            }
        }
        return this;
    }

    public Job unique(Map<String, ?> query) {
        return unique(query, false);
    }

    /**
     * Records a uniqueness constraint. The store upserts on it instead of inserting a duplicate.
     *
     * @param query       fields identifying the single allowed job, e.g. {@code {"data.userId": 42}}
     * @param insertOnly  when true an existing matching job is left untouched
     */
    public Job unique(Map<String, ?> query, boolean insertOnly) {
        attrs.set(JOB_UNIQUE, new Document(new LinkedHashMap<String, Object>(query)));
        attrs.set(JOB_UNIQUE_OPTS, new Document(UNIQUE_INSERT_ONLY, insertOnly));
        return this;
    }

    /**
     * @param priority number, {@link Priority} or level name; anything else becomes {@code 0}
     */
    public Job priority(Object priority) {
        attrs.set(JOB_PRIORITY, Priority.parseOrDefault(priority));
        return this;
    }

    public Job disable() {
        attrs.set(JOB_DISABLED, true);
        return this;
    }

    public Job enable() {
        attrs.set(JOB_DISABLED, false);
        return this;
    }

    /**
     * Records a failure: reason, time and one more failure in the count. Never throws.
     *
     * @param reason a {@link Throwable}, whose message is used, or any other value
     */
    public Job fail(Object reason) {
        String failReason = describe(reason);
        Date now = clock().now();
        attrs.set(JOB_FAIL_REASON, failReason);
        attrs.set(JOB_FAIL_COUNT, getFailCount() + 1);
        attrs.set(JOB_FAILED_AT, now);
        attrs.set(JOB_LAST_FINISHED_AT, now);
        log.debug("Job {} failed with reason '{}', failCount {}", getName(), failReason, getFailCount());
        return this;
    }

    /**
     * @return true between the start of a run and its end
     */
    public boolean isRunning() {
        Date lastRunAt = getLastRunAt();
        if (lastRunAt == null) {
            return false;
        }
        Date lastFinishedAt = getLastFinishedAt();
        return lastFinishedAt == null || lastRunAt.after(lastFinishedAt);
    }

    /**
     * Runs the job's handler and records the outcome.
     *
     * <p>Marks {@code lastRunAt} and saves, then invokes the handler registered for the job's
     * name. Success sets {@code lastFinishedAt}; a missing definition or a handler exception
     * goes to {@link #fail(Object)}. Afterwards a recurring job gets its next occurrence, a
     * one-shot job is never due again, the claim is released and the job is saved.</p>
     *
     * @throws JobStoreException when either save fails; nothing the handler throws, errors
     *                           included, leaves this method
     */
    public Job run() throws JobStoreException {
        if (removed) {
            log.warn("Job {} ({}) was removed, not running it", getName(), getId());
            return this;
        }
        String name = getName();
        attrs.set(JOB_LAST_RUN_AT, clock().now());
        log.debug("Job {} ({}) starting", name, getId());
        save();
        scheduler.fireStarted(this);

        Throwable failure = null;
        JobDefinition definition = scheduler.getDefinition(name);
        if (definition == null) {
            failure = new IllegalStateException(UNDEFINED_JOB);
        } else {
            try {
                definition.getHandler().execute(this);
            } catch (Throwable t) {
                failure = t;
            }
        }

        if (failure == null) {
            attrs.set(JOB_LAST_FINISHED_AT, clock().now());
            log.debug("Job {} ({}) succeeded", name, getId());
        } else {
            log.warn("Job {} ({}) failed", name, getId(), failure);
            fail(failure);
        }

        if (isRecurring()) {
            computeNextRunAt();
        } else {
            attrs.set(JOB_NEXT_RUN_AT, null);
        }
        attrs.set(JOB_LOCKED_AT, null);
        save();

        if (failure == null) {
            scheduler.fireSucceeded(this);
        } else {
            scheduler.fireFailed(this, failure);
        }
        scheduler.fireCompleted(this);
        return this;
    }

    /**
     * Writes the attributes changed since the previous save. Safe to call with nothing
     * pending. If the store fails, the changes stay pending for the next attempt.
     */
    public Job save() throws JobStoreException {
        if (removed) {
            log.debug("Job {} ({}) was removed, not saving it", getName(), getId());
            return this;
        }
        Set<String> changes = attrs.takeChanges();
        Map<String, Object> assigned;
        try {
            assigned = store().saveJob(this, changes);
        } catch (JobStoreException e) {
            attrs.markChanged(changes);
            throw e;
        }
        for (Map.Entry<String, Object> entry : assigned.entrySet()) {
            attrs.restore(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Deletes the stored job. The instance stays readable but is neither saved nor run again.
     *
     * @return true if a stored job was deleted
     */
    public boolean remove() throws JobStoreException {
        boolean deleted = store().removeJob(this);
        removed = true;
        log.debug("Job {} ({}) removed: {}", getName(), getId(), deleted);
        return deleted;
    }

    /**
     * Renews the claim of a long running job so that it is not taken over.
     */
    public Job touch() throws JobStoreException {
        attrs.set(JOB_LOCKED_AT, clock().now());
        return save();
    }

    /**
     * @return snapshot of the persisted attributes
     */
    public Document toDocument() {
        return new JobConverter().toSnapshot(this);
    }

    public String toJson() {
        return toDocument().toJson();
    }

    @Override
    public String toString() {
        return "Job{name='" + getName() + "', id=" + getId() + ", nextRunAt=" + getNextRunAt() + '}';
    }

    private Clock clock() {
        return scheduler.getClock();
    }

    private JobStore store() {
        return scheduler.getJobStore();
    }

    private static String describe(Object reason) {
        String described;
        if (reason instanceof Throwable) {
            Throwable cause = (Throwable) reason;
            described = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        } else {
            described = reason == null ? null : String.valueOf(reason);
        }
        return described == null || described.isEmpty() ? UNKNOWN_FAILURE : described;
    }
}
