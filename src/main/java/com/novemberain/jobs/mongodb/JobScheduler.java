package com.novemberain.jobs.mongodb;

import com.novemberain.jobs.mongodb.util.Clock;
import com.novemberain.jobs.mongodb.util.ExpiryCalculator;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.novemberain.jobs.mongodb.Constants.*;

/**
 * Owner of jobs: knows their handlers, the store they live in and the clock they read.
 * Polling for due jobs and dispatching them to workers is left to the caller, which
 * uses {@link #lockNextJob(String, Date)} and {@link Job#run()}.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final String name;
    private final JobStore jobStore;
    private final Clock clock;
    private final ExpiryCalculator expiryCalculator;
    private final Map<String, JobDefinition> definitions = new ConcurrentHashMap<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();

    public JobScheduler(String name, JobStore jobStore) {
        this(name, jobStore, Clock.SYSTEM_CLOCK, DEFAULT_LOCK_LIFETIME_MILLIS);
    }

    /**
     * @param name                       written to {@code lastModifiedBy} of saved jobs
     * @param defaultLockLifetimeMillis  claim lifetime of jobs whose definition sets none
     */
    public JobScheduler(String name, JobStore jobStore, Clock clock, long defaultLockLifetimeMillis) {
        this.name = name;
        this.jobStore = jobStore;
        this.clock = clock;
        this.expiryCalculator = new ExpiryCalculator(clock, defaultLockLifetimeMillis);
    }

    public String getName() {
        return name;
    }

    public JobStore getJobStore() {
        return jobStore;
    }

    public Clock getClock() {
        return clock;
    }

    public ExpiryCalculator getExpiryCalculator() {
        return expiryCalculator;
    }

    public JobDefinition define(String jobName, JobHandler handler) {
        return define(new JobDefinition(jobName, handler));
    }

    public JobDefinition define(JobDefinition definition) {
        JobDefinition previous = definitions.put(definition.getName(), definition);
        if (previous != null) {
            log.info("Replaced definition of job {}", definition.getName());
        } else {
            log.debug("Defined {}", definition);
        }
        return definition;
    }

    /**
     * @return handler and defaults for the name, or {@code null} if it was never defined
     */
    public JobDefinition getDefinition(String jobName) {
        return jobName == null ? null : definitions.get(jobName);
    }

    public Collection<String> getDefinedNames() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    /**
     * Creates an unsaved {@code normal} job with the priority of its definition.
     */
    public Job create(String jobName, Object data) {
        JobDefinition definition = getDefinition(jobName);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(JOB_NAME, jobName);
        fields.put(JOB_DATA, data);
        fields.put(JOB_TYPE, JobType.NORMAL.value());
        fields.put(JOB_PRIORITY, definition != null ? definition.getPriority() : Priority.NORMAL.value());
        return new Job(this, fields);
    }

    /**
     * Saves a {@code single} job repeating on {@code interval}; saving it again later updates
     * the same record instead of adding another.
     */
    public Job every(String interval, String jobName, Object data, RepeatOptions options)
            throws JobStoreException {
        Job job = create(jobName, data);
        job.attributes().set(JOB_TYPE, JobType.SINGLE.value());
        job.repeatEvery(interval, options);
        return job.save();
    }

    public Job schedule(String when, String jobName, Object data) throws JobStoreException {
        return create(jobName, data).schedule(when).save();
    }

    public Job now(String jobName, Object data) throws JobStoreException {
        return create(jobName, data).schedule(clock.now()).save();
    }

    public List<Job> jobs(Bson query) throws JobStoreException {
        return jobStore.findJobs(this, query);
    }

    public long cancel(Bson query) throws JobStoreException {
        return jobStore.removeJobs(query);
    }

    public long disable(Bson query) throws JobStoreException {
        return jobStore.setDisabled(query, true);
    }

    public long enable(Bson query) throws JobStoreException {
        return jobStore.setDisabled(query, false);
    }

    /**
     * Removes stored jobs that no definition of this scheduler can run.
     */
    public long purge() throws JobStoreException {
        return jobStore.purge(new ArrayList<>(definitions.keySet()));
    }

    /**
     * Claims a saved job for this worker.
     *
     * @return false when another worker holds a live claim or the job is no longer due
     */
    public boolean lockJob(Job job) throws JobStoreException {
        return jobStore.lockJob(job, lockDeadline(job.getName()));
    }

    /**
     * Claims the most urgent job of the given name due by {@code nextScanAt}, or one whose
     * claim has expired.
     */
    public Job lockNextJob(String jobName, Date nextScanAt) throws JobStoreException {
        return jobStore.lockNextJob(this, jobName, nextScanAt, lockDeadline(jobName));
    }

    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    public void removeListener(JobListener listener) {
        listeners.remove(listener);
    }

    public void shutdown() {
        log.info("Shutting down job scheduler {}", name);
        jobStore.shutdown();
    }

    void fireStarted(Job job) {
        for (JobListener listener : listeners) {
            try {
                listener.jobStarted(job);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on start of job {}", listener, job.getName(), e);
            }
        }
    }

    void fireSucceeded(Job job) {
        for (JobListener listener : listeners) {
            try {
                listener.jobSucceeded(job);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on success of job {}", listener, job.getName(), e);
            }
        }
    }

    void fireFailed(Job job, Throwable cause) {
        for (JobListener listener : listeners) {
            try {
                listener.jobFailed(job, cause);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on failure of job {}", listener, job.getName(), e);
            }
        }
    }

    void fireCompleted(Job job) {
        for (JobListener listener : listeners) {
            try {
                listener.jobCompleted(job);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on completion of job {}", listener, job.getName(), e);
            }
        }
    }

    private Date lockDeadline(String jobName) {
        JobDefinition definition = getDefinition(jobName);
        return expiryCalculator.lockDeadline(definition != null ? definition.getLockLifetimeMillis() : 0);
    }
}
