package com.novemberain.jobs.mongodb;

/**
 * Receives lifecycle events of jobs run through a {@link JobScheduler}.
 * Exceptions thrown by a listener are logged and do not affect the job.
 */
public interface JobListener {

    default void jobStarted(Job job) {
    }

    default void jobSucceeded(Job job) {
    }

    default void jobFailed(Job job, Throwable cause) {
    }

    /**
     * Called after every run, successful or not.
     */
    default void jobCompleted(Job job) {
    }
}
