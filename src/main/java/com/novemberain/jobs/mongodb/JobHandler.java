package com.novemberain.jobs.mongodb;

/**
 * Work performed when a job of a given name runs.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @param job the running job, its data and attributes may be read and changed
     * @throws Exception any failure, recorded on the job with {@link Job#fail(Object)}
     */
    void execute(Job job) throws Exception;
}
