package com.novemberain.jobs.mongodb;

import org.bson.conversions.Bson;

import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable storage of jobs shared by every worker.
 */
public interface JobStore {

    /**
     * Persists a job. A stored job gets only {@code changedKeys} written; a new job is
     * inserted, or upserted when it is a {@code single} job or carries a uniqueness constraint.
     *
     * @param job          job to persist
     * @param changedKeys  attributes written since the previous save, may be empty
     * @return attributes assigned by the store, at least {@code _id} for a new job
     * @throws JobStoreException when the store rejects the write
     */
    Map<String, Object> saveJob(Job job, Set<String> changedKeys) throws JobStoreException;

    /**
     * Claims a stored job if it is still due at its {@code nextRunAt}, enabled, and either
     * unlocked or locked at or before {@code lockDeadline}.
     *
     * @return true when the claim succeeded, the job then carries the new {@code lockedAt}
     */
    boolean lockJob(Job job, Date lockDeadline) throws JobStoreException;

    /**
     * Claims the most urgent due job of the given name.
     *
     * @return the claimed job or {@code null}
     */
    Job lockNextJob(JobScheduler owner, String name, Date nextScanAt, Date lockDeadline) throws JobStoreException;

    boolean removeJob(Job job) throws JobStoreException;

    long removeJobs(Bson query) throws JobStoreException;

    List<Job> findJobs(JobScheduler owner, Bson query) throws JobStoreException;

    long setDisabled(Bson query, boolean disabled) throws JobStoreException;

    /**
     * Removes every job whose name is not among {@code definedNames}.
     */
    long purge(Collection<String> definedNames) throws JobStoreException;

    void ensureIndexes() throws JobStoreException;

    void shutdown();
}
