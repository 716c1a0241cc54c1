package com.novemberain.jobs.mongodb;

import com.mongodb.MongoException;
import com.novemberain.jobs.mongodb.dao.JobDao;
import com.novemberain.jobs.mongodb.db.MongoConnector;
import com.novemberain.jobs.mongodb.util.Clock;
import com.novemberain.jobs.mongodb.util.JobQueries;
import org.bson.Document;
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
import java.util.Set;

import static com.novemberain.jobs.mongodb.Constants.*;

public class MongoJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final JobDao jobDao;
    private final JobConverter jobConverter = new JobConverter();
    private final Clock clock;
    private final String instanceName;
    private final MongoConnector mongoConnector;

    public MongoJobStore(JobDao jobDao, Clock clock, String instanceName) {
        this(jobDao, clock, instanceName, null);
    }

    public MongoJobStore(MongoConnector mongoConnector, String collectionName, Clock clock, String instanceName) {
        this(new JobDao(mongoConnector.getCollection(collectionName)), clock, instanceName, mongoConnector);
    }

    private MongoJobStore(JobDao jobDao, Clock clock, String instanceName, MongoConnector mongoConnector) {
        this.jobDao = jobDao;
        this.clock = clock;
        this.instanceName = instanceName;
        this.mongoConnector = mongoConnector;
    }

    @Override
    public Map<String, Object> saveJob(Job job, Set<String> changedKeys) throws JobStoreException {
        try {
            Object id = job.getId();
            if (id != null) {
                updateChanged(job, id, changedKeys);
                return Collections.emptyMap();
            }
            if (job.getType() == JobType.SINGLE) {
                return saveSingle(job);
            }
            if (job.getUnique() != null) {
                return saveUnique(job);
            }
            return insert(job);
        } catch (MongoException e) {
            log.error("Saving job {} failed because: {}", job.getName(), e.getMessage(), e);
            throw new JobStoreException("Could not save job " + job.getName(), e);
        }
    }

    @Override
    public boolean lockJob(Job job, Date lockDeadline) throws JobStoreException {
        Object id = job.getId();
        if (id == null) {
            log.warn("Job {} has never been saved, it cannot be locked", job.getName());
            return false;
        }
        Document claimed;
        try {
            claimed = jobDao.claim(JobQueries.lockableJob(id, job.getNextRunAt(), lockDeadline), null, clock.now());
        } catch (MongoException e) {
            log.error("Locking job {} failed because: {}", job.getName(), e.getMessage(), e);
            throw new JobStoreException("Could not lock job " + job.getName(), e);
        }
        if (claimed == null) {
            log.debug("Job {} ({}) is already locked or no longer due", job.getName(), id);
            return false;
        }
        job.attributes().restore(JOB_LOCKED_AT, claimed.getDate(JOB_LOCKED_AT));
        log.debug("Locked job {} ({}) at {}", job.getName(), id, job.getLockedAt());
        return true;
    }

    @Override
    public Job lockNextJob(JobScheduler owner, String name, Date nextScanAt, Date lockDeadline)
            throws JobStoreException {
        Document claimed;
        try {
            claimed = jobDao.claim(JobQueries.nextDueJob(name, nextScanAt, lockDeadline),
                    JobQueries.NEXT_JOB_SORT, clock.now());
        } catch (MongoException e) {
            log.error("Locking next {} job failed because: {}", name, e.getMessage(), e);
            throw new JobStoreException("Could not lock next job " + name, e);
        }
        if (claimed == null) {
            return null;
        }
        log.debug("Locked next job {} ({})", name, claimed.get(JOB_ID));
        return jobConverter.toJob(owner, claimed);
    }

    @Override
    public boolean removeJob(Job job) throws JobStoreException {
        Object id = job.getId();
        if (id == null) {
            return false;
        }
        try {
            return jobDao.remove(id);
        } catch (MongoException e) {
            throw new JobStoreException("Could not remove job " + job.getName(), e);
        }
    }

    @Override
    public long removeJobs(Bson query) throws JobStoreException {
        try {
            long removed = jobDao.remove(query);
            log.debug("Removed {} jobs", removed);
            return removed;
        } catch (MongoException e) {
            throw new JobStoreException("Could not remove jobs", e);
        }
    }

    @Override
    public List<Job> findJobs(JobScheduler owner, Bson query) throws JobStoreException {
        List<Document> docs;
        try {
            docs = jobDao.find(query, JobQueries.NEXT_JOB_SORT);
        } catch (MongoException e) {
            throw new JobStoreException("Could not query jobs", e);
        }
        List<Job> jobs = new ArrayList<>(docs.size());
        for (Document doc : docs) {
            jobs.add(jobConverter.toJob(owner, doc));
        }
        return jobs;
    }

    @Override
    public long setDisabled(Bson query, boolean disabled) throws JobStoreException {
        try {
            return jobDao.setDisabled(query, disabled);
        } catch (MongoException e) {
            throw new JobStoreException("Could not " + (disabled ? "disable" : "enable") + " jobs", e);
        }
    }

    @Override
    public long purge(Collection<String> definedNames) throws JobStoreException {
        log.info("Purging jobs other than {}", definedNames);
        return removeJobs(JobQueries.undefinedJobs(definedNames));
    }

    @Override
    public void ensureIndexes() throws JobStoreException {
        try {
            jobDao.createIndex();
        } catch (MongoException e) {
            throw new JobStoreException("Could not create indexes on jobs collection", e);
        }
    }

    @Override
    public void shutdown() {
        if (mongoConnector != null) {
            mongoConnector.close();
        }
    }

    private void updateChanged(Job job, Object id, Set<String> changedKeys) {
        if (changedKeys.isEmpty()) {
            log.trace("Nothing to save for job {} ({})", job.getName(), id);
            return;
        }
        Document set = jobConverter.toSetDocument(job, changedKeys);
        Document unset = jobConverter.toUnsetDocument(job, changedKeys);
        set.put(JOB_LAST_MODIFIED_BY, instanceName);
        if (!jobDao.update(id, set, unset)) {
            log.warn("Job {} ({}) no longer exists, changes to {} were dropped", job.getName(), id, changedKeys);
        }
    }

    /**
     * A past {@code nextRunAt} only applies when the record is created, so saving
     * the definition again does not reschedule an existing single job.
     */
    private Map<String, Object> saveSingle(Job job) {
        Document props = jobConverter.toDocument(job);
        props.put(JOB_LAST_MODIFIED_BY, instanceName);
        Document update = new Document("$set", props);

        Date nextRunAt = job.getNextRunAt();
        if (nextRunAt != null && !nextRunAt.after(clock.now())) {
            props.remove(JOB_NEXT_RUN_AT);
            update.put("$setOnInsert", new Document(JOB_NEXT_RUN_AT, nextRunAt));
        }
        log.debug("Upserting single job {}", job.getName());
        return assigned(jobDao.upsert(JobQueries.singleJob(job.getName()), update));
    }

    private Map<String, Object> saveUnique(Job job) {
        Document props = jobConverter.toDocument(job);
        props.put(JOB_LAST_MODIFIED_BY, instanceName);
        Map<String, Object> uniqueOpts = job.getUniqueOptions();
        boolean insertOnly = uniqueOpts != null && Boolean.TRUE.equals(uniqueOpts.get(UNIQUE_INSERT_ONLY));
        Document update = new Document(insertOnly ? "$setOnInsert" : "$set", props);
        log.debug("Upserting unique job {} on {}", job.getName(), job.getUnique());
        return assigned(jobDao.upsert(JobQueries.uniqueJob(job.getUnique(), job.getName()), update));
    }

    private Map<String, Object> insert(Job job) {
        Document doc = jobConverter.toDocument(job);
        doc.put(JOB_LAST_MODIFIED_BY, instanceName);
        Object id = jobDao.insert(doc);
        log.debug("Inserted job {} ({})", job.getName(), id);
        return Collections.<String, Object>singletonMap(JOB_ID, id);
    }

    private Map<String, Object> assigned(Document stored) {
        Map<String, Object> assigned = new LinkedHashMap<>();
        if (stored != null) {
            assigned.put(JOB_ID, stored.get(JOB_ID));
            assigned.put(JOB_NEXT_RUN_AT, stored.get(JOB_NEXT_RUN_AT));
        }
        return assigned;
    }
}
