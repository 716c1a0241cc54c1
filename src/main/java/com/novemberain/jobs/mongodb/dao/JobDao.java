package com.novemberain.jobs.mongodb.dao;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.UpdateResult;
import com.novemberain.jobs.mongodb.util.JobQueries;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static com.novemberain.jobs.mongodb.Constants.JOB_ID;

/**
 * Raw access to the jobs collection. Driver exceptions are left to the caller.
 */
public class JobDao {

    private static final Logger log = LoggerFactory.getLogger(JobDao.class);

    private final MongoCollection<Document> jobCollection;

    public JobDao(MongoCollection<Document> jobCollection) {
        this.jobCollection = jobCollection;
    }

    public void createIndex() {
        jobCollection.createIndex(JobQueries.nextJobIndexKeys(),
                new IndexOptions().name(JobQueries.NEXT_JOB_INDEX));
    }

    public List<Document> find(Bson filter, Bson sort) {
        return jobCollection.find(filter).sort(sort).into(new ArrayList<Document>());
    }

    /**
     * Inserts a new job, assigning its {@code _id} first if it has none.
     */
    public Object insert(Document job) {
        if (job.get(JOB_ID) == null) {
            job.put(JOB_ID, new ObjectId());
        }
        jobCollection.insertOne(job);
        return job.get(JOB_ID);
    }

    /**
     * Applies {@code $set} and {@code $unset} to a single job.
     *
     * @return false when there was nothing to write or the job no longer exists
     */
    public boolean update(Object id, Document set, Document unset) {
        Document update = new Document();
        if (!set.isEmpty()) {
            update.put("$set", set);
        }
        if (!unset.isEmpty()) {
            update.put("$unset", unset);
        }
        if (update.isEmpty()) {
            return false;
        }
        UpdateResult result = jobCollection.updateOne(JobQueries.byId(id), update);
        if (result.getMatchedCount() == 0) {
            log.debug("No job with id {} to update", id);
            return false;
        }
        return true;
    }

    /**
     * Upserts a job matching {@code filter} and returns it as stored.
     */
    public Document upsert(Bson filter, Document update) {
        return jobCollection.findOneAndUpdate(filter, update,
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER));
    }

    /**
     * Sets {@code lockedAt} on the first job matching {@code filter}.
     *
     * @return the claimed job, or {@code null} if nothing matched
     */
    public Document claim(Bson filter, Bson sort, Date lockedAt) {
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER);
        if (sort != null) {
            options.sort(sort);
        }
        return jobCollection.findOneAndUpdate(filter, JobQueries.lockUpdate(lockedAt), options);
    }

    public long setDisabled(Bson filter, boolean disabled) {
        return jobCollection.updateMany(filter, JobQueries.disabledUpdate(disabled)).getModifiedCount();
    }

    public boolean remove(Object id) {
        return jobCollection.deleteOne(JobQueries.byId(id)).getDeletedCount() > 0;
    }

    public long remove(Bson filter) {
        return jobCollection.deleteMany(filter).getDeletedCount();
    }
}
