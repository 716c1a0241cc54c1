package com.novemberain.jobs.mongodb;

import org.bson.Document;

import java.util.Date;
import java.util.Map;
import java.util.Set;

import static com.novemberain.jobs.mongodb.Constants.JOB_ID;

/**
 * Converts between {@link Job} and mongo {@link Document}.
 */
public class JobConverter {

    /**
     * All attributes of a job, for inserts and upserts. The {@code _id} is left out.
     */
    public Document toDocument(Job job) {
        Document doc = new Document();
        for (Map.Entry<String, Object> entry : job.attributes().asMap().entrySet()) {
            if (!JOB_ID.equals(entry.getKey())) {
                doc.put(entry.getKey(), entry.getValue());
            }
        }
        return doc;
    }

    /**
     * Values of the changed keys the job still holds, for {@code $set}.
     */
    public Document toSetDocument(Job job, Set<String> changedKeys) {
        JobAttributes attrs = job.attributes();
        Document set = new Document();
        for (String key : changedKeys) {
            if (!JOB_ID.equals(key) && attrs.contains(key)) {
                set.put(key, attrs.get(key));
            }
        }
        return set;
    }

    /**
     * Changed keys the job no longer holds, for {@code $unset}.
     */
    public Document toUnsetDocument(Job job, Set<String> changedKeys) {
        JobAttributes attrs = job.attributes();
        Document unset = new Document();
        for (String key : changedKeys) {
            if (!JOB_ID.equals(key) && !attrs.contains(key)) {
                unset.put(key, "");
            }
        }
        return unset;
    }

    /**
     * Plain snapshot of the attributes. Dates are copied so callers cannot alter the job through it.
     */
    public Document toSnapshot(Job job) {
        Document doc = new Document();
        for (Map.Entry<String, Object> entry : job.attributes().asMap().entrySet()) {
            Object value = entry.getValue();
            doc.put(entry.getKey(), value instanceof Date ? new Date(((Date) value).getTime()) : value);
        }
        return doc;
    }

    public Job toJob(JobScheduler owner, Document doc) {
        return Job.restore(owner, doc);
    }
}
