package com.novemberain.jobs.mongodb.util;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.novemberain.jobs.mongodb.JobType;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static com.novemberain.jobs.mongodb.Constants.*;

/**
 * Filters and sorts used against the jobs collection.
 */
public final class JobQueries {

    public static final Bson NEXT_JOB_SORT = Sorts.orderBy(Sorts.ascending(JOB_NEXT_RUN_AT),
            Sorts.descending(JOB_PRIORITY));

    public static final String NEXT_JOB_INDEX = "findAndLockNextJobIndex";

    private JobQueries() {
    }

    public static Bson byId(Object id) {
        return Filters.eq(JOB_ID, id);
    }

    public static Bson byName(String name) {
        return Filters.eq(JOB_NAME, name);
    }

    public static Bson singleJob(String name) {
        return Filters.and(
                Filters.eq(JOB_NAME, name),
                Filters.eq(JOB_TYPE, JobType.SINGLE.value()));
    }

    /**
     * Query of a uniqueness constraint, always narrowed to jobs of the same name.
     */
    public static Bson uniqueJob(Map<String, Object> unique, String name) {
        Document query = new Document(unique);
        query.put(JOB_NAME, name);
        return query;
    }

    /**
     * Matches the given job only while it is still due at {@code nextRunAt},
     * enabled, and not claimed by someone else since {@code lockDeadline}.
     */
    public static Bson lockableJob(Object id, Date nextRunAt, Date lockDeadline) {
        return Filters.and(
                byId(id),
                Filters.eq(JOB_NEXT_RUN_AT, nextRunAt),
                Filters.ne(JOB_DISABLED, true),
                unlockedOrExpired(lockDeadline));
    }

    /**
     * Matches enabled jobs of the given name that are due by {@code nextScanAt}
     * and free, or whose claim expired at {@code lockDeadline}.
     */
    public static Bson nextDueJob(String name, Date nextScanAt, Date lockDeadline) {
        return Filters.and(
                Filters.eq(JOB_NAME, name),
                Filters.ne(JOB_DISABLED, true),
                Filters.or(
                        Filters.and(
                                Filters.eq(JOB_LOCKED_AT, null),
                                Filters.lte(JOB_NEXT_RUN_AT, nextScanAt)),
                        Filters.lte(JOB_LOCKED_AT, lockDeadline)));
    }

    public static Bson undefinedJobs(Collection<String> definedNames) {
        return Filters.nin(JOB_NAME, new ArrayList<>(definedNames));
    }

    public static Document lockUpdate(Date lockedAt) {
        return new Document("$set", new Document(JOB_LOCKED_AT, lockedAt));
    }

    public static Document disabledUpdate(boolean disabled) {
        return new Document("$set", new Document(JOB_DISABLED, disabled));
    }

    public static Document nextJobIndexKeys() {
        return new Document(JOB_NAME, 1)
                .append(JOB_NEXT_RUN_AT, 1)
                .append(JOB_PRIORITY, -1)
                .append(JOB_LOCKED_AT, 1)
                .append(JOB_DISABLED, 1);
    }

    private static Bson unlockedOrExpired(Date lockDeadline) {
        List<Bson> conditions = new ArrayList<>();
        conditions.add(Filters.eq(JOB_LOCKED_AT, null));
        conditions.add(Filters.lte(JOB_LOCKED_AT, lockDeadline));
        return Filters.or(conditions);
    }
}
