package com.novemberain.jobs.mongodb.dao;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.novemberain.jobs.mongodb.util.JobQueries;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class JobDaoTest {

    private static final Date NOW = new Date(1705312800000L);

    private MongoCollection<Document> collection;
    private JobDao jobDao;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() {
        collection = mock(MongoCollection.class);
        jobDao = new JobDao(collection);
    }

    @Test
    public void testCreateIndex() {
        jobDao.createIndex();

        ArgumentCaptor<IndexOptions> options = ArgumentCaptor.forClass(IndexOptions.class);
        verify(collection).createIndex(eq(JobQueries.nextJobIndexKeys()), options.capture());
        assertEquals(JobQueries.NEXT_JOB_INDEX, options.getValue().getName());
    }

    @Test
    public void testInsertAssignsId() {
        Document job = new Document("name", "report");

        Object id = jobDao.insert(job);

        assertTrue(id instanceof ObjectId);
        assertEquals(id, job.get("_id"));
        verify(collection).insertOne(job);
    }

    @Test
    public void testInsertKeepsGivenId() {
        Document job = new Document("_id", "report-1").append("name", "report");

        assertEquals("report-1", jobDao.insert(job));
    }

    @Test
    public void testUpdateSetsAndUnsets() {
        when(collection.updateOne(any(Bson.class), any(Bson.class))).thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertTrue(jobDao.update(42, new Document("data", "x"), new Document("failReason", "")));

        ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
        verify(collection).updateOne(any(Bson.class), update.capture());
        assertEquals(new Document("$set", new Document("data", "x"))
                .append("$unset", new Document("failReason", "")), update.getValue());
    }

    @Test
    public void testUpdateWithoutChanges() {
        assertFalse(jobDao.update(42, new Document(), new Document()));
        verifyNoInteractions(collection);
    }

    @Test
    public void testUpdateOfMissingJob() {
        when(collection.updateOne(any(Bson.class), any(Bson.class))).thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertFalse(jobDao.update(42, new Document("data", "x"), new Document()));
    }

    @Test
    public void testUpsertReturnsStoredJob() {
        Document stored = new Document("_id", 1);
        when(collection.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
                .thenReturn(stored);

        assertSame(stored, jobDao.upsert(JobQueries.singleJob("report"), new Document("$set", new Document())));

        ArgumentCaptor<FindOneAndUpdateOptions> options = ArgumentCaptor.forClass(FindOneAndUpdateOptions.class);
        verify(collection).findOneAndUpdate(any(Bson.class), any(Bson.class), options.capture());
        assertTrue(options.getValue().isUpsert());
        assertEquals(ReturnDocument.AFTER, options.getValue().getReturnDocument());
    }

    @Test
    public void testClaimSetsLockedAt() {
        Document claimed = new Document("_id", 1).append("lockedAt", NOW);
        when(collection.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
                .thenReturn(claimed);

        assertSame(claimed, jobDao.claim(JobQueries.byId(1), JobQueries.NEXT_JOB_SORT, NOW));

        ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
        ArgumentCaptor<FindOneAndUpdateOptions> options = ArgumentCaptor.forClass(FindOneAndUpdateOptions.class);
        verify(collection).findOneAndUpdate(any(Bson.class), update.capture(), options.capture());
        assertEquals(JobQueries.lockUpdate(NOW), update.getValue());
        assertSame(JobQueries.NEXT_JOB_SORT, options.getValue().getSort());
        assertFalse(options.getValue().isUpsert());
    }

    @Test
    public void testClaimWithoutSort() {
        jobDao.claim(JobQueries.byId(1), null, NOW);

        ArgumentCaptor<FindOneAndUpdateOptions> options = ArgumentCaptor.forClass(FindOneAndUpdateOptions.class);
        verify(collection).findOneAndUpdate(any(Bson.class), any(Bson.class), options.capture());
        assertNull(options.getValue().getSort());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFindSortsResults() {
        final Document doc = new Document("_id", 1);
        FindIterable<Document> iterable = mock(FindIterable.class);
        when(collection.find(any(Bson.class))).thenReturn(iterable);
        when(iterable.sort(any(Bson.class))).thenReturn(iterable);
        doAnswer(invocation -> {
            Collection<Document> target = invocation.getArgument(0);
            target.add(doc);
            return target;
        }).when(iterable).into(ArgumentMatchers.<ArrayList<Document>>any());

        List<Document> found = jobDao.find(JobQueries.byName("report"), JobQueries.NEXT_JOB_SORT);

        assertEquals(1, found.size());
        assertSame(doc, found.get(0));
        verify(iterable).sort(JobQueries.NEXT_JOB_SORT);
    }

    @Test
    public void testSetDisabled() {
        when(collection.updateMany(any(Bson.class), any(Bson.class))).thenReturn(UpdateResult.acknowledged(3, 2L, null));

        assertEquals(2L, jobDao.setDisabled(JobQueries.byName("report"), true));
        verify(collection).updateMany(any(Bson.class), eq(JobQueries.disabledUpdate(true)));
    }

    @Test
    public void testRemove() {
        when(collection.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));
        when(collection.deleteMany(any(Bson.class))).thenReturn(DeleteResult.acknowledged(4));

        assertTrue(jobDao.remove((Object) 42));
        assertEquals(4L, jobDao.remove(JobQueries.byName("report")));
    }
}
