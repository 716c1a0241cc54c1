package com.novemberain.jobs.mongodb;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.novemberain.jobs.mongodb.db.MongoConnector;
import com.novemberain.jobs.mongodb.util.JobQueries;
import org.bson.Document;
import org.junit.Test;

import java.util.Date;
import java.util.Properties;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class JobSchedulerFactoryTest {

    @Test
    public void testReadsClasspathProperties() throws Exception {
        JobSchedulerFactory factory = JobSchedulerFactory.fromClasspath("jobs-test.properties");

        assertEquals("scheduled_jobs", factory.getCollectionName());
        assertEquals("worker-7", factory.getInstanceName());
        assertEquals(30000L, factory.getDefaultLockLifetimeMillis());
    }

    @Test
    public void testDefaults() throws Exception {
        JobSchedulerFactory factory = new JobSchedulerFactory(new Properties());

        assertEquals(Constants.DEFAULT_COLLECTION, factory.getCollectionName());
        assertEquals(Constants.DEFAULT_LOCK_LIFETIME_MILLIS, factory.getDefaultLockLifetimeMillis());
        assertNotNull(factory.getInstanceName());
    }

    @Test(expected = JobConfigException.class)
    public void testMissingResource() throws Exception {
        JobSchedulerFactory.fromClasspath("no-such-jobs.properties");
    }

    @Test
    public void testInvalidNumber() {
        Properties props = new Properties();
        props.setProperty(JobSchedulerFactory.PROP_DEFAULT_LOCK_LIFETIME, "ten minutes");

        try {
            new JobSchedulerFactory(props).getDefaultLockLifetimeMillis();
            fail("a non numeric lock lifetime should be rejected");
        } catch (JobConfigException e) {
            assertTrue(e.getMessage().contains(JobSchedulerFactory.PROP_DEFAULT_LOCK_LIFETIME));
        }
    }

    @Test
    public void testMissingConnectionSettings() {
        try {
            new JobSchedulerFactory(new Properties()).getScheduler();
            fail("a scheduler without MongoDB settings should not be built");
        } catch (JobConfigException e) {
            assertEquals("A MongoDB URI or at least one server address is required.", e.getMessage());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testBuildsSchedulerOnConnector() throws Exception {
        MongoCollection<Document> collection = mock(MongoCollection.class);
        MongoConnector connector = mock(MongoConnector.class);
        when(connector.getCollection("scheduled_jobs")).thenReturn(collection);
        ManualClock clock = new ManualClock(new Date(0));

        JobScheduler scheduler = JobSchedulerFactory.fromClasspath("jobs-test.properties")
                .withClock(clock)
                .getScheduler(connector);

        assertEquals("worker-7", scheduler.getName());
        assertSame(clock, scheduler.getClock());
        assertEquals(30000L, scheduler.getExpiryCalculator().getDefaultLockLifetimeMillis());
        assertTrue(scheduler.getJobStore() instanceof MongoJobStore);
        verify(collection).createIndex(eq(JobQueries.nextJobIndexKeys()), any(IndexOptions.class));

        scheduler.shutdown();
        verify(connector).close();
    }
}
