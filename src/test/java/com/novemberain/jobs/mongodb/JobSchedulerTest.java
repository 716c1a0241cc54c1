package com.novemberain.jobs.mongodb;

import com.novemberain.jobs.mongodb.util.JobQueries;
import org.bson.conversions.Bson;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.Arrays;

import static com.novemberain.jobs.mongodb.Constants.*;
import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class JobSchedulerTest extends AbstractJobTest {

    private static final JobHandler NOOP = job -> {
    };

    @Test
    public void testDefine() {
        JobDefinition first = scheduler.define("report", NOOP);
        assertSame(first, scheduler.getDefinition("report"));

        JobDefinition second = scheduler.define(new JobDefinition("report", NOOP, 10, 1000));
        assertSame(second, scheduler.getDefinition("report"));
        assertEquals(Collections.singleton("report"), new HashSet<>(scheduler.getDefinedNames()));

        assertNull(scheduler.getDefinition("unknown"));
        assertNull(scheduler.getDefinition(null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDefinitionNeedsHandler() {
        new JobDefinition("report", null);
    }

    @Test
    public void testCreateUsesDefinitionPriority() {
        scheduler.define(new JobDefinition("report", NOOP, Priority.HIGH.value(), 0));

        Job job = scheduler.create("report", "weekly");

        assertEquals(JobType.NORMAL, job.getType());
        assertEquals(10, job.getPriority());
        assertEquals("weekly", job.getData());
        assertEquals(NOW, job.getNextRunAt());
        assertNull(job.getId());
        assertEquals(0, scheduler.create("undefined", null).getPriority());
    }

    @Test
    public void testEverySavesSingleJob() throws Exception {
        Job job = scheduler.every("1 hour", "report", null, RepeatOptions.defaults());

        assertEquals(JobType.SINGLE, job.getType());
        assertEquals("1 hour", job.getRepeatInterval());
        assertEquals(NOW, job.getNextRunAt());
        assertNotNull(job.getId());
        assertEquals(1, store.savedChanges.size());
        assertEquals("single", store.lastValues().get(JOB_TYPE));
    }

    @Test
    public void testEverySkipImmediate() throws Exception {
        Job job = scheduler.every("1 hour", "report", null, RepeatOptions.defaults().skipImmediate(true));

        assertEquals(new Date(NOW.getTime() + 60 * 60 * 1000L), job.getNextRunAt());
    }

    @Test
    public void testScheduleAndNow() throws Exception {
        Job later = scheduler.schedule("in 2 hours", "report", "later");
        assertEquals(new Date(NOW.getTime() + 2 * 60 * 60 * 1000L), later.getNextRunAt());
        assertNotNull(later.getId());

        Job now = scheduler.now("report", "now");
        assertEquals(NOW, now.getNextRunAt());
        assertEquals(2, store.savedChanges.size());
    }

    @Test
    public void testLockJobUsesDefinitionLockLifetime() throws Exception {
        JobStore jobStore = mock(JobStore.class);
        JobScheduler owner = new JobScheduler("worker-1", jobStore, clock, DEFAULT_LOCK_LIFETIME_MILLIS);
        owner.define(new JobDefinition("report", NOOP, 0, 60000));
        Job job = new Job(owner, "report");
        when(jobStore.lockJob(same(job), any(Date.class))).thenReturn(true);

        assertTrue(owner.lockJob(job));
        verify(jobStore).lockJob(job, new Date(NOW.getTime() - 60000));
    }

    @Test
    public void testLockNextJobUsesDefaultLockLifetime() throws Exception {
        JobStore jobStore = mock(JobStore.class);
        JobScheduler owner = new JobScheduler("worker-1", jobStore, clock, 30000);
        Date nextScanAt = new Date(NOW.getTime() + 5000);

        assertNull(owner.lockNextJob("report", nextScanAt));
        verify(jobStore).lockNextJob(owner, "report", nextScanAt, new Date(NOW.getTime() - 30000));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPurgePassesDefinedNames() throws Exception {
        JobStore jobStore = mock(JobStore.class);
        JobScheduler owner = new JobScheduler("worker-1", jobStore, clock, DEFAULT_LOCK_LIFETIME_MILLIS);
        owner.define("report", NOOP);
        owner.define("send-email", NOOP);
        when(jobStore.purge(anyCollection())).thenReturn(4L);

        assertEquals(4L, owner.purge());

        ArgumentCaptor<Collection<String>> names = ArgumentCaptor.forClass(Collection.class);
        verify(jobStore).purge(names.capture());
        assertEquals(new HashSet<>(Arrays.asList("report", "send-email")), new HashSet<>(names.getValue()));
    }

    @Test
    public void testBulkOperationsDelegateToStore() throws Exception {
        JobStore jobStore = mock(JobStore.class);
        JobScheduler owner = new JobScheduler("worker-1", jobStore);
        Bson query = JobQueries.byName("report");
        when(jobStore.removeJobs(query)).thenReturn(3L);
        when(jobStore.setDisabled(query, true)).thenReturn(2L);
        when(jobStore.setDisabled(query, false)).thenReturn(1L);
        when(jobStore.findJobs(owner, query)).thenReturn(Collections.<Job>emptyList());

        assertEquals(3L, owner.cancel(query));
        assertEquals(2L, owner.disable(query));
        assertEquals(1L, owner.enable(query));
        assertTrue(owner.jobs(query).isEmpty());
    }

    @Test
    public void testShutdownClosesStore() {
        JobStore jobStore = mock(JobStore.class);
        new JobScheduler("worker-1", jobStore).shutdown();

        verify(jobStore).shutdown();
    }

    @Test
    public void testRemovedListenerIsNotCalled() throws Exception {
        final int[] calls = {0};
        JobListener listener = new JobListener() {
            @Override
            public void jobCompleted(Job job) {
                calls[0]++;
            }
        };
        scheduler.addListener(listener);
        scheduler.define("report", NOOP);
        scheduler.now("report", null).run();
        scheduler.removeListener(listener);
        scheduler.now("report", null).run();

        assertEquals(1, calls[0]);
    }
}
