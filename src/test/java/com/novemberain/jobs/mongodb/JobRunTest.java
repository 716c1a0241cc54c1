package com.novemberain.jobs.mongodb;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import static com.novemberain.jobs.mongodb.Constants.*;
import static org.junit.Assert.*;

public class JobRunTest extends AbstractJobTest {

    private final List<String> events = new ArrayList<>();
    private Throwable reportedFailure;

    @Before
    public void setUp() {
        scheduler.addListener(new JobListener() {
            @Override
            public void jobStarted(Job job) {
                events.add("start:" + job.getName());
            }

            @Override
            public void jobSucceeded(Job job) {
                events.add("success:" + job.getName());
            }

            @Override
            public void jobFailed(Job job, Throwable cause) {
                events.add("fail:" + job.getName());
                reportedFailure = cause;
            }

            @Override
            public void jobCompleted(Job job) {
                events.add("complete:" + job.getName());
            }
        });
    }

    @Test
    public void testSuccessfulRun() throws Exception {
        final List<Boolean> runningInsideHandler = new ArrayList<>();
        scheduler.define("send-email", job -> {
            runningInsideHandler.add(job.isRunning());
            clock.advance(1000);
        });
        Job job = new Job(scheduler, "send-email").save();
        job.attributes().set(JOB_LOCKED_AT, NOW);

        job.run();

        assertEquals(Collections.singletonList(Boolean.TRUE), runningInsideHandler);
        assertEquals(NOW, job.getLastRunAt());
        assertEquals(new Date(NOW.getTime() + 1000), job.getLastFinishedAt());
        assertFalse(job.isRunning());
        assertNull(job.getNextRunAt());
        assertNull(job.getLockedAt());
        assertEquals(0, job.getFailCount());
        assertNull(job.getFailReason());
        assertEquals(Arrays.asList("start:send-email", "success:send-email", "complete:send-email"), events);
    }

    @Test
    public void testRunSavesBeforeAndAfterHandler() throws Exception {
        final List<Integer> savesSeenByHandler = new ArrayList<>();
        scheduler.define("send-email", job -> savesSeenByHandler.add(store.savedChanges.size()));
        Job job = new Job(scheduler, "send-email").save();

        job.run();

        assertEquals(Collections.singletonList(2), savesSeenByHandler);
        assertEquals(3, store.savedChanges.size());
        assertTrue(store.savedChanges.get(1).contains(JOB_LAST_RUN_AT));
        assertTrue(store.lastChanges().containsAll(Arrays.asList(JOB_LAST_FINISHED_AT, JOB_NEXT_RUN_AT, JOB_LOCKED_AT)));
        assertFalse(job.attributes().hasChanges());
    }

    @Test
    public void testHandlerFailureIsRecorded() throws Exception {
        final Exception boom = new Exception("smtp unreachable");
        scheduler.define("send-email", job -> {
            throw boom;
        });
        Job job = new Job(scheduler, "send-email").save();

        job.run();

        assertEquals("smtp unreachable", job.getFailReason());
        assertEquals(1, job.getFailCount());
        assertEquals(NOW, job.getFailedAt());
        assertEquals(NOW, job.getLastFinishedAt());
        assertNull(job.getLockedAt());
        assertSame(boom, reportedFailure);
        assertEquals(Arrays.asList("start:send-email", "fail:send-email", "complete:send-email"), events);
        assertTrue(store.lastChanges().containsAll(Arrays.asList(JOB_FAIL_REASON, JOB_FAIL_COUNT, JOB_FAILED_AT)));
    }

    @Test
    public void testHandlerErrorIsRecorded() throws Exception {
        scheduler.define("send-email", job -> {
            throw new AssertionError("handler bug");
        });
        Job job = new Job(scheduler, "send-email").save();
        job.attributes().set(JOB_LOCKED_AT, NOW);

        job.run();

        assertEquals("handler bug", job.getFailReason());
        assertEquals(1, job.getFailCount());
        assertFalse(job.isRunning());
        assertNull(job.getLockedAt());
        assertTrue(reportedFailure instanceof AssertionError);
        assertEquals(Arrays.asList("start:send-email", "fail:send-email", "complete:send-email"), events);
        assertTrue(store.lastChanges().containsAll(Arrays.asList(JOB_FAIL_REASON, JOB_LOCKED_AT)));
    }

    @Test
    public void testUndefinedJobFails() throws Exception {
        Job job = new Job(scheduler, "nobody-knows-me").save();

        job.run();

        assertEquals(Job.UNDEFINED_JOB, job.getFailReason());
        assertEquals(1, job.getFailCount());
        assertTrue(reportedFailure instanceof IllegalStateException);
        assertEquals(Arrays.asList("start:nobody-knows-me", "fail:nobody-knows-me", "complete:nobody-knows-me"),
                events);
    }

    @Test
    public void testRecurringJobGetsNextRun() throws Exception {
        scheduler.define("report", job -> clock.advance(5000));
        Job job = new Job(scheduler, "report").repeatEvery("1 hour").save();

        job.run();

        assertEquals(new Date(NOW.getTime() + 60 * 60 * 1000L), job.getNextRunAt());
    }

    @Test
    public void testRecurringCronJobGetsNextRun() throws Exception {
        scheduler.define("report", job -> {
        });
        Job job = new Job(scheduler, "report")
                .repeatEvery("*/5 * * * *", RepeatOptions.defaults().withTimezone("UTC")).save();

        job.run();

        assertEquals(at("2024-01-15T10:05:00Z"), job.getNextRunAt());
    }

    @Test
    public void testFailedRecurringJobStillGetsNextRun() throws Exception {
        scheduler.define("report", job -> {
            throw new IllegalArgumentException("bad input");
        });
        Job job = new Job(scheduler, "report").repeatEvery("1 day").save();

        job.run();

        assertEquals("bad input", job.getFailReason());
        assertEquals(new Date(NOW.getTime() + 24 * 60 * 60 * 1000L), job.getNextRunAt());
    }

    @Test
    public void testListenerFailureDoesNotStopRun() throws Exception {
        final List<String> handled = new ArrayList<>();
        scheduler.addListener(new JobListener() {
            @Override
            public void jobStarted(Job job) {
                throw new IllegalStateException("listener bug");
            }
        });
        scheduler.define("send-email", job -> handled.add(job.getName()));
        Job job = new Job(scheduler, "send-email").save();

        job.run();

        assertEquals(Collections.singletonList("send-email"), handled);
        assertEquals(0, job.getFailCount());
        assertEquals(Arrays.asList("start:send-email", "success:send-email", "complete:send-email"), events);
    }

    @Test
    public void testStoreFailureIsThrownBeforeHandler() {
        final List<String> handled = new ArrayList<>();
        scheduler.define("send-email", job -> handled.add(job.getName()));
        Job job = new Job(scheduler, "send-email");
        store.failure = new JobStoreException("mongo is down");

        try {
            job.run();
            fail("run should have failed");
        } catch (JobStoreException e) {
            assertEquals("mongo is down", e.getMessage());
        }

        assertTrue(handled.isEmpty());
        assertTrue(events.isEmpty());
        assertTrue(job.attributes().changedKeys().contains(JOB_LAST_RUN_AT));
    }

    @Test
    public void testRemovedJobDoesNotRun() throws Exception {
        final List<String> handled = new ArrayList<>();
        scheduler.define("send-email", job -> handled.add(job.getName()));
        Job job = new Job(scheduler, "send-email").save();
        job.remove();

        job.run();

        assertTrue(handled.isEmpty());
        assertTrue(events.isEmpty());
        assertNull(job.getLastRunAt());
    }
}
