package com.novemberain.jobs.mongodb;

public interface Constants {

    String JOB_ID = "_id";
    String JOB_NAME = "name";
    String JOB_TYPE = "type";
    String JOB_PRIORITY = "priority";
    String JOB_DATA = "data";
    String JOB_NEXT_RUN_AT = "nextRunAt";
    String JOB_LAST_RUN_AT = "lastRunAt";
    String JOB_LAST_FINISHED_AT = "lastFinishedAt";
    String JOB_LOCKED_AT = "lockedAt";
    String JOB_DISABLED = "disabled";
    String JOB_REPEAT_INTERVAL = "repeatInterval";
    String JOB_REPEAT_TIMEZONE = "repeatTimezone";
    String JOB_REPEAT_AT = "repeatAt";
    String JOB_UNIQUE = "unique";
    String JOB_UNIQUE_OPTS = "uniqueOpts";
    String JOB_FAILED_AT = "failedAt";
    String JOB_FAIL_REASON = "failReason";
    String JOB_FAIL_COUNT = "failCount";
    String JOB_LAST_MODIFIED_BY = "lastModifiedBy";

    String UNIQUE_INSERT_ONLY = "insertOnly";

    String DEFAULT_COLLECTION = "jobs";
    long DEFAULT_LOCK_LIFETIME_MILLIS = 10 * 60 * 1000L;

}
