package com.novemberain.jobs.mongodb;

/**
 * How a job is de-duplicated and whether it recurs.
 */
public enum JobType {

    /** One-shot job, each save of a new instance inserts a new record. */
    ONCE("once"),

    /** At most one record per job name, saving a new instance upserts it. */
    SINGLE("single"),

    /** Regular job, may carry a recurrence. */
    NORMAL("normal");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return matching type or {@code null} when the value is unknown
     */
    public static JobType fromValue(String value) {
        for (JobType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
