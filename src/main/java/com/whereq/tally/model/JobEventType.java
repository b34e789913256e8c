package com.whereq.tally.model;

/**
 * Lifecycle events published on the event bus. {@link #getWireName()} is the name
 * external consumers (the WebSocket broadcaster) subscribe to.
 */
public enum JobEventType {
    JOB_SCHEDULED("job:scheduled"),
    JOB_STARTED("job:started"),
    JOB_COMPLETED("job:completed"),
    JOB_FAILED("job:failed"),
    JOB_PAUSED("job:paused"),
    JOB_RESUMED("job:resumed"),
    JOB_CANCELLED("job:cancelled"),
    EXTRACTION_STARTED("extraction:started"),
    EXTRACTION_PROGRESS("extraction:progress"),
    EXTRACTION_COMPLETED("extraction:completed"),
    EXTRACTION_FAILED("extraction:failed");

    private final String wireName;

    JobEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
