package com.whereq.tally.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * IDLE → SCHEDULED ⇄ PAUSED
 * SCHEDULED → RUNNING → {COMPLETED, FAILED, SCHEDULED (retry pending)}
 * any non-terminal → CANCELLED
 */
public enum JobStatus {
    /**
     * Created, not yet registered with the scheduler
     */
    IDLE,

    /**
     * Trigger armed, waiting for the next fire or a pending retry
     */
    SCHEDULED,

    /**
     * Extraction in progress
     */
    RUNNING,

    /**
     * Trigger suspended
     */
    PAUSED,

    /**
     * Last run extracted successfully
     */
    COMPLETED,

    /**
     * Last run exhausted its attempts or failed terminally
     */
    FAILED,

    /**
     * User-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state. COMPLETED and FAILED describe the last run
     * of a recurring job, only CANCELLED stops all further runs.
     */
    public boolean isTerminal() {
        return this == CANCELLED;
    }
}
