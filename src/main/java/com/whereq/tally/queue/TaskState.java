package com.whereq.tally.queue;

/**
 * Queue task lifecycle
 *
 * WAITING → ACTIVE → {COMPLETED, FAILED}
 * DELAYED → WAITING once the delay elapses
 * ACTIVE → WAITING when the lease expires (stalled)
 */
public enum TaskState {
    WAITING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if the task has not been picked up yet and may still be cancelled
     */
    public boolean isPending() {
        return this == WAITING || this == DELAYED;
    }
}
