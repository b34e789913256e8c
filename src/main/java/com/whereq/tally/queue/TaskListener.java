package com.whereq.tally.queue;

/**
 * Observer of task transitions. Called on queue threads, must not block.
 */
public interface TaskListener {

    default void onStarted(TaskStatus task) {
    }

    default void onCompleted(TaskStatus task) {
    }

    /**
     * @param willRetry whether a follow-up attempt was enqueued
     */
    default void onFailed(TaskStatus task, Throwable error, boolean willRetry) {
    }

    default void onRetried(TaskStatus failed, String retryTaskId, long delayMs) {
    }

    default void onStalled(TaskStatus task) {
    }
}
