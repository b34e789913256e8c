package com.whereq.tally.queue;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Per-task delivery options
 */
@Data
@Builder
public class TaskOptions {

    /**
     * Total attempts, the first delivery included
     */
    @Builder.Default
    private int attempts = 1;

    @Builder.Default
    private BackoffSpec backoff = BackoffSpec.none();

    /**
     * Initial delay before the first delivery
     */
    @Builder.Default
    private Duration delay = Duration.ZERO;

    /**
     * Lower runs first. Equal priorities are delivered in insertion order.
     */
    @Builder.Default
    private int priority = 0;

    /**
     * Job the task belongs to, used for bulk cancellation
     */
    private String jobId;

    @Builder.Default
    private boolean removeOnComplete = false;

    @Builder.Default
    private boolean removeOnFail = false;

    public static TaskOptions defaults() {
        return TaskOptions.builder().build();
    }
}
