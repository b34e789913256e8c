package com.whereq.tally.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only snapshot of a task
 */
@Value
@Builder
public class TaskStatus {
    String taskId;
    String queueName;
    String name;
    String jobId;
    TaskState state;
    int attempt;
    int maxAttempts;
    int stalledCount;
    Instant enqueuedAt;
    Instant finishedAt;
    String failedReason;
    String retriedAs;
    Object result;
}
