package com.whereq.tally.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of work held by the queue. Handlers receive a detached copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueTask {

    private String taskId;

    private String queueName;

    private String name;

    private String jobId;

    private Object payload;

    /**
     * Attempt number, 1-based
     */
    private int attempt;

    private int maxAttempts;

    private int priority;

    private BackoffSpec backoff;

    /**
     * Insertion order, breaks priority ties
     */
    private long sequence;

    private Instant enqueuedAt;

    /**
     * When a DELAYED task becomes eligible
     */
    private Instant availableAt;

    private TaskState state;

    private String leaseToken;

    private Instant leaseExpiresAt;

    private int stalledCount;

    private String failedReason;

    /**
     * Id of the task created to retry this one
     */
    private String retriedAs;

    private Object result;

    private Instant finishedAt;

    private boolean removeOnComplete;

    private boolean removeOnFail;

    public QueueTask copy() {
        return toBuilder().build();
    }

    public TaskStatus toStatus() {
        return TaskStatus.builder()
            .taskId(taskId)
            .queueName(queueName)
            .name(name)
            .jobId(jobId)
            .state(state)
            .attempt(attempt)
            .maxAttempts(maxAttempts)
            .stalledCount(stalledCount)
            .enqueuedAt(enqueuedAt)
            .finishedAt(finishedAt)
            .failedReason(failedReason)
            .retriedAs(retriedAs)
            .result(result)
            .build();
    }
}
