package com.whereq.tally.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable-style task queue with leased, at-least-once delivery and retries with backoff
 */
public interface RetryQueue {

    /**
     * Create a queue. Creating an existing queue is a no-op.
     */
    void createQueue(String queueName);

    /**
     * Add a task
     *
     * @param queueName target queue
     * @param taskName descriptive name
     * @param payload opaque payload handed to the handler
     * @param options attempts, backoff, delay and priority
     * @return the task id
     * @throws com.whereq.tally.exception.NotFoundException if the queue does not exist
     */
    String addTask(String queueName, String taskName, Object payload, TaskOptions options);

    /**
     * Start consuming a queue
     *
     * @throws IllegalStateException if a worker is already registered for the queue
     */
    void registerWorker(String queueName, TaskHandler handler, WorkerConfig config);

    void addListener(TaskListener listener);

    /**
     * Renew the lease of an active task
     *
     * @return false if the task is not active
     */
    boolean extendLease(String taskId);

    Optional<TaskStatus> getTaskStatus(String taskId);

    /**
     * Remove a waiting or delayed task
     *
     * @return false if the task is unknown, active or finished
     */
    boolean cancelTask(String taskId);

    /**
     * Remove every waiting or delayed task of a job
     *
     * @return number of tasks removed
     */
    int cancelTasksForJob(String jobId);

    QueueStats getQueueStats(String queueName);

    void pauseQueue(String queueName);

    void resumeQueue(String queueName);

    /**
     * Remove finished tasks older than the grace period
     *
     * @return number of tasks removed
     */
    int cleanQueue(String queueName, Duration grace);

    void shutdown();
}
