package com.whereq.tally.queue;

import lombok.Builder;
import lombok.Value;

/**
 * Task counts of a queue by state
 */
@Value
@Builder
public class QueueStats {
    String queueName;
    long waiting;
    long active;
    long delayed;
    long completed;
    long failed;
    boolean paused;
    long total;
}
