package com.whereq.tally.queue;

import com.whereq.tally.config.TallyProperties;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Worker settings for a queue
 */
@Data
@Builder
public class WorkerConfig {

    /**
     * Maximum handlers running at once
     */
    @Builder.Default
    private int concurrency = 5;

    /**
     * Lease length of an active task
     */
    @Builder.Default
    private Duration lockDuration = Duration.ofSeconds(30);

    @Builder.Default
    private Duration stalledInterval = Duration.ofSeconds(30);

    /**
     * Stalls tolerated before the task fails
     */
    @Builder.Default
    private int maxStalledCount = 1;

    public static WorkerConfig from(TallyProperties.QueueConfig config) {
        return WorkerConfig.builder()
            .concurrency(config.getConcurrency())
            .lockDuration(config.getLockDuration())
            .stalledInterval(config.getStalledInterval())
            .maxStalledCount(config.getMaxStalledCount())
            .build();
    }
}
