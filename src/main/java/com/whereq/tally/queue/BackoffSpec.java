package com.whereq.tally.queue;

import com.whereq.tally.model.BackoffStrategy;
import com.whereq.tally.model.RetryConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Delay policy between attempts of a task
 */
@Value
@Builder
public class BackoffSpec {

    @Builder.Default
    BackoffStrategy strategy = BackoffStrategy.CONSTANT;

    /**
     * Initial delay in milliseconds
     */
    long initialDelay;

    /**
     * Upper bound in milliseconds
     */
    long maxDelay;

    public static BackoffSpec none() {
        return BackoffSpec.builder().build();
    }

    public static BackoffSpec from(RetryConfig retryConfig) {
        return BackoffSpec.builder()
            .strategy(retryConfig.getBackoffStrategy())
            .initialDelay(retryConfig.getInitialDelay())
            .maxDelay(retryConfig.getMaxDelay())
            .build();
    }
}
