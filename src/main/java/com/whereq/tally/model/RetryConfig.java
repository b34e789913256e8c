package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry policy for failed extractions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Maximum number of attempts, the first run included
     */
    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialDelay = 5000;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxDelay = 60000;

    /**
     * Substrings matched against a failure message to decide whether it is retryable
     */
    @Builder.Default
    private List<String> retryableErrors = new ArrayList<>();

    public RetryConfig copy() {
        return new RetryConfig(maxAttempts, backoffStrategy, initialDelay, maxDelay,
            retryableErrors != null ? new ArrayList<>(retryableErrors) : new ArrayList<>());
    }
}
