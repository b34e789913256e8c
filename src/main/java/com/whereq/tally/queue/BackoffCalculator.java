package com.whereq.tally.queue;

import com.whereq.tally.model.BackoffStrategy;
import com.whereq.tally.model.RetryConfig;

/**
 * Computes the delay before the next attempt.
 *
 * <ul>
 *   <li>CONSTANT: {@code initialDelay}</li>
 *   <li>LINEAR: {@code initialDelay + 1000 * (attempt - 1)}</li>
 *   <li>EXPONENTIAL: {@code initialDelay * 2^(attempt - 1)}</li>
 * </ul>
 * The result is clamped to {@code [0, maxDelay]} and never overflows.
 */
public final class BackoffCalculator {

    private static final long LINEAR_STEP_MS = 1000L;

    private BackoffCalculator() {
    }

    /**
     * @param attempt the attempt that just failed, 1-based
     * @return delay in milliseconds
     */
    public static long calculate(BackoffStrategy strategy, int attempt, long initialDelay, long maxDelay) {
        long initial = Math.max(0, initialDelay);
        long max = Math.max(0, maxDelay);
        int n = Math.max(1, attempt);

        long delay = switch (strategy != null ? strategy : BackoffStrategy.EXPONENTIAL) {
            case CONSTANT -> initial;
            case LINEAR -> saturatedAdd(initial, LINEAR_STEP_MS * (n - 1));
            case EXPONENTIAL -> shiftSaturated(initial, n - 1);
        };

        return Math.min(delay, max);
    }

    public static long calculate(BackoffSpec backoff, int attempt) {
        return calculate(backoff.getStrategy(), attempt, backoff.getInitialDelay(), backoff.getMaxDelay());
    }

    public static long calculate(RetryConfig retryConfig, int attempt) {
        return calculate(retryConfig.getBackoffStrategy(), attempt,
            retryConfig.getInitialDelay(), retryConfig.getMaxDelay());
    }

    private static long saturatedAdd(long a, long b) {
        return a > Long.MAX_VALUE - b ? Long.MAX_VALUE : a + b;
    }

    private static long shiftSaturated(long value, int shift) {
        if (value == 0) {
            return 0;
        }
        if (shift >= Long.SIZE - 1 || value > (Long.MAX_VALUE >> shift)) {
            return Long.MAX_VALUE;
        }
        return value << shift;
    }
}
