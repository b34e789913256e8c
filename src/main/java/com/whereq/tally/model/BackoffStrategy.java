package com.whereq.tally.model;

/**
 * Delay function between retry attempts
 */
public enum BackoffStrategy {
    CONSTANT,
    LINEAR,
    EXPONENTIAL
}
