package com.whereq.tally.model;

/**
 * How often a credential is expected to be rotated
 */
public enum RotationPolicy {
    MANUAL(-1),
    DAILY(1),
    WEEKLY(7),
    MONTHLY(30),
    QUARTERLY(90);

    private final int thresholdDays;

    RotationPolicy(int thresholdDays) {
        this.thresholdDays = thresholdDays;
    }

    /**
     * Days after which rotation is due, negative for never
     */
    public int getThresholdDays() {
        return thresholdDays;
    }

    public boolean isRotationDue(long daysSinceRotation) {
        return thresholdDays >= 0 && daysSinceRotation >= thresholdDays;
    }
}
