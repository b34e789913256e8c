package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * When a job runs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronSchedule {

    /**
     * Cron expression, five fields (minute precision) or six (with seconds)
     */
    private String expression;

    /**
     * IANA zone id the expression is evaluated in
     */
    @Builder.Default
    private String timezone = "UTC";

    /**
     * Off-peak hours (0-23). Advisory only.
     */
    @Builder.Default
    private List<Integer> preferredHours = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    public CronSchedule copy() {
        return new CronSchedule(expression, timezone,
            preferredHours != null ? new ArrayList<>(preferredHours) : new ArrayList<>(), enabled);
    }
}
