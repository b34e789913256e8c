package com.whereq.tally.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Payload of a lifecycle event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobEvent {

    private JobEventType type;

    private String jobId;

    private Instant timestamp;

    /**
     * Attempt number, for execution events
     */
    private Integer attempt;

    /**
     * Failure message, for failed events
     */
    private String error;

    /**
     * Progress in percent, for progress events
     */
    private Integer percentage;

    /**
     * Event-specific data (extraction result, next run, retry delay...)
     */
    private Map<String, Object> data;

    public static JobEvent of(JobEventType type, String jobId) {
        return JobEvent.builder()
            .type(type)
            .jobId(jobId)
            .timestamp(Instant.now())
            .build();
    }
}
