package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recurring extraction job
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    /**
     * Caller-supplied unique identifier
     */
    private String id;

    private String name;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private CronSchedule schedule;

    private DataSource source;

    private CredentialReference credentialRef;

    /**
     * Selects the registered extractor, e.g. "api" or "web-automation"
     */
    private String extractionMethod;

    private RetryConfig retryConfig;

    @Builder.Default
    private JobStatus status = JobStatus.IDLE;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant lastRunAt;

    /**
     * Independent copy, safe to hand to callers
     */
    public Job copy() {
        return toBuilder()
            .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
            .schedule(schedule != null ? schedule.copy() : null)
            .source(source != null ? source.copy() : null)
            .credentialRef(credentialRef != null ? credentialRef.copy() : null)
            .retryConfig(retryConfig != null ? retryConfig.copy() : null)
            .build();
    }
}
