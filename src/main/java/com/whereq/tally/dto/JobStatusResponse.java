package com.whereq.tally.dto;

import com.whereq.tally.model.ExtractionMetadata;
import com.whereq.tally.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    private String name;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Attempt of the current or last run
     */
    private int attempt;

    /**
     * Retries performed since the job was scheduled
     */
    private int retryCount;

    /**
     * Progress of the running extraction, in percent
     */
    private Integer progress;

    private Instant scheduledAt;

    /**
     * When the last run started
     */
    private Instant lastRunAt;

    /**
     * When the last run finished
     */
    private Instant completedAt;

    /**
     * Next scheduled fire; null when paused or cancelled
     */
    private Instant nextRunAt;

    /**
     * Error message of the last failed attempt
     */
    private String errorMessage;

    /**
     * Metadata of the last successful extraction
     */
    private ExtractionMetadata lastResult;
}
