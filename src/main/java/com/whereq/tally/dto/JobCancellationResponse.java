package com.whereq.tally.dto;

import com.whereq.tally.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of cancelling a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {

    private String jobId;

    /**
     * Status the job had when it was cancelled
     */
    private JobStatus previousStatus;

    /**
     * Always CANCELLED
     */
    private JobStatus status;

    private Instant cancelledAt;

    /**
     * Waiting or delayed attempts dropped from the queue
     */
    private int removedTasks;

    /**
     * An extraction was running; it finishes but its result is thrown away
     */
    private boolean inFlightDiscarded;

    private String message;
}
