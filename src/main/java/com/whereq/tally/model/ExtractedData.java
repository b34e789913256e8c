package com.whereq.tally.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one successful extraction
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedData {

    private String jobId;

    private Instant timestamp;

    /**
     * Raw payload as returned by the source
     */
    private JsonNode rawData;

    private ExtractionMetadata metadata;

    /**
     * Payload size in bytes
     */
    private long dataSize;
}
