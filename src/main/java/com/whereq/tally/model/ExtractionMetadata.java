package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Facts about how an extraction went
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionMetadata {
    private String source;
    private long extractionDurationMs;
    private int recordCount;
    private String fileFormat;
    private boolean compressionUsed;
    private String checksumHash;
}
