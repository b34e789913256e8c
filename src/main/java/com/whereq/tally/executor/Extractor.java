package com.whereq.tally.executor;

import com.whereq.tally.model.ExtractedData;

/**
 * Interface for extraction strategies, selected by a job's extraction method
 */
public interface Extractor {

    /**
     * Extraction method this strategy serves, e.g. {@code api}
     */
    String getMethod();

    /**
     * Extract synchronously (blocking). Runs on a queue worker thread.
     *
     * @param params job, credentials and progress reporting
     * @return extracted data
     * @throws Exception if extraction fails; the message decides whether it is retried
     */
    ExtractedData extract(ExtractionParams params) throws Exception;
}
