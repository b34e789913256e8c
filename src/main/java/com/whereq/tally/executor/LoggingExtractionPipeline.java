package com.whereq.tally.executor;

import com.whereq.tally.model.ExtractedData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Default pipeline: records receipt only
 */
@Slf4j
@Component
public class LoggingExtractionPipeline implements ExtractionPipeline {

    @Override
    public Mono<Void> process(ExtractedData data) {
        return Mono.fromRunnable(() -> log.info("Received extraction of job {}: {} record(s), {} bytes, checksum {}",
            data.getJobId(),
            data.getMetadata() != null ? data.getMetadata().getRecordCount() : 0,
            data.getDataSize(),
            data.getMetadata() != null ? data.getMetadata().getChecksumHash() : null));
    }
}
