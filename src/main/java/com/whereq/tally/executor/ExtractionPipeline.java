package com.whereq.tally.executor;

import com.whereq.tally.model.ExtractedData;
import reactor.core.publisher.Mono;

/**
 * Downstream consumer of successful extractions (validation, transformation, load)
 */
public interface ExtractionPipeline {

    Mono<Void> process(ExtractedData data);
}
