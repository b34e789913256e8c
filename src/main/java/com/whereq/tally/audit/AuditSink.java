package com.whereq.tally.audit;

import reactor.core.publisher.Mono;

/**
 * Destination for audit records. Buffering, rotation and persistence are the
 * sink's own concern.
 */
public interface AuditSink {

    /**
     * Record an entry
     *
     * @param entry audit record
     * @return Mono that completes when the sink accepted the entry
     */
    Mono<Void> log(AuditEntry entry);
}
