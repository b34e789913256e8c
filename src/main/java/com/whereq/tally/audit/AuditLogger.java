package com.whereq.tally.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Fire-and-forget front for the audit sink. A failing sink is logged and never
 * reaches the operation being audited.
 */
@Slf4j
@Component
public class AuditLogger {

    private final AuditSink sink;

    @Autowired
    public AuditLogger(AuditSink sink) {
        this.sink = sink;
    }

    public void record(AuditEntry entry) {
        Mono.defer(() -> sink.log(entry))
            .doOnError(e -> log.error("Failed to write audit entry {} for {}: {}",
                entry.getAction(), entry.getResourceId(), e.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail the audited operation
            .subscribe();
    }
}
