package com.whereq.tally.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.crypto.EncryptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes audit records as signed JSON lines to the {@code AUDIT} logger.
 * Route that logger to an append-only appender to keep a tamper-evident trail.
 */
@Slf4j(topic = "AUDIT")
@Component
public class LoggingAuditSink implements AuditSink {

    private final ObjectMapper objectMapper;
    private final EncryptionService encryptionService;

    @Autowired
    public LoggingAuditSink(ObjectMapper objectMapper, EncryptionService encryptionService) {
        this.objectMapper = objectMapper;
        this.encryptionService = encryptionService;
    }

    @Override
    public Mono<Void> log(AuditEntry entry) {
        return Mono.fromCallable(() -> sign(entry))
            .doOnNext(log::info)
            .then();
    }

    /**
     * Serialize an entry and append its HMAC
     *
     * @return {@code <json>|<hmac>}
     */
    public String sign(AuditEntry entry) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(entry);
        return json + "|" + encryptionService.hmac(json);
    }

    /**
     * Check a line produced by {@link #sign(AuditEntry)}
     */
    public boolean verifyLine(String line) {
        int separator = line.lastIndexOf('|');
        if (separator < 0) {
            return false;
        }
        return encryptionService.verify(line.substring(0, separator), line.substring(separator + 1));
    }
}
