package com.whereq.tally.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.crypto.EncryptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingAuditSinkTest {

    private LoggingAuditSink sink;

    @BeforeEach
    void setUp() {
        EncryptionService encryptionService = new EncryptionService(
            "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f", 1000);
        sink = new LoggingAuditSink(new ObjectMapper().findAndRegisterModules(), encryptionService);
    }

    private static AuditEntry entry() {
        return AuditEntry.builder()
            .timestamp(Instant.parse("2024-03-01T02:00:00Z"))
            .action("job.cancelled")
            .resource("job")
            .resourceId("daily-ach")
            .details(Map.of("previousStatus", "SCHEDULED"))
            .build();
    }

    @Test
    void signedLineShouldVerify() throws Exception {
        String line = sink.sign(entry());

        assertThat(line).contains("\"action\":\"job.cancelled\"");
        assertThat(sink.verifyLine(line)).isTrue();
    }

    @Test
    void editedLineShouldNotVerify() throws Exception {
        String line = sink.sign(entry());
        String tampered = line.replace("daily-ach", "daily-wire");

        assertThat(sink.verifyLine(tampered)).isFalse();
    }

    @Test
    void lineWithoutSignatureShouldNotVerify() {
        assertThat(sink.verifyLine("{\"action\":\"job.cancelled\"}")).isFalse();
    }

    @Test
    void shouldCompleteWhenLogging() {
        StepVerifier.create(sink.log(entry()))
            .verifyComplete();
    }
}
