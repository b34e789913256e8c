package com.whereq.tally.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audit record. Never carries secret material.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEntry {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private String userId = "system";

    /**
     * Dotted action name, e.g. {@code credential.rotated}
     */
    private String action;

    private String resource;

    private String resourceId;

    @Builder.Default
    private AuditResult result = AuditResult.SUCCESS;

    private String errorMessage;

    private Map<String, Object> details;

    public static AuditEntry success(String action, String resource, String resourceId) {
        return AuditEntry.builder()
            .action(action)
            .resource(resource)
            .resourceId(resourceId)
            .build();
    }

    public static AuditEntry failure(String action, String resource, String resourceId, Throwable error) {
        return AuditEntry.builder()
            .action(action)
            .resource(resource)
            .resourceId(resourceId)
            .result(AuditResult.FAILURE)
            .errorMessage(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName())
            .build();
    }
}
