package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Non-secret view of a vault entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialMetadata {
    private String id;
    private CredentialType type;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastRotated;
    private RotationPolicy rotationPolicy;
    private String description;
    private List<String> tags;

    public static CredentialMetadata from(EncryptedCredential entry) {
        return CredentialMetadata.builder()
            .id(entry.getId())
            .type(entry.getType())
            .createdAt(entry.getCreatedAt())
            .expiresAt(entry.getExpiresAt())
            .lastRotated(entry.getLastRotated())
            .rotationPolicy(entry.getRotationPolicy())
            .description(entry.getDescription())
            .tags(entry.getTags() != null ? List.copyOf(entry.getTags()) : List.of())
            .build();
    }
}
