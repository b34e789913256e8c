package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Vault entry as persisted. {@code encryptedData} is the base64 envelope.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedCredential {

    private String id;

    private CredentialType type;

    private String encryptedData;

    private Instant createdAt;

    private Instant expiresAt;

    private RotationPolicy rotationPolicy;

    private Instant lastRotated;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
