package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional settings for storing a credential
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageOptions {

    private Instant expiresAt;

    @Builder.Default
    private RotationPolicy rotationPolicy = RotationPolicy.MANUAL;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    public static StorageOptions defaults() {
        return StorageOptions.builder().build();
    }
}
