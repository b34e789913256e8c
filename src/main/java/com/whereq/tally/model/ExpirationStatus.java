package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Expiry view of a credential. {@code daysUntilExpiration} is null when it never expires.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpirationStatus {
    private boolean expired;
    private Long daysUntilExpiration;
}
