package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pointer into the credential vault. Never holds the secret itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialReference {
    private String vaultId;
    private CredentialType type;

    public CredentialReference copy() {
        return new CredentialReference(vaultId, type);
    }
}
