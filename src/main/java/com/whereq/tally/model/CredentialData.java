package com.whereq.tally.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Plaintext credential. Only ever exists in memory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@ToString(onlyExplicitlyIncluded = true)
public class CredentialData {

    @ToString.Include
    private CredentialType type;

    @ToString.Include
    private String username;

    private String password;

    private String token;

    private String key;

    private String certificate;

    private String privateKey;

    /**
     * Header used for api-key credentials
     */
    @ToString.Include
    private String headerName;
}
