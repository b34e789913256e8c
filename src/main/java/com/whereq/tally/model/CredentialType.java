package com.whereq.tally.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of secret stored in the vault
 */
public enum CredentialType {
    OAUTH("oauth"),
    BASIC("basic"),
    CERTIFICATE("certificate"),
    API_KEY("api-key");

    private final String value;

    CredentialType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CredentialType fromValue(String value) {
        for (CredentialType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown credential type: " + value);
    }
}
