package com.whereq.tally.crypto;

import lombok.Value;

/**
 * Plaintext recovered from an AAD envelope together with the data it was bound to
 */
@Value
public class AadPayload {
    String data;
    String aad;
}
