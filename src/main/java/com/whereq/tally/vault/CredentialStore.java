package com.whereq.tally.vault;

import com.whereq.tally.model.EncryptedCredential;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage for encrypted vault entries, keyed by credential id.
 * Implementations only ever see ciphertext.
 */
public interface CredentialStore {

    /**
     * Insert or replace an entry
     */
    Mono<Void> save(EncryptedCredential credential);

    /**
     * Find an entry
     *
     * @return Mono with the entry, empty if absent
     */
    Mono<EncryptedCredential> find(String id);

    /**
     * Remove an entry
     *
     * @return Mono with true if an entry was removed
     */
    Mono<Boolean> delete(String id);

    /**
     * All entries, in no particular order
     */
    Flux<EncryptedCredential> findAll();
}
