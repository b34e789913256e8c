package com.whereq.tally.vault;

import com.whereq.tally.model.EncryptedCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local credential store. Entries are lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tally.vault", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentHashMap<String, EncryptedCredential> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(EncryptedCredential credential) {
        return Mono.fromRunnable(() -> entries.put(credential.getId(), credential));
    }

    @Override
    public Mono<EncryptedCredential> find(String id) {
        return Mono.justOrEmpty(entries.get(id));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.fromCallable(() -> entries.remove(id) != null);
    }

    @Override
    public Flux<EncryptedCredential> findAll() {
        return Flux.fromIterable(entries.values());
    }
}
