package com.whereq.tally.vault;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.model.EncryptedCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis-backed credential store. Entries (ciphertext only) are fields of the hash
 * {@code <prefix>credentials}, keyed by credential id.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tally.vault", name = "store", havingValue = "redis")
public class RedisCredentialStore implements CredentialStore {

    private final ReactiveHashOperations<String, String, EncryptedCredential> entries;
    private final String hashKey;

    @Autowired
    public RedisCredentialStore(@Qualifier("vaultRedisTemplate") ReactiveRedisTemplate<String, EncryptedCredential> redisTemplate,
                                TallyProperties properties) {
        this.entries = redisTemplate.opsForHash();
        this.hashKey = properties.getVault().getKeyPrefix() + "credentials";
    }

    @Override
    public Mono<Void> save(EncryptedCredential credential) {
        return entries.put(hashKey, credential.getId(), credential)
            .doOnSuccess(created -> log.debug("Persisted credential {} to Redis", credential.getId()))
            .then();
    }

    @Override
    public Mono<EncryptedCredential> find(String id) {
        return entries.get(hashKey, id);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return entries.remove(hashKey, id).map(removed -> removed > 0);
    }

    @Override
    public Flux<EncryptedCredential> findAll() {
        return entries.values(hashKey);
    }
}
