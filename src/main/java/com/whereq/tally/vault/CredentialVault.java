package com.whereq.tally.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.audit.AuditEntry;
import com.whereq.tally.audit.AuditLogger;
import com.whereq.tally.crypto.EncryptionService;
import com.whereq.tally.exception.CredentialExpiredException;
import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.EncryptionException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.ValidationException;
import com.whereq.tally.model.CredentialData;
import com.whereq.tally.model.CredentialMetadata;
import com.whereq.tally.model.EncryptedCredential;
import com.whereq.tally.model.ExpirationStatus;
import com.whereq.tally.model.RotationPolicy;
import com.whereq.tally.model.StorageOptions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;

/**
 * Encrypted storage for third-party credentials with expiry and rotation-policy
 * bookkeeping.
 *
 * Every operation is audited, success or failure. Auditing never blocks or fails the
 * operation. Concurrent writes to the same id are last-writer-wins.
 */
@Slf4j
@Service
public class CredentialVault {

    private static final String RESOURCE = "credential-vault";
    private static final long DAY_MS = Duration.ofDays(1).toMillis();

    private final EncryptionService encryptionService;
    private final CredentialStore store;
    private final AuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Counter rotationNeededCounter;

    @Autowired
    public CredentialVault(EncryptionService encryptionService,
                           CredentialStore store,
                           AuditLogger auditLogger,
                           ObjectMapper objectMapper,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.encryptionService = encryptionService;
        this.store = store;
        this.auditLogger = auditLogger;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rotationNeededCounter = Counter.builder("tally.vault.rotation.needed")
            .description("Credential reads that found the rotation policy exceeded")
            .register(meterRegistry);
    }

    /**
     * Store credentials, replacing any entry with the same id
     *
     * @param id credential identifier
     * @param credentials plaintext credentials
     * @param options expiry, rotation policy and descriptive metadata
     * @return Mono that completes when stored
     */
    public Mono<Void> store(String id, CredentialData credentials, StorageOptions options) {
        StorageOptions opts = options != null ? options : StorageOptions.defaults();

        return Mono.fromCallable(() -> {
                validate(id, credentials);
                Instant now = clock.instant();
                return EncryptedCredential.builder()
                    .id(id)
                    .type(credentials.getType())
                    .encryptedData(encryptionService.encrypt(toJson(credentials)))
                    .createdAt(now)
                    .expiresAt(opts.getExpiresAt())
                    .rotationPolicy(opts.getRotationPolicy() != null ? opts.getRotationPolicy() : RotationPolicy.MANUAL)
                    .lastRotated(now)
                    .description(opts.getDescription() != null ? opts.getDescription() : "")
                    .tags(opts.getTags() != null ? new ArrayList<>(opts.getTags()) : new ArrayList<>())
                    .build();
            })
            .subscribeOn(Schedulers.boundedElastic()) // key derivation is CPU heavy
            .flatMap(entry -> store.save(entry).thenReturn(entry))
            .doOnSuccess(entry -> {
                log.info("Stored credential {} (type={}, rotation={})", id, entry.getType(), entry.getRotationPolicy());
                auditLogger.record(AuditEntry.builder()
                    .action("credential.stored")
                    .resource(RESOURCE)
                    .resourceId(id)
                    .details(Map.of(
                        "type", entry.getType().getValue(),
                        "rotationPolicy", entry.getRotationPolicy().name()))
                    .build());
            })
            .doOnError(e -> auditFailure("credential.store.failed", id, e))
            .then();
    }

    public Mono<Void> store(String id, CredentialData credentials) {
        return store(id, credentials, null);
    }

    /**
     * Retrieve and decrypt credentials. Also checks the rotation policy, which only
     * flags an overdue rotation and never blocks the read.
     *
     * @param id credential identifier
     * @return Mono with the plaintext credentials
     */
    public Mono<CredentialData> retrieve(String id) {
        return store.find(id)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Credential " + id + " not found in vault")))
            .publishOn(Schedulers.boundedElastic())
            .map(entry -> {
                if (entry.getExpiresAt() != null && entry.getExpiresAt().isBefore(clock.instant())) {
                    throw new CredentialExpiredException("Credential " + id + " has expired");
                }
                CredentialData credentials = fromJson(encryptionService.decrypt(entry.getEncryptedData()));
                checkRotationPolicy(entry);
                return credentials;
            })
            .doOnSuccess(credentials -> auditLogger.record(AuditEntry.success("credential.retrieved", RESOURCE, id)))
            .doOnError(e -> auditFailure("credential.retrieve.failed", id, e));
    }

    /**
     * Replace the secret of an existing credential and reset its rotation clock
     *
     * @param id credential identifier
     * @param credentials new plaintext credentials
     * @return Mono that completes when updated
     */
    public Mono<Void> update(String id, CredentialData credentials) {
        return reencrypt(id, credentials)
            .doOnSuccess(v -> auditLogger.record(AuditEntry.success("credential.updated", RESOURCE, id)))
            .doOnError(e -> auditFailure("credential.update.failed", id, e));
    }

    /**
     * Rotate credentials: an update recorded as a rotation
     *
     * @param id credential identifier
     * @param newCredentials freshly obtained credentials
     * @return Mono that completes when rotated
     */
    public Mono<Void> rotate(String id, CredentialData newCredentials) {
        return update(id, newCredentials)
            .doOnSuccess(v -> {
                log.info("Rotated credential {}", id);
                auditLogger.record(AuditEntry.success("credential.rotated", RESOURCE, id));
            });
    }

    /**
     * Delete credentials
     *
     * @param id credential identifier
     * @return Mono that completes when deleted
     */
    public Mono<Void> delete(String id) {
        return store.delete(id)
            .flatMap(deleted -> deleted
                ? Mono.<Void>empty()
                : Mono.error(new NotFoundException("Credential " + id + " not found")))
            .doOnSuccess(v -> {
                log.info("Deleted credential {}", id);
                auditLogger.record(AuditEntry.success("credential.deleted", RESOURCE, id));
            })
            .doOnError(e -> auditFailure("credential.delete.failed", id, e));
    }

    /**
     * List non-secret metadata of all credentials
     */
    public Flux<CredentialMetadata> list() {
        return store.findAll().map(CredentialMetadata::from);
    }

    /**
     * Expiry status of a credential
     *
     * @param id credential identifier
     * @return Mono with the status; days are floored and negative once expired
     */
    public Mono<ExpirationStatus> getExpirationStatus(String id) {
        return store.find(id)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Credential " + id + " not found")))
            .map(entry -> {
                if (entry.getExpiresAt() == null) {
                    return new ExpirationStatus(false, null);
                }
                Instant now = clock.instant();
                long remainingMs = entry.getExpiresAt().toEpochMilli() - now.toEpochMilli();
                return new ExpirationStatus(entry.getExpiresAt().isBefore(now), Math.floorDiv(remainingMs, DAY_MS));
            });
    }

    private Mono<Void> reencrypt(String id, CredentialData credentials) {
        return store.find(id)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Credential " + id + " not found")))
            .publishOn(Schedulers.boundedElastic())
            .map(existing -> {
                validate(id, credentials);
                return existing.toBuilder()
                    .type(credentials.getType())
                    .encryptedData(encryptionService.encrypt(toJson(credentials)))
                    .lastRotated(clock.instant())
                    .build();
            })
            .flatMap(store::save);
    }

    /**
     * Flag (never perform) a rotation that the entry's policy says is overdue
     */
    private void checkRotationPolicy(EncryptedCredential entry) {
        RotationPolicy policy = entry.getRotationPolicy() != null ? entry.getRotationPolicy() : RotationPolicy.MANUAL;
        long daysSinceRotation = Math.floorDiv(
            clock.instant().toEpochMilli() - entry.getLastRotated().toEpochMilli(), DAY_MS);

        if (policy.isRotationDue(daysSinceRotation)) {
            log.warn("Credential {} needs rotation: policy={}, {} days since last rotation",
                entry.getId(), policy, daysSinceRotation);
            rotationNeededCounter.increment();
            auditLogger.record(AuditEntry.builder()
                .action("credential.rotation.needed")
                .resource(RESOURCE)
                .resourceId(entry.getId())
                .details(Map.of("policy", policy.name(), "daysSinceRotation", daysSinceRotation))
                .build());
        }
    }

    private void validate(String id, CredentialData credentials) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Credential id is required");
        }
        if (credentials == null) {
            throw new ValidationException("Credential data is required for " + id);
        }
        if (credentials.getType() == null) {
            throw new ValidationException("Credential type is required for " + id);
        }
    }

    private String toJson(CredentialData credentials) {
        try {
            return objectMapper.writeValueAsString(credentials);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize credential", e);
        }
    }

    private CredentialData fromJson(String json) {
        try {
            return objectMapper.readValue(json, CredentialData.class);
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Decrypted credential is not valid JSON", e);
        }
    }

    private void auditFailure(String action, String id, Throwable error) {
        log.error("Vault operation {} failed for {}: {}", action, id, error.getMessage());
        auditLogger.record(AuditEntry.failure(action, RESOURCE, id, error));
    }
}
