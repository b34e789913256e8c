package com.whereq.tally.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.audit.AuditEntry;
import com.whereq.tally.audit.AuditLogger;
import com.whereq.tally.audit.AuditResult;
import com.whereq.tally.crypto.EncryptionService;
import com.whereq.tally.exception.CredentialExpiredException;
import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.NotFoundException;
import com.whereq.tally.exception.ValidationException;
import com.whereq.tally.model.CredentialData;
import com.whereq.tally.model.CredentialType;
import com.whereq.tally.model.EncryptedCredential;
import com.whereq.tally.model.RotationPolicy;
import com.whereq.tally.model.StorageOptions;
import com.whereq.tally.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CredentialVaultTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private AuditLogger auditLogger;

    private InMemoryCredentialStore store;
    private EncryptionService encryptionService;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        encryptionService = new EncryptionService(
            "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f", 1000);
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(START);
        vault = new CredentialVault(encryptionService, store, auditLogger,
            new ObjectMapper().findAndRegisterModules(), meterRegistry, clock);
    }

    private static CredentialData apiKey(String key) {
        return CredentialData.builder()
            .type(CredentialType.API_KEY)
            .key(key)
            .headerName("X-Bank-Key")
            .build();
    }

    private List<AuditEntry> auditEntries() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogger, atLeastOnce()).record(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("store and retrieve")
    class StoreAndRetrieve {

        @Test
        void shouldReturnStoredCredentials() {
            StepVerifier.create(vault.store("acme", apiKey("k-123"))
                    .then(vault.retrieve("acme")))
                .assertNext(credentials -> {
                    assertThat(credentials.getType()).isEqualTo(CredentialType.API_KEY);
                    assertThat(credentials.getKey()).isEqualTo("k-123");
                    assertThat(credentials.getHeaderName()).isEqualTo("X-Bank-Key");
                })
                .verifyComplete();
        }

        @Test
        void shouldNeverPersistPlaintext() {
            vault.store("acme", apiKey("very-secret-key")).block();

            EncryptedCredential persisted = store.find("acme").block();
            assertThat(persisted).isNotNull();
            assertThat(persisted.getEncryptedData()).doesNotContain("very-secret-key");
            assertThat(persisted.getLastRotated()).isEqualTo(START);
        }

        @Test
        void shouldReplaceExistingEntry() {
            StepVerifier.create(vault.store("acme", apiKey("first"))
                    .then(vault.store("acme", apiKey("second")))
                    .then(vault.retrieve("acme")))
                .assertNext(credentials -> assertThat(credentials.getKey()).isEqualTo("second"))
                .verifyComplete();
        }

        @Test
        void shouldFailForUnknownId() {
            StepVerifier.create(vault.retrieve("missing"))
                .expectError(NotFoundException.class)
                .verify();

            assertThat(auditEntries())
                .anyMatch(e -> e.getAction().equals("credential.retrieve.failed") && e.getResult() == AuditResult.FAILURE);
        }

        @Test
        void shouldRejectMissingType() {
            StepVerifier.create(vault.store("acme", CredentialData.builder().key("k").build()))
                .expectError(ValidationException.class)
                .verify();
        }

        @Test
        void shouldFailOnCorruptedEntry() {
            vault.store("acme", apiKey("k")).block();
            EncryptedCredential persisted = store.find("acme").block();
            store.save(persisted.toBuilder().encryptedData(encryptionService.encrypt("x").substring(4) + "AAAA").build()).block();

            StepVerifier.create(vault.retrieve("acme"))
                .expectError(DecryptionException.class)
                .verify();
        }

        @Test
        void shouldAuditWithoutSecrets() {
            vault.store("acme", apiKey("never-logged")).then(vault.retrieve("acme")).block();

            assertThat(auditEntries())
                .extracting(AuditEntry::getAction)
                .contains("credential.stored", "credential.retrieved");
            assertThat(auditEntries().toString()).doesNotContain("never-logged");
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        void shouldRejectExpiredCredential() {
            StorageOptions options = StorageOptions.builder().expiresAt(START.plus(Duration.ofDays(1))).build();
            vault.store("acme", apiKey("k"), options).block();

            clock.advance(Duration.ofDays(2));

            StepVerifier.create(vault.retrieve("acme"))
                .expectError(CredentialExpiredException.class)
                .verify();
        }

        @Test
        void shouldReportDaysUntilExpiration() {
            StorageOptions options = StorageOptions.builder()
                .expiresAt(START.plus(Duration.ofDays(10)).plus(Duration.ofHours(5)))
                .build();
            vault.store("acme", apiKey("k"), options).block();

            StepVerifier.create(vault.getExpirationStatus("acme"))
                .assertNext(status -> {
                    assertThat(status.isExpired()).isFalse();
                    assertThat(status.getDaysUntilExpiration()).isEqualTo(10L);
                })
                .verifyComplete();
        }

        @Test
        void shouldReportNegativeDaysOnceExpired() {
            StorageOptions options = StorageOptions.builder().expiresAt(START.plus(Duration.ofDays(1))).build();
            vault.store("acme", apiKey("k"), options).block();
            clock.advance(Duration.ofDays(3));

            StepVerifier.create(vault.getExpirationStatus("acme"))
                .assertNext(status -> {
                    assertThat(status.isExpired()).isTrue();
                    assertThat(status.getDaysUntilExpiration()).isEqualTo(-2L);
                })
                .verifyComplete();
        }

        @Test
        void shouldReportNoExpiry() {
            vault.store("acme", apiKey("k")).block();

            StepVerifier.create(vault.getExpirationStatus("acme"))
                .assertNext(status -> {
                    assertThat(status.isExpired()).isFalse();
                    assertThat(status.getDaysUntilExpiration()).isNull();
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("rotation")
    class Rotation {

        @Test
        void shouldReplaceSecretAndResetRotationClock() {
            vault.store("acme", apiKey("old"), StorageOptions.builder().rotationPolicy(RotationPolicy.WEEKLY).build()).block();
            clock.advance(Duration.ofDays(3));

            StepVerifier.create(vault.rotate("acme", apiKey("new")).then(vault.retrieve("acme")))
                .assertNext(credentials -> assertThat(credentials.getKey()).isEqualTo("new"))
                .verifyComplete();

            EncryptedCredential persisted = store.find("acme").block();
            assertThat(persisted.getLastRotated()).isEqualTo(START.plus(Duration.ofDays(3)));
            assertThat(persisted.getCreatedAt()).isEqualTo(START);
            assertThat(persisted.getRotationPolicy()).isEqualTo(RotationPolicy.WEEKLY);
            assertThat(auditEntries()).extracting(AuditEntry::getAction).contains("credential.updated", "credential.rotated");
        }

        @Test
        void shouldFlagOverdueRotationWithoutBlockingRead() {
            vault.store("acme", apiKey("k"), StorageOptions.builder().rotationPolicy(RotationPolicy.DAILY).build()).block();
            clock.advance(Duration.ofDays(2));

            StepVerifier.create(vault.retrieve("acme"))
                .assertNext(credentials -> assertThat(credentials.getKey()).isEqualTo("k"))
                .verifyComplete();

            assertThat(meterRegistry.counter("tally.vault.rotation.needed").count()).isEqualTo(1.0);
            assertThat(auditEntries()).extracting(AuditEntry::getAction).contains("credential.rotation.needed");
        }

        @Test
        void shouldNeverFlagManualPolicy() {
            vault.store("acme", apiKey("k")).block();
            clock.advance(Duration.ofDays(400));

            vault.retrieve("acme").block();

            assertThat(meterRegistry.counter("tally.vault.rotation.needed").count()).isZero();
        }

        @Test
        void shouldFailToRotateUnknownCredential() {
            StepVerifier.create(vault.rotate("missing", apiKey("k")))
                .expectError(NotFoundException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("delete and list")
    class DeleteAndList {

        @Test
        void shouldDeleteCredential() {
            vault.store("acme", apiKey("k")).block();

            StepVerifier.create(vault.delete("acme").then(vault.retrieve("acme")))
                .expectError(NotFoundException.class)
                .verify();
        }

        @Test
        void shouldFailToDeleteUnknownCredential() {
            StepVerifier.create(vault.delete("missing"))
                .expectError(NotFoundException.class)
                .verify();
        }

        @Test
        void shouldListMetadataOnly() {
            vault.store("a", apiKey("k1"), StorageOptions.builder().description("Bank A").tags(List.of("ach")).build())
                .then(vault.store("b", CredentialData.builder().type(CredentialType.OAUTH).token("t").build()))
                .block();

            StepVerifier.create(vault.list().collectList())
                .assertNext(list -> {
                    assertThat(list).extracting("id").containsExactlyInAnyOrder("a", "b");
                    assertThat(list).filteredOn(m -> m.getId().equals("a"))
                        .singleElement()
                        .satisfies(m -> {
                            assertThat(m.getDescription()).isEqualTo("Bank A");
                            assertThat(m.getTags()).containsExactly("ach");
                        });
                })
                .verifyComplete();
        }
    }
}
