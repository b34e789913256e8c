package com.whereq.tally.crypto;

import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.EncryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionServiceTest {

    private static final String MASTER_KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private EncryptionService encryptionService;

    @BeforeEach
    void setUp() {
        encryptionService = new EncryptionService(MASTER_KEY, 1000);
    }

    @Nested
    @DisplayName("encrypt / decrypt")
    class RoundTrip {

        @Test
        void shouldDecryptWhatItEncrypted() {
            String plaintext = "{\"type\":\"api-key\",\"key\":\"s3cr3t\"} ünïcødé ✓";

            String envelope = encryptionService.encrypt(plaintext);

            assertThat(envelope).doesNotContain("s3cr3t");
            assertThat(encryptionService.decrypt(envelope)).isEqualTo(plaintext);
        }

        @Test
        void shouldHandleEmptyPlaintext() {
            String envelope = encryptionService.encrypt("");

            assertThat(Base64.getDecoder().decode(envelope)).hasSize(64);
            assertThat(encryptionService.decrypt(envelope)).isEmpty();
        }

        @Test
        void shouldUseFreshSaltAndIvEveryTime() {
            String first = encryptionService.encrypt("same input");
            String second = encryptionService.encrypt("same input");

            assertThat(first).isNotEqualTo(second);
        }

        @Test
        void shouldLayOutSaltIvTagThenCiphertext() {
            byte[] combined = Base64.getDecoder().decode(encryptionService.encrypt("abcde"));

            assertThat(combined).hasSize(32 + 16 + 16 + 5);
        }

        @Test
        void shouldNotDecryptWithAnotherMasterKey() {
            String envelope = encryptionService.encrypt("secret");
            EncryptionService other = new EncryptionService(
                "ff0102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f", 1000);

            assertThatThrownBy(() -> other.decrypt(envelope))
                .isInstanceOf(DecryptionException.class);
        }
    }

    @Nested
    @DisplayName("tamper detection")
    class Tampering {

        @Test
        void shouldRejectEveryFlippedByte() {
            byte[] original = Base64.getDecoder().decode(encryptionService.encrypt("account 12345"));

            for (int i = 0; i < original.length; i++) {
                byte[] tampered = original.clone();
                tampered[i] ^= 0x01;
                String envelope = Base64.getEncoder().encodeToString(tampered);

                assertThatThrownBy(() -> encryptionService.decrypt(envelope))
                    .as("byte %d", i)
                    .isInstanceOf(DecryptionException.class);
            }
        }

        @Test
        void shouldRejectTruncatedEnvelope() {
            String shortEnvelope = Base64.getEncoder().encodeToString(new byte[40]);

            assertThatThrownBy(() -> encryptionService.decrypt(shortEnvelope))
                .isInstanceOf(DecryptionException.class);
        }

        @Test
        void shouldRejectInvalidBase64() {
            assertThatThrownBy(() -> encryptionService.decrypt("not*base64!"))
                .isInstanceOf(DecryptionException.class);
        }
    }

    @Nested
    @DisplayName("additional authenticated data")
    class Aad {

        @Test
        void shouldReturnPlaintextAndAad() {
            String envelope = encryptionService.encryptWithAad("payload", "job-42");

            AadPayload payload = encryptionService.decryptWithAad(envelope);

            assertThat(payload.getData()).isEqualTo("payload");
            assertThat(payload.getAad()).isEqualTo("job-42");
        }

        @Test
        void shouldRejectModifiedAad() {
            byte[] combined = Base64.getDecoder().decode(encryptionService.encryptWithAad("payload", "job-42"));
            // aad starts after salt, iv, tag and the 4-byte length
            combined[64 + 4] ^= 0x01;
            String envelope = Base64.getEncoder().encodeToString(combined);

            assertThatThrownBy(() -> encryptionService.decryptWithAad(envelope))
                .isInstanceOf(DecryptionException.class);
        }

        @Test
        void shouldRejectImpossibleAadLength() {
            byte[] combined = Base64.getDecoder().decode(encryptionService.encryptWithAad("payload", "job-42"));
            combined[64] = 0x7f;
            String envelope = Base64.getEncoder().encodeToString(combined);

            assertThatThrownBy(() -> encryptionService.decryptWithAad(envelope))
                .isInstanceOf(DecryptionException.class);
        }
    }

    @Nested
    @DisplayName("hashing and signatures")
    class Signatures {

        @Test
        void shouldProduceKnownSha256() {
            assertThat(encryptionService.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }

        @Test
        void shouldVerifyOwnHmac() {
            String signature = encryptionService.hmac("audit line");

            assertThat(encryptionService.verify("audit line", signature)).isTrue();
            assertThat(encryptionService.verify("audit line!", signature)).isFalse();
            assertThat(encryptionService.verify("audit line", "00")).isFalse();
        }

        @Test
        void shouldProduceKnownHmacWithExplicitKey() {
            // RFC 4231 test case 2
            assertThat(encryptionService.hmac("what do ya want for nothing?", "Jefe"))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
        }

        @Test
        void shouldGenerateHexTokensOfRequestedLength() {
            assertThat(encryptionService.generateToken(16)).matches("[0-9a-f]{32}");
            assertThat(encryptionService.generateKey()).matches("[0-9a-f]{64}");
        }
    }

    @Nested
    @DisplayName("master key")
    class MasterKey {

        @Test
        void shouldRejectNonHexKey() {
            assertThatThrownBy(() -> new EncryptionService("zz-not-hex", 1000))
                .isInstanceOf(EncryptionException.class);
        }

        @Test
        void shouldRejectShortKey() {
            assertThatThrownBy(() -> new EncryptionService("0011", 1000))
                .isInstanceOf(EncryptionException.class);
        }

        @Test
        void shouldGenerateEphemeralKeyWhenMissing() {
            EncryptionService ephemeral = new EncryptionService(null, 1000);

            assertThat(ephemeral.decrypt(ephemeral.encrypt("x"))).isEqualTo("x");
        }
    }
}
