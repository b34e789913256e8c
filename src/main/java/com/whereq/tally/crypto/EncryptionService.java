package com.whereq.tally.crypto;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.exception.DecryptionException;
import com.whereq.tally.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Encryption Service - AES-256-GCM with a PBKDF2-derived key per blob.
 *
 * Envelope layout (base64 encoded):
 * <pre>
 *   salt(32) || iv(16) || tag(16) || ciphertext
 *   salt(32) || iv(16) || tag(16) || aadLen(4, big-endian) || aad || ciphertext
 * </pre>
 * Salt and IV are fresh for every call. The key is derived from the process-wide
 * master key with PBKDF2-HMAC-SHA256.
 */
@Slf4j
@Service
public class EncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int SALT_LENGTH = 32;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final int HEADER_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;

    public static final int DEFAULT_ITERATIONS = 100_000;

    private final SecureRandom secureRandom = new SecureRandom();
    private final byte[] masterKey;
    private final int iterations;

    @Autowired
    public EncryptionService(TallyProperties properties) {
        this(properties.getEncryption().getMasterKey(), properties.getEncryption().getIterations());
    }

    /**
     * @param masterKeyHex hex-encoded master key, or null/blank for an ephemeral one
     * @param iterations PBKDF2 iteration count
     */
    public EncryptionService(String masterKeyHex, int iterations) {
        if (iterations <= 0) {
            throw new EncryptionException("PBKDF2 iterations must be positive, got " + iterations);
        }
        this.iterations = iterations;

        if (masterKeyHex == null || masterKeyHex.isBlank()) {
            log.warn("WARNING: tally.encryption.master-key is not set. Using a temporary random key. "
                + "Credentials stored now cannot be decrypted after a restart. DO NOT USE IN PRODUCTION!");
            this.masterKey = randomBytes(KEY_LENGTH);
        } else {
            try {
                this.masterKey = HexFormat.of().parseHex(masterKeyHex.trim());
            } catch (IllegalArgumentException e) {
                throw new EncryptionException("Master key must be hex encoded", e);
            }
            if (masterKey.length < 16) {
                throw new EncryptionException("Master key too short: " + masterKey.length + " bytes");
            }
        }
    }

    /**
     * Encrypt a UTF-8 string
     *
     * @param plaintext data to encrypt
     * @return base64 envelope
     */
    public String encrypt(String plaintext) {
        try {
            byte[] salt = randomBytes(SALT_LENGTH);
            byte[] iv = randomBytes(IV_LENGTH);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag; the envelope carries it up front
            int ctLength = sealed.length - TAG_LENGTH;
            byte[] combined = ByteBuffer.allocate(HEADER_LENGTH + ctLength)
                .put(salt)
                .put(iv)
                .put(sealed, ctLength, TAG_LENGTH)
                .put(sealed, 0, ctLength)
                .array();

            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decrypt an envelope produced by {@link #encrypt(String)}
     *
     * @param envelope base64 envelope
     * @return plaintext
     * @throws DecryptionException if the tag does not verify or the envelope is malformed
     */
    public String decrypt(String envelope) {
        byte[] combined = decodeEnvelope(envelope);
        if (combined.length < HEADER_LENGTH) {
            throw new DecryptionException("Decryption failed: envelope too short");
        }

        ByteBuffer buffer = ByteBuffer.wrap(combined);
        byte[] salt = take(buffer, SALT_LENGTH);
        byte[] iv = take(buffer, IV_LENGTH);
        byte[] tag = take(buffer, TAG_LENGTH);
        byte[] ciphertext = take(buffer, buffer.remaining());

        return new String(open(salt, iv, tag, ciphertext, null), StandardCharsets.UTF_8);
    }

    /**
     * Encrypt with additional authenticated data bound to the tag
     *
     * @param plaintext data to encrypt
     * @param additionalData authenticated but not encrypted
     * @return base64 envelope (AAD variant)
     */
    public String encryptWithAad(String plaintext, String additionalData) {
        try {
            byte[] salt = randomBytes(SALT_LENGTH);
            byte[] iv = randomBytes(IV_LENGTH);
            byte[] aad = additionalData.getBytes(StandardCharsets.UTF_8);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            cipher.updateAAD(aad);
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            int ctLength = sealed.length - TAG_LENGTH;
            byte[] combined = ByteBuffer.allocate(HEADER_LENGTH + 4 + aad.length + ctLength)
                .put(salt)
                .put(iv)
                .put(sealed, ctLength, TAG_LENGTH)
                .putInt(aad.length)
                .put(aad)
                .put(sealed, 0, ctLength)
                .array();

            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption with AAD failed: " + e.getMessage(), e);
        }
    }

    /**
     * Decrypt an AAD envelope
     *
     * @param envelope base64 envelope (AAD variant)
     * @return plaintext together with the authenticated data
     * @throws DecryptionException if the tag or the AAD does not verify
     */
    public AadPayload decryptWithAad(String envelope) {
        byte[] combined = decodeEnvelope(envelope);

        try {
            ByteBuffer buffer = ByteBuffer.wrap(combined);
            byte[] salt = take(buffer, SALT_LENGTH);
            byte[] iv = take(buffer, IV_LENGTH);
            byte[] tag = take(buffer, TAG_LENGTH);
            int aadLength = buffer.getInt();
            if (aadLength < 0 || aadLength > buffer.remaining()) {
                throw new DecryptionException("Decryption with AAD failed: invalid AAD length " + aadLength);
            }
            byte[] aad = take(buffer, aadLength);
            byte[] ciphertext = take(buffer, buffer.remaining());

            byte[] plaintext = open(salt, iv, tag, ciphertext, aad);
            return new AadPayload(
                new String(plaintext, StandardCharsets.UTF_8),
                new String(aad, StandardCharsets.UTF_8));
        } catch (BufferUnderflowException e) {
            throw new DecryptionException("Decryption with AAD failed: envelope too short", e);
        }
    }

    /**
     * SHA-256 hex digest
     */
    public String hash(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Hashing failed", e);
        }
    }

    /**
     * HMAC-SHA256 hex keyed with the master key
     */
    public String hmac(String data) {
        return hmac(data, masterKey);
    }

    /**
     * HMAC-SHA256 hex keyed with the UTF-8 bytes of {@code key}
     */
    public String hmac(String data, String key) {
        return hmac(data, key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Constant-time check of an HMAC produced by {@link #hmac(String)}
     */
    public boolean verify(String data, String signature) {
        return constantTimeEquals(signature, hmac(data));
    }

    /**
     * Constant-time check of an HMAC produced by {@link #hmac(String, String)}
     */
    public boolean verify(String data, String signature, String key) {
        return constantTimeEquals(signature, hmac(data, key));
    }

    /**
     * Cryptographically secure random token, hex encoded
     *
     * @param length number of random bytes
     */
    public String generateToken(int length) {
        return HexFormat.of().formatHex(randomBytes(length));
    }

    /**
     * Fresh 256-bit key, hex encoded. Suitable as a master key.
     */
    public String generateKey() {
        return generateToken(KEY_LENGTH);
    }

    public int getIterations() {
        return iterations;
    }

    private byte[] open(byte[] salt, byte[] iv, byte[] tag, byte[] ciphertext, byte[] aad) {
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            if (aad != null) {
                cipher.updateAAD(aad);
            }
            byte[] sealed = ByteBuffer.allocate(ciphertext.length + TAG_LENGTH)
                .put(ciphertext)
                .put(tag)
                .array();
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Decryption failed: authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed: " + e.getMessage(), e);
        }
    }

    /**
     * PBKDF2-HMAC-SHA256 over the raw master key bytes. PBEKeySpec only takes char[]
     * passwords, so the single 32-byte block is computed directly.
     */
    private SecretKeySpec deriveKey(byte[] salt) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(masterKey, HMAC_ALGORITHM));

        mac.update(salt);
        byte[] u = mac.doFinal(new byte[] {0, 0, 0, 1});
        byte[] derived = u.clone();
        for (int i = 1; i < iterations; i++) {
            u = mac.doFinal(u);
            for (int j = 0; j < derived.length; j++) {
                derived[j] ^= u[j];
            }
        }
        return new SecretKeySpec(Arrays.copyOf(derived, KEY_LENGTH), "AES");
    }

    private String hmac(String data, byte[] key) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("HMAC failed", e);
        }
    }

    private static boolean constantTimeEquals(String given, String expected) {
        if (given == null) {
            return false;
        }
        return MessageDigest.isEqual(
            given.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] decodeEnvelope(String envelope) {
        if (envelope == null) {
            throw new DecryptionException("Decryption failed: envelope is null");
        }
        try {
            return Base64.getDecoder().decode(envelope);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Decryption failed: envelope is not valid base64", e);
        }
    }

    private static byte[] take(ByteBuffer buffer, int length) {
        byte[] out = new byte[length];
        buffer.get(out);
        return out;
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
