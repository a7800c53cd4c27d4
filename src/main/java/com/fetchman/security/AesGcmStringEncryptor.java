package com.fetchman.security;

import com.fetchman.exception.ConfigurationException;
import com.fetchman.exception.MalformedPayloadException;
import com.fetchman.exception.PayloadAuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link StringEncryptor} that protects variable values with AES-256-GCM.
 * <p>
 * Every value is stored as a self-describing envelope {@code base64(iv):base64(ciphertext):base64(tag)},
 * so the encryptor keeps no per-value state. The AES key is the SHA-256 digest of the operator secret;
 * it is derived on first use and then shared read-only for the lifetime of the bean, which is a
 * singleton for the whole process.
 * <p>
 * Neither the secret, the key nor any plaintext is ever logged.
 */
@Slf4j
public class AesGcmStringEncryptor implements StringEncryptor {

    static final String DELIMITER = ":";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BYTES = 16;

    private final String secret;
    private final AtomicReference<SecretKey> derivedKey = new AtomicReference<>();
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param secret The operator-supplied secret. May be blank here; the failure is raised on
     *               first use so that code paths which never touch variables keep working.
     */
    public AesGcmStringEncryptor(String secret) {
        this.secret = secret;
    }

    /**
     * Derives the 256-bit AES key for a secret.
     *
     * @throws ConfigurationException if the secret is {@code null} or blank.
     */
    public static SecretKey deriveKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("Missing encryption secret: set ENCRYPTION_KEY (fetchman.encryption.secret)");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(digest, "AES");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }

    /**
     * Returns the cached key, deriving it on the first call. Concurrent first calls may both derive,
     * but they produce the same key and only one is ever published.
     */
    SecretKey key() {
        SecretKey key = derivedKey.get();
        if (key != null) {
            return key;
        }
        SecretKey fresh = deriveKey(secret);
        if (derivedKey.compareAndSet(null, fresh)) {
            log.debug("Derived variable encryption key");
            return fresh;
        }
        return derivedKey.get();
    }

    public boolean isConfigured() {
        return secret != null && !secret.isBlank();
    }

    /**
     * Encrypts a value under a fresh random 96-bit nonce.
     *
     * @return The three-part envelope.
     */
    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Value to encrypt must not be null");
        }
        SecretKey key = key();
        byte[] iv = new byte[IV_LENGTH_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            // JCE appends the tag to the ciphertext
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int split = sealed.length - TAG_LENGTH_BYTES;
            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv)
                    + DELIMITER + encoder.encodeToString(Arrays.copyOfRange(sealed, 0, split))
                    + DELIMITER + encoder.encodeToString(Arrays.copyOfRange(sealed, split, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Opens an envelope produced by {@link #encrypt(String)}.
     *
     * @throws MalformedPayloadException      if the envelope does not have three segments.
     * @throws PayloadAuthenticationException if a segment is not canonical base64 or the tag does not
     *                                        verify (tampering, truncation, wrong key).
     */
    @Override
    public String decrypt(String envelope) {
        if (envelope == null) {
            throw new MalformedPayloadException("Invalid encrypted payload format: null");
        }
        String[] segments = envelope.split(DELIMITER, -1);
        if (segments.length != 3) {
            throw new MalformedPayloadException("Invalid encrypted payload format: expected 3 segments, found " + segments.length);
        }

        byte[] iv = decodeSegment(segments[0]);
        byte[] ciphertext = decodeSegment(segments[1]);
        byte[] tag = decodeSegment(segments[2]);

        SecretKey key = key();
        if (iv.length != IV_LENGTH_BYTES || tag.length != TAG_LENGTH_BYTES) {
            throw new PayloadAuthenticationException("Encrypted payload failed verification: truncated nonce or tag", null);
        }

        byte[] sealed = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new PayloadAuthenticationException("Encrypted payload failed verification", e);
        }
    }

    /**
     * Decodes one segment, accepting only the exact text the encoder produces. The JDK decoder
     * ignores the unused low bits of the final character, which would let an altered envelope
     * decode to the original bytes.
     */
    private static byte[] decodeSegment(String segment) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(segment);
        } catch (IllegalArgumentException e) {
            throw new PayloadAuthenticationException("Encrypted payload failed verification: segment is not base64", e);
        }
        if (!Base64.getEncoder().encodeToString(decoded).equals(segment)) {
            throw new PayloadAuthenticationException("Encrypted payload failed verification: non-canonical base64 segment", null);
        }
        return decoded;
    }
}
