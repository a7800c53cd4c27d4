package com.fetchman.model;

import com.fetchman.exception.FetchmanException;
import com.fetchman.exception.MalformedPayloadException;
import com.fetchman.exception.PayloadAuthenticationException;
import org.jasypt.encryption.StringEncryptor;

/**
 * Result of decrypting a single {@link VariableRecord}: either the plaintext or the failure.
 * <p>
 * The execution path keeps only successes, while the management view reports failures as
 * {@code decryption_failed}. Both policies aggregate over the same list of outcomes.
 *
 * @param source    The stored record.
 * @param plaintext The decrypted value, {@code null} on failure.
 * @param failure   The per-record failure, {@code null} on success.
 */
public record DecryptionOutcome(VariableRecord source, String plaintext, FetchmanException failure) {

    /**
     * Decrypts one record. Malformed or unauthenticated envelopes become a failed outcome;
     * anything else (notably a missing encryption secret) propagates, because it affects every record.
     */
    public static DecryptionOutcome attempt(VariableRecord source, StringEncryptor encryptor) {
        try {
            return new DecryptionOutcome(source, encryptor.decrypt(source.value()), null);
        } catch (MalformedPayloadException | PayloadAuthenticationException e) {
            return new DecryptionOutcome(source, null, e);
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String key() {
        return source.key();
    }
}
