package com.fetchman.config;

import com.fetchman.exception.ConfigurationException;
import com.fetchman.security.AesGcmStringEncryptor;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Registers the variable encryptor and applies the secret policy.
 * <p>
 * The bean is named {@code jasyptStringEncryptor} so the Jasypt starter picks it up instead of
 * creating its own PBE encryptor. It is primary because the starter also exposes a lazy
 * {@link StringEncryptor} that delegates to it.
 */
@Configuration
@Slf4j
public class EncryptionConfig {

    @Bean(name = "jasyptStringEncryptor")
    @Primary
    public AesGcmStringEncryptor jasyptStringEncryptor(FetchmanProperties properties) {
        FetchmanProperties.Encryption encryption = properties.getEncryption();
        String secret = encryption.getSecret();

        if (secret == null || secret.isBlank()) {
            log.warn("No encryption secret configured (ENCRYPTION_KEY). Workspace variables are unavailable until one is set.");
        } else if (secret.length() < encryption.getMinSecretLength()) {
            throw new ConfigurationException("Encryption secret must be at least "
                    + encryption.getMinSecretLength() + " characters long");
        }
        return new AesGcmStringEncryptor(secret);
    }
}
