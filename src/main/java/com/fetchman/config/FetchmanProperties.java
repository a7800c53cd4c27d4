package com.fetchman.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Externalized settings bound from the {@code fetchman.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "fetchman")
public class FetchmanProperties {

    private Encryption encryption = new Encryption();
    private Http http = new Http();
    private Store store = new Store();

    @Data
    public static class Encryption {

        /**
         * Operator secret the AES key is derived from. Normally supplied through {@code ENCRYPTION_KEY}.
         */
        private String secret;

        /**
         * A non-blank secret shorter than this is rejected at startup.
         */
        private int minSecretLength = 16;
    }

    @Data
    public static class Http {

        /**
         * Upper bound for one outbound call, including reading the full response body.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Largest response body buffered in memory.
         */
        private DataSize maxResponseBytes = DataSize.ofMegabytes(16);
    }

    @Data
    public static class Store {

        /**
         * JSON file holding every workspace's encrypted variable records.
         */
        private String path = System.getProperty("user.home") + "/.fetchman/variables.json";
    }
}
