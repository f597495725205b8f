package com.cloudimages.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the credential encryption key once at startup. A missing or malformed
 * key aborts context startup.
 */
@Configuration
public class VaultConfig {

    private static final Logger log = LoggerFactory.getLogger(VaultConfig.class);

    @Bean
    public VaultKey vaultKey(AppConfig appConfig) {
        VaultKey key = VaultKey.fromBase64(appConfig.getEncryptionKey());
        log.info("Credential vault initialized with {}", key);
        return key;
    }
}
