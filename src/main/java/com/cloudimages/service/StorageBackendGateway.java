package com.cloudimages.service;

import com.cloudimages.entity.StorageProviderEntity;
import com.cloudimages.exception.DecryptionException;
import com.cloudimages.exception.ProviderConnectionException;
import com.cloudimages.exception.ValidationException;
import com.cloudimages.storage.BackendCallExecutor;
import com.cloudimages.storage.StorageBackend;
import com.cloudimages.storage.StorageBackendFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Single entry point for talking to a provider's remote storage.
 *
 * Each call decrypts the provider's credentials, builds a fresh backend,
 * runs one operation on it under the bounded timeout and closes it again.
 * Decrypted credentials never leave this method's scope.
 */
@Component
public class StorageBackendGateway {

    private static final Logger log = LoggerFactory.getLogger(StorageBackendGateway.class);

    @FunctionalInterface
    public interface BackendOperation<T> {
        T apply(StorageBackend backend) throws Exception;
    }

    private final CredentialVault credentialVault;
    private final StorageBackendFactory backendFactory;
    private final BackendCallExecutor callExecutor;

    public StorageBackendGateway(CredentialVault credentialVault,
            StorageBackendFactory backendFactory,
            BackendCallExecutor callExecutor) {
        this.credentialVault = credentialVault;
        this.backendFactory = backendFactory;
        this.callExecutor = callExecutor;
    }

    /**
     * Runs {@code operation} against the provider's backend.
     *
     * @param description short label for logs, e.g. "upload"
     * @throws ProviderConnectionException if the provider has no usable
     *                                     credentials, is misconfigured,
     *                                     unreachable or too slow
     */
    public <T> T execute(StorageProviderEntity provider, String description, BackendOperation<T> operation) {
        return execute(provider, description, operation, null);
    }

    /**
     * Runs {@code operation} against the provider's backend. A result that
     * only arrives after the call timed out goes to {@code lateResultHandler}.
     *
     * @see BackendCallExecutor#call(String, java.util.concurrent.Callable, Consumer)
     */
    public <T> T execute(StorageProviderEntity provider, String description, BackendOperation<T> operation,
            Consumer<? super T> lateResultHandler) {
        if (!provider.hasCredentials()) {
            throw new ProviderConnectionException("No credentials configured for storage provider " + provider.getId());
        }
        Map<String, Object> credentials;
        try {
            credentials = credentialVault.decrypt(provider.getEncryptedCredentials());
        } catch (DecryptionException e) {
            log.warn("Credentials of storage provider {} could not be decrypted: {}", provider.getId(), e.getMessage());
            throw new ProviderConnectionException("Stored credentials for storage provider " + provider.getId()
                    + " are unreadable; please re-enter them");
        }
        Map<String, Object> config = new LinkedHashMap<>(provider.getConfig());
        String label = description + " on provider " + provider.getId();

        return callExecutor.call(label, () -> {
            try (StorageBackend backend = backendFactory.create(provider.getProviderType(), config, credentials)) {
                return operation.apply(backend);
            } catch (ValidationException e) {
                throw new ProviderConnectionException(
                        "Storage provider " + provider.getId() + " is misconfigured: " + e.getMessage(), e);
            }
        }, lateResultHandler);
    }
}
