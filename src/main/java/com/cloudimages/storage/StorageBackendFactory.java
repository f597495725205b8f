package com.cloudimages.storage;

import com.cloudimages.entity.ProviderType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Maps each {@link ProviderType} to the backend that serves it. The mapping is
 * fixed when the factory is built, so callers never branch on the type.
 */
@Component
public class StorageBackendFactory {

    private final Map<ProviderType, BiFunction<Map<String, Object>, Map<String, Object>, StorageBackend>> builders =
            new EnumMap<>(ProviderType.class);

    public StorageBackendFactory() {
        builders.put(ProviderType.OBJECT_STORE, S3StorageBackend::new);
        builders.put(ProviderType.BLOB_STORE, AzureBlobStorageBackend::new);
        builders.put(ProviderType.CLOUD_BUCKET, GcsStorageBackend::new);
        builders.put(ProviderType.FILE_TRANSFER, SftpStorageBackend::new);
    }

    /**
     * Builds a backend for one operation. The caller owns the returned instance
     * and must close it; the decrypted credentials are not retained elsewhere.
     */
    public StorageBackend create(ProviderType type, Map<String, Object> config, Map<String, Object> credentials) {
        BiFunction<Map<String, Object>, Map<String, Object>, StorageBackend> builder = builders.get(type);
        if (builder == null) {
            throw new IllegalStateException("No storage backend registered for " + type);
        }
        return builder.apply(config, credentials);
    }
}
