package com.cloudimages.entity;

import java.util.List;
import java.util.Locale;

/**
 * Supported remote storage systems. The set is closed: every value has exactly
 * one backend implementation.
 */
public enum ProviderType {

    OBJECT_STORE("s3", "AWS S3",
            List.of("access_key_id", "secret_access_key"),
            List.of("bucket", "region")),

    BLOB_STORE("azure", "Azure Blob Storage",
            List.of("account_name", "account_key"),
            List.of("container")),

    CLOUD_BUCKET("gcs", "Google Cloud Storage",
            List.of("credentials_json"),
            List.of("bucket")),

    FILE_TRANSFER("sftp", "SFTP",
            List.of("host", "username"),
            List.of("remote_path"));

    private final String code;
    private final String displayName;
    private final List<String> requiredCredentials;
    private final List<String> requiredConfig;

    ProviderType(String code, String displayName, List<String> requiredCredentials, List<String> requiredConfig) {
        this.code = code;
        this.displayName = displayName;
        this.requiredCredentials = requiredCredentials;
        this.requiredConfig = requiredConfig;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getRequiredCredentials() {
        return requiredCredentials;
    }

    public List<String> getRequiredConfig() {
        return requiredConfig;
    }

    /**
     * Resolves a type from its enum name ("OBJECT_STORE", "object-store") or its
     * short code ("s3").
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static ProviderType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ProviderType type : values()) {
            if (type.name().equals(normalized) || type.code.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported provider type: " + value);
    }
}
