package com.cloudimages.dto;

import com.cloudimages.entity.StorageProviderEntity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Client view of a storage provider. Credentials are never included, only
 * whether some are stored.
 */
public class ProviderResponse {

    private Long id;
    private String name;
    private String providerType;
    private String providerCode;
    private String providerTypeDisplay;
    private Map<String, Object> config;
    private boolean hasCredentials;
    private boolean isDefault;
    private boolean isActive;
    private String createdAt;
    private String updatedAt;

    public ProviderResponse() {
    }

    public static ProviderResponse from(StorageProviderEntity entity) {
        ProviderResponse r = new ProviderResponse();
        r.id = entity.getId();
        r.name = entity.getName();
        r.providerType = entity.getProviderType().name();
        r.providerCode = entity.getProviderType().getCode();
        r.providerTypeDisplay = entity.getProviderType().getDisplayName();
        r.config = entity.getConfig();
        r.hasCredentials = entity.hasCredentials();
        r.isDefault = entity.isDefault();
        r.isActive = entity.isActive();
        r.createdAt = entity.getCreatedAt() != null ? entity.getCreatedAt().toString() : null;
        r.updatedAt = entity.getUpdatedAt() != null ? entity.getUpdatedAt().toString() : null;
        return r;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getProviderType() {
        return providerType;
    }

    public String getProviderCode() {
        return providerCode;
    }

    public String getProviderTypeDisplay() {
        return providerTypeDisplay;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    @JsonProperty("hasCredentials")
    public boolean hasCredentials() {
        return hasCredentials;
    }

    @JsonProperty("isDefault")
    public boolean isDefault() {
        return isDefault;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return isActive;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }
}
