package com.cloudimages.dto;

import java.util.Map;

/**
 * Body of create and update provider requests. On update every null field is
 * left unchanged; credentials are replaced only when supplied.
 */
public class ProviderRequest {

    private String name;
    private String providerType;
    private Map<String, Object> config;
    private Map<String, Object> credentials;
    private Boolean isDefault;
    private Boolean isActive;

    public ProviderRequest() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** Enum name ("OBJECT_STORE") or short code ("s3") */
    public String getProviderType() {
        return providerType;
    }

    public void setProviderType(String providerType) {
        this.providerType = providerType;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }

    public Map<String, Object> getCredentials() {
        return credentials;
    }

    public void setCredentials(Map<String, Object> credentials) {
        this.credentials = credentials;
    }

    public Boolean getIsDefault() {
        return isDefault;
    }

    public void setIsDefault(Boolean isDefault) {
        this.isDefault = isDefault;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    @Override
    public String toString() {
        // credentials deliberately omitted
        return "ProviderRequest[name=" + name + ", providerType=" + providerType
                + ", isDefault=" + isDefault + ", isActive=" + isActive + "]";
    }
}
