package com.cloudimages.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Base64-encoded AES key (16, 24 or 32 bytes) used to encrypt provider credentials */
    private String encryptionKey;

    /** Maximum accepted upload size in bytes (50 MB) */
    private long maxUploadBytes = 50L * 1024 * 1024;

    /** Comma-separated list of accepted image content types */
    private String allowedContentTypes = "image/jpeg,image/jpg,image/png,image/gif,image/webp";

    /** Upper bound for a single remote storage call in milliseconds */
    private long backendTimeoutMs = 30_000;

    /** What happens to referencing images when a provider is deleted */
    private ProviderDeletePolicy providerDeletePolicy = ProviderDeletePolicy.BLOCK;

    private final Optimization optimization = new Optimization();

    // ───────────── getters / setters ─────────────

    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public void setMaxUploadBytes(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    public String getAllowedContentTypes() {
        return allowedContentTypes;
    }

    public void setAllowedContentTypes(String allowedContentTypes) {
        this.allowedContentTypes = allowedContentTypes;
    }

    /** Returns the accepted content types, lower-cased */
    public List<String> getAllowedContentTypeList() {
        return Arrays.stream(allowedContentTypes.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isBlank())
                .toList();
    }

    public long getBackendTimeoutMs() {
        return backendTimeoutMs;
    }

    public void setBackendTimeoutMs(long backendTimeoutMs) {
        this.backendTimeoutMs = backendTimeoutMs;
    }

    public ProviderDeletePolicy getProviderDeletePolicy() {
        return providerDeletePolicy;
    }

    public void setProviderDeletePolicy(ProviderDeletePolicy providerDeletePolicy) {
        this.providerDeletePolicy = providerDeletePolicy;
    }

    public Optimization getOptimization() {
        return optimization;
    }

    /**
     * Settings for the image optimization pipeline.
     */
    public static class Optimization {

        /** Longest allowed side in pixels; larger images are scaled down */
        private int maxDimension = 2048;

        /** Quality factor for lossy re-encoding, 0.0 - 1.0 */
        private float quality = 0.85f;

        public int getMaxDimension() {
            return maxDimension;
        }

        public void setMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
        }

        public float getQuality() {
            return quality;
        }

        public void setQuality(float quality) {
            this.quality = quality;
        }
    }

    /**
     * Policy applied when a storage provider that still has images is deleted.
     */
    public enum ProviderDeletePolicy {
        /** Refuse the delete while any image references the provider */
        BLOCK,
        /** Delete every referencing image (remote blob, then record) first */
        CASCADE
    }
}
