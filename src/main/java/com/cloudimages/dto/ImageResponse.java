package com.cloudimages.dto;

import com.cloudimages.entity.ImageEntity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Client view of an uploaded image.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageResponse {

    private Long id;
    private String originalFilename;
    private long fileSize;
    private double sizeMb;
    private String contentType;
    private String storagePath;
    private Long storageProviderId;
    private String storageProviderName;
    private Integer width;
    private Integer height;
    private boolean isOptimized;
    private Long optimizedSize;
    private Double optimizedSizeMb;
    private Double optimizationPercentage;
    private List<String> tags;
    private Map<String, Object> metadata;
    private String url;
    private String createdAt;
    private String updatedAt;

    public ImageResponse() {
    }

    public static ImageResponse from(ImageEntity entity) {
        ImageResponse r = new ImageResponse();
        r.id = entity.getId();
        r.originalFilename = entity.getOriginalFilename();
        r.fileSize = entity.getFileSize();
        r.sizeMb = entity.getSizeMb();
        r.contentType = entity.getContentType();
        r.storagePath = entity.getStoragePath();
        r.storageProviderId = entity.getStorageProvider().getId();
        r.storageProviderName = entity.getStorageProvider().getName();
        r.width = entity.getWidth();
        r.height = entity.getHeight();
        r.isOptimized = entity.isOptimized();
        r.optimizedSize = entity.getOptimizedSize();
        r.optimizedSizeMb = entity.getOptimizedSizeMb();
        r.optimizationPercentage = entity.getOptimizationPercentage() != null
                ? Math.round(entity.getOptimizationPercentage() * 100.0) / 100.0
                : null;
        r.tags = entity.getTags();
        r.metadata = entity.getMetadata();
        r.createdAt = entity.getCreatedAt() != null ? entity.getCreatedAt().toString() : null;
        r.updatedAt = entity.getUpdatedAt() != null ? entity.getUpdatedAt().toString() : null;
        return r;
    }

    public Long getId() {
        return id;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public long getFileSize() {
        return fileSize;
    }

    public double getSizeMb() {
        return sizeMb;
    }

    public String getContentType() {
        return contentType;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public Long getStorageProviderId() {
        return storageProviderId;
    }

    public String getStorageProviderName() {
        return storageProviderName;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    @JsonProperty("isOptimized")
    public boolean isOptimized() {
        return isOptimized;
    }

    public Long getOptimizedSize() {
        return optimizedSize;
    }

    public Double getOptimizedSizeMb() {
        return optimizedSizeMb;
    }

    public Double getOptimizationPercentage() {
        return optimizationPercentage;
    }

    public List<String> getTags() {
        return tags;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** Provider URL of the stored blob; only filled on detail requests */
    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }
}
