package com.cloudimages.entity;

import com.cloudimages.util.JsonListConverter;
import com.cloudimages.util.JsonMapConverter;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An uploaded image and the remote location it was written to.
 * Created only after the blob has been stored; the storage path, sizes and
 * dimensions never change afterwards.
 */
@Entity
@Table(name = "images", indexes = {
        @Index(name = "idx_image_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_image_provider", columnList = "storage_provider_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_image_provider_path", columnNames = { "storage_provider_id", "storage_path" })
})
public class ImageEntity {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 128, updatable = false)
    private String userId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "storage_provider_id", nullable = false, updatable = false)
    private StorageProviderEntity storageProvider;

    @Column(name = "original_filename", nullable = false, length = 255, updatable = false)
    private String originalFilename;

    @Column(name = "file_size", nullable = false, updatable = false)
    private long fileSize;

    @Column(name = "content_type", nullable = false, length = 100, updatable = false)
    private String contentType;

    @Column(name = "storage_path", nullable = false, length = 512, updatable = false)
    private String storagePath;

    @Column(name = "width", updatable = false)
    private Integer width;

    @Column(name = "height", updatable = false)
    private Integer height;

    @Column(name = "is_optimized", nullable = false, updatable = false)
    private boolean isOptimized = false;

    @Column(name = "optimized_size", updatable = false)
    private Long optimizedSize;

    @Column(name = "optimization_percentage", updatable = false)
    private Double optimizationPercentage;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "tags_json", length = 8192)
    private List<String> tags = new ArrayList<>();

    /** Format, color mode, dimensions and selected EXIF fields */
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata_json", length = 16384)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // ───────────── constructors ─────────────

    public ImageEntity() {
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public double getSizeMb() {
        return Math.round(fileSize / BYTES_PER_MB * 100.0) / 100.0;
    }

    public Double getOptimizedSizeMb() {
        if (optimizedSize == null) {
            return null;
        }
        return Math.round(optimizedSize / BYTES_PER_MB * 100.0) / 100.0;
    }

    // ───────────── getters / setters ─────────────

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public StorageProviderEntity getStorageProvider() {
        return storageProvider;
    }

    public void setStorageProvider(StorageProviderEntity storageProvider) {
        this.storageProvider = storageProvider;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public void setOriginalFilename(String originalFilename) {
        this.originalFilename = originalFilename;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public boolean isOptimized() {
        return isOptimized;
    }

    public void setOptimized(boolean optimized) {
        isOptimized = optimized;
    }

    public Long getOptimizedSize() {
        return optimizedSize;
    }

    public void setOptimizedSize(Long optimizedSize) {
        this.optimizedSize = optimizedSize;
    }

    public Double getOptimizationPercentage() {
        return optimizationPercentage;
    }

    public void setOptimizationPercentage(Double optimizationPercentage) {
        this.optimizationPercentage = optimizationPercentage;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
