package com.cloudimages.service;

import com.cloudimages.config.AppConfig;
import com.cloudimages.dto.ImageStats;
import com.cloudimages.dto.ImageUpdateRequest;
import com.cloudimages.dto.UploadCommand;
import com.cloudimages.entity.ImageEntity;
import com.cloudimages.entity.StorageProviderEntity;
import com.cloudimages.exception.InternalException;
import com.cloudimages.exception.NotFoundException;
import com.cloudimages.exception.ProviderConnectionException;
import com.cloudimages.exception.ValidationException;
import com.cloudimages.repository.ImageRepository;
import com.cloudimages.storage.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Upload flow and image management.
 *
 * An upload goes: validate, resolve provider, optimize, store remotely,
 * persist the record. The remote write happens before the record exists and
 * outside any database transaction; if the record then cannot be saved the
 * blob is deleted again (compensating action). An upload that times out but
 * still lands later is deleted as soon as it completes. A blob that survives
 * either compensation is logged as an orphan.
 */
@Service
public class ImageUploadService {

    private static final Logger log = LoggerFactory.getLogger(ImageUploadService.class);
    private static final int MAX_TAG_LENGTH = 50;
    private static final int MAX_FILENAME_LENGTH = 255;

    private final AppConfig appConfig;
    private final StorageProviderService providerService;
    private final ImageOptimizationService optimizationService;
    private final StorageBackendGateway backendGateway;
    private final StoredImageRemover imageRemover;
    private final ImageRepository imageRepository;
    private final TransactionTemplate transactionTemplate;

    public ImageUploadService(AppConfig appConfig,
            StorageProviderService providerService,
            ImageOptimizationService optimizationService,
            StorageBackendGateway backendGateway,
            StoredImageRemover imageRemover,
            ImageRepository imageRepository,
            PlatformTransactionManager transactionManager) {
        this.appConfig = appConfig;
        this.providerService = providerService;
        this.optimizationService = optimizationService;
        this.backendGateway = backendGateway;
        this.imageRemover = imageRemover;
        this.imageRepository = imageRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores one uploaded image on the resolved provider and records it.
     *
     * @throws ValidationException          for empty, oversized or disallowed input
     * @throws NotFoundException            if no usable provider exists
     * @throws ProviderConnectionException  if the remote write fails or times out
     * @throws InternalException            if the record could not be saved
     */
    public ImageEntity upload(String userId, UploadCommand command) {
        // ── 1. Validate ─────────────────────────────────────────────────
        validate(command);
        List<String> tags = validateTags(command.getTags());
        String filename = cleanFilename(command.getFilename());

        // ── 2. Resolve provider ─────────────────────────────────────────
        StorageProviderEntity provider = providerService.resolveForUpload(userId, command.getProviderId());

        // ── 3. Optimize ─────────────────────────────────────────────────
        byte[] original = command.getData();
        OptimizationResult result = optimizationService.process(original, command.isOptimize());

        // ── 4. Store remotely ───────────────────────────────────────────
        String pathSource = result.isOptimized() ? "image." + result.getExtension() : filename;
        String generatedPath = StoragePaths.generate(userId, pathSource);
        String contentType = result.isOptimized() ? result.getContentType() : normalizeContentType(command.getContentType());
        String storagePath = backendGateway.execute(provider, "upload",
                backend -> backend.upload(result.getData(), generatedPath, contentType),
                latePath -> removeLateUpload(provider, latePath));

        // ── 5. Persist ──────────────────────────────────────────────────
        ImageEntity image = new ImageEntity();
        image.setUserId(userId);
        image.setStorageProvider(provider);
        image.setOriginalFilename(filename);
        image.setFileSize(original.length);
        image.setContentType(contentType);
        image.setStoragePath(storagePath);
        image.setWidth(result.getWidth());
        image.setHeight(result.getHeight());
        image.setTags(tags);
        image.setMetadata(result.getMetadata());
        if (result.isOptimized()) {
            image.setOptimized(true);
            image.setOptimizedSize(result.getSize());
            image.setOptimizationPercentage(savingsPercent(original.length, result.getSize()));
        }

        ImageEntity saved;
        try {
            saved = transactionTemplate.execute(status -> imageRepository.save(image));
        } catch (RuntimeException e) {
            compensate(provider, storagePath, e);
            throw new InternalException("Image record could not be saved; the upload was rolled back", e);
        }

        log.info("Uploaded image {} for user {} to provider {} at {} ({} -> {} bytes)",
                saved.getId(), userId, provider.getId(), storagePath, original.length, result.getSize());
        return saved;
    }

    /**
     * Lists the user's images, newest first.
     */
    @Transactional(readOnly = true)
    public List<ImageEntity> list(String userId) {
        requireUser(userId);
        return imageRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    @Transactional(readOnly = true)
    public ImageEntity get(Long imageId, String userId) {
        requireUser(userId);
        return imageRepository.findByIdAndUserId(imageId, userId)
                .orElseThrow(() -> NotFoundException.image(imageId));
    }

    /**
     * Provider URL of the stored blob, or null if the provider cannot be
     * used right now.
     */
    public String publicUrl(ImageEntity image) {
        try {
            return backendGateway.execute(image.getStorageProvider(), "public url",
                    backend -> backend.publicUrl(image.getStoragePath()));
        } catch (ProviderConnectionException e) {
            log.debug("No public url for image {}: {}", image.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * Updates tags and/or metadata. Everything else is immutable.
     */
    @Transactional
    public ImageEntity update(Long imageId, String userId, ImageUpdateRequest request) {
        ImageEntity image = get(imageId, userId);
        if (request.getTags() != null) {
            image.setTags(validateTags(request.getTags()));
        }
        if (request.getMetadata() != null) {
            image.setMetadata(request.getMetadata());
        }
        return imageRepository.save(image);
    }

    /**
     * Deletes the remote blob, then the record.
     */
    public void delete(Long imageId, String userId) {
        imageRemover.remove(get(imageId, userId));
    }

    /**
     * Reads the stored bytes back from the provider.
     */
    public byte[] download(ImageEntity image) {
        return backendGateway.execute(image.getStorageProvider(), "download",
                backend -> backend.download(image.getStoragePath()));
    }

    @Transactional(readOnly = true)
    public ImageStats stats(String userId) {
        requireUser(userId);
        return new ImageStats(
                imageRepository.countByUserId(userId),
                imageRepository.sumFileSizeByUserId(userId),
                imageRepository.countByUserIdAndIsOptimizedTrue(userId),
                imageRepository.sumSavedBytesByUserId(userId));
    }

    // ───────────── helpers ─────────────

    private void compensate(StorageProviderEntity provider, String storagePath, RuntimeException cause) {
        try {
            backendGateway.execute(provider, "compensating delete", backend -> backend.delete(storagePath));
            log.warn("Removed blob {} from provider {} after the image record failed to save: {}",
                    storagePath, provider.getId(), cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Orphaned blob anomaly: {} on provider {} could not be removed after the image record "
                    + "failed to save", storagePath, provider.getId(), e);
            cause.addSuppressed(e);
        }
    }

    /**
     * Deletes a blob whose upload finished after the request had already
     * failed with a timeout. No record points at it.
     */
    void removeLateUpload(StorageProviderEntity provider, String storagePath) {
        try {
            backendGateway.execute(provider, "late upload cleanup", backend -> backend.delete(storagePath));
            log.warn("Removed blob {} from provider {} after its upload completed past the timeout",
                    storagePath, provider.getId());
        } catch (RuntimeException e) {
            log.error("Orphaned blob anomaly: {} on provider {} was uploaded after the timeout and could not "
                    + "be removed", storagePath, provider.getId(), e);
        }
    }

    private void validate(UploadCommand command) {
        byte[] data = command.getData();
        if (data == null || data.length == 0) {
            throw new ValidationException("Uploaded file is empty");
        }
        if (data.length > appConfig.getMaxUploadBytes()) {
            throw new ValidationException("File too large: " + data.length + " bytes (max "
                    + appConfig.getMaxUploadBytes() + ")");
        }
        String contentType = normalizeContentType(command.getContentType());
        if (contentType == null || !appConfig.getAllowedContentTypeList().contains(contentType)) {
            throw new ValidationException("Unsupported content type: " + command.getContentType()
                    + " (allowed: " + appConfig.getAllowedContentTypes() + ")");
        }
    }

    static List<String> validateTags(List<String> tags) {
        List<String> result = new ArrayList<>();
        if (tags == null) {
            return result;
        }
        for (String tag : tags) {
            if (tag == null) {
                throw new ValidationException("Tags must not be null");
            }
            if (tag.length() > MAX_TAG_LENGTH) {
                throw new ValidationException("Tag exceeds " + MAX_TAG_LENGTH + " characters: " + tag);
            }
            result.add(tag);
        }
        return result;
    }

    private static String cleanFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "image";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty()) {
            return "image";
        }
        return name.length() > MAX_FILENAME_LENGTH ? name.substring(name.length() - MAX_FILENAME_LENGTH) : name;
    }

    private static String normalizeContentType(String contentType) {
        if (contentType == null) {
            return null;
        }
        // drop parameters such as "; charset=..."
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Percentage of bytes saved; negative when the output grew.
     */
    static double savingsPercent(long originalSize, long optimizedSize) {
        return (originalSize - optimizedSize) * 100.0 / originalSize;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
    }
}
