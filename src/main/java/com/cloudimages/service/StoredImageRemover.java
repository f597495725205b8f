package com.cloudimages.service;

import com.cloudimages.entity.ImageEntity;
import com.cloudimages.exception.InternalException;
import com.cloudimages.repository.ImageRepository;
import com.cloudimages.storage.DeleteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Removes an image completely: remote blob first, then the record.
 *
 * If the remote delete fails the record is kept and the
 * {@link com.cloudimages.exception.ProviderConnectionException} propagates.
 * If the record cannot be removed after the blob is gone, the stale record is
 * logged as an anomaly.
 */
@Component
public class StoredImageRemover {

    private static final Logger log = LoggerFactory.getLogger(StoredImageRemover.class);

    private final StorageBackendGateway backendGateway;
    private final ImageRepository imageRepository;

    public StoredImageRemover(StorageBackendGateway backendGateway, ImageRepository imageRepository) {
        this.backendGateway = backendGateway;
        this.imageRepository = imageRepository;
    }

    public void remove(ImageEntity image) {
        String path = image.getStoragePath();
        Long providerId = image.getStorageProvider().getId();

        DeleteOutcome outcome = backendGateway.execute(image.getStorageProvider(), "delete",
                backend -> backend.delete(path));
        if (outcome == DeleteOutcome.NOT_FOUND) {
            log.warn("Blob {} was already absent on provider {} while deleting image {}", path, providerId, image.getId());
        }

        try {
            imageRepository.deleteById(image.getId());
        } catch (DataAccessException e) {
            log.error("Stale record anomaly: image {} still references removed blob {} on provider {}",
                    image.getId(), path, providerId, e);
            throw new InternalException("Image " + image.getId() + " could not be removed after its blob was deleted", e);
        }
        log.info("Deleted image {} ({}) from provider {}", image.getId(), path, providerId);
    }
}
