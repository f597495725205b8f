package com.cloudimages.service;

import com.cloudimages.config.AppConfig;
import com.cloudimages.dto.ProviderRequest;
import com.cloudimages.entity.ImageEntity;
import com.cloudimages.entity.ProviderType;
import com.cloudimages.entity.StorageProviderEntity;
import com.cloudimages.exception.ConflictException;
import com.cloudimages.exception.NotFoundException;
import com.cloudimages.exception.ProviderConnectionException;
import com.cloudimages.exception.ValidationException;
import com.cloudimages.repository.ImageRepository;
import com.cloudimages.repository.StorageProviderRepository;
import com.cloudimages.storage.ConnectionTestResult;
import com.cloudimages.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Manages a user's storage providers: CRUD, the single default provider,
 * connection tests and provider selection for uploads.
 *
 * Every lookup is scoped to the calling user; another user's provider id is
 * reported as not found.
 */
@Service
@Transactional
public class StorageProviderService {

    private static final Logger log = LoggerFactory.getLogger(StorageProviderService.class);
    private static final int MAX_NAME_LENGTH = 255;

    private final StorageProviderRepository providerRepository;
    private final ImageRepository imageRepository;
    private final CredentialVault credentialVault;
    private final StorageBackendGateway backendGateway;
    private final StoredImageRemover imageRemover;
    private final DefaultProviderLock defaultLock;
    private final AppConfig appConfig;

    public StorageProviderService(StorageProviderRepository providerRepository,
            ImageRepository imageRepository,
            CredentialVault credentialVault,
            StorageBackendGateway backendGateway,
            StoredImageRemover imageRemover,
            DefaultProviderLock defaultLock,
            AppConfig appConfig) {
        this.providerRepository = providerRepository;
        this.imageRepository = imageRepository;
        this.credentialVault = credentialVault;
        this.backendGateway = backendGateway;
        this.imageRemover = imageRemover;
        this.defaultLock = defaultLock;
        this.appConfig = appConfig;
    }

    /**
     * Registers a new provider. Credentials are encrypted before they touch
     * the entity.
     */
    public StorageProviderEntity create(String userId, ProviderRequest request) {
        requireUser(userId);
        String name = validateName(request.getName());
        ProviderType type = parseType(request.getProviderType());
        Map<String, Object> config = request.getConfig() != null ? request.getConfig() : Map.of();
        validateConfig(type, config);

        StorageProviderEntity provider = new StorageProviderEntity(userId, name, type);
        provider.setConfig(config);
        if (request.getCredentials() != null && !request.getCredentials().isEmpty()) {
            validateCredentials(type, request.getCredentials());
            provider.setEncryptedCredentials(credentialVault.encrypt(request.getCredentials()));
        }
        if (request.getIsActive() != null) {
            provider.setActive(request.getIsActive());
        }

        if (Boolean.TRUE.equals(request.getIsDefault())) {
            requireActiveForDefault(provider);
            clearDefaults(userId, null);
            provider.setDefault(true);
        }

        StorageProviderEntity saved = providerRepository.save(provider);
        log.info("Created {} storage provider {} '{}' for user {}{}", type.getCode(), saved.getId(), name, userId,
                saved.isDefault() ? " (default)" : "");
        return saved;
    }

    /**
     * Partial update. Null fields are left untouched; credentials are replaced
     * only when supplied.
     */
    public StorageProviderEntity update(Long providerId, String userId, ProviderRequest request) {
        StorageProviderEntity provider = findOwned(providerId, userId);

        if (request.getName() != null) {
            provider.setName(validateName(request.getName()));
        }
        if (request.getProviderType() != null) {
            provider.setProviderType(parseType(request.getProviderType()));
        }
        if (request.getConfig() != null) {
            provider.setConfig(request.getConfig());
        }
        validateConfig(provider.getProviderType(), provider.getConfig());

        if (request.getCredentials() != null && !request.getCredentials().isEmpty()) {
            validateCredentials(provider.getProviderType(), request.getCredentials());
            provider.setEncryptedCredentials(credentialVault.encrypt(request.getCredentials()));
            log.info("Replaced credentials of storage provider {}", providerId);
        }

        if (request.getIsActive() != null) {
            provider.setActive(request.getIsActive());
            if (!provider.isActive() && provider.isDefault()) {
                provider.setDefault(false);
                log.info("Storage provider {} deactivated; it is no longer the default", providerId);
            }
        }

        if (Boolean.TRUE.equals(request.getIsDefault()) && !provider.isDefault()) {
            requireActiveForDefault(provider);
            clearDefaults(userId, providerId);
            provider.setDefault(true);
        } else if (Boolean.FALSE.equals(request.getIsDefault())) {
            provider.setDefault(false);
        }

        return providerRepository.save(provider);
    }

    /**
     * Makes one provider the user's default.
     *
     * The user's default lock and all of the user's provider rows are held
     * for the duration of the transaction, so concurrent default changes run
     * one after the other and exactly one default is visible after each
     * commit.
     */
    public StorageProviderEntity setDefault(Long providerId, String userId) {
        requireUser(userId);
        defaultLock.acquire(userId);
        List<StorageProviderEntity> locked = providerRepository.lockAllByUserId(userId);
        StorageProviderEntity target = locked.stream()
                .filter(p -> p.getId().equals(providerId))
                .findFirst()
                .orElseThrow(() -> NotFoundException.provider(providerId));
        requireActiveForDefault(target);

        for (StorageProviderEntity p : locked) {
            p.setDefault(p == target);
        }
        log.info("Storage provider {} is now the default for user {}", providerId, userId);
        return target;
    }

    @Transactional(readOnly = true)
    public StorageProviderEntity get(Long providerId, String userId) {
        return findOwned(providerId, userId);
    }

    /**
     * Lists the user's providers, default first, then newest first.
     */
    @Transactional(readOnly = true)
    public List<StorageProviderEntity> list(String userId) {
        requireUser(userId);
        return providerRepository.findByUserIdOrderByIsDefaultDescCreatedAtDescIdDesc(userId);
    }

    /**
     * Picks the upload target: the explicitly requested provider if it is
     * owned and active, otherwise the user's active default.
     *
     * @throws NotFoundException if no usable provider exists
     */
    @Transactional(readOnly = true)
    public StorageProviderEntity resolveForUpload(String userId, Long providerId) {
        requireUser(userId);
        if (providerId != null) {
            return providerRepository.findByIdAndUserIdAndIsActiveTrue(providerId, userId)
                    .orElseThrow(() -> new NotFoundException("Storage provider not found or inactive: " + providerId));
        }
        return providerRepository.findFirstByUserIdAndIsDefaultTrueAndIsActiveTrue(userId)
                .orElseThrow(() -> new NotFoundException(
                        "No active default storage provider configured; create one or pass a provider id"));
    }

    /**
     * Checks reachability and credentials with a read-only call. Nothing is
     * written, whatever the outcome.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public ConnectionTestResult testConnection(Long providerId, String userId) {
        StorageProviderEntity provider = findOwned(providerId, userId);
        if (!provider.hasCredentials()) {
            return ConnectionTestResult.error("No credentials configured");
        }

        ConnectionTestResult result;
        try {
            result = backendGateway.execute(provider, "connection test", StorageBackend::testConnection);
        } catch (ProviderConnectionException e) {
            result = ConnectionTestResult.error(e.getMessage());
        }

        if (result.isSuccess()) {
            log.info("Connection test for storage provider {} succeeded", providerId);
        } else {
            log.warn("Connection test for storage provider {} failed: {}", providerId, result.getMessage());
        }
        return result;
    }

    /**
     * Deletes a provider according to {@code app.provider-delete-policy}.
     * Runs outside a transaction so that cascaded remote deletes never hold
     * database locks.
     *
     * @throws ConflictException under BLOCK when images still reference it
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void delete(Long providerId, String userId) {
        StorageProviderEntity provider = findOwned(providerId, userId);

        long imageCount = imageRepository.countByStorageProviderId(providerId);
        if (imageCount > 0) {
            if (appConfig.getProviderDeletePolicy() == AppConfig.ProviderDeletePolicy.BLOCK) {
                throw new ConflictException("Storage provider " + providerId + " is still used by " + imageCount
                        + " image(s); delete them first");
            }
            List<ImageEntity> images = imageRepository.findByStorageProviderId(providerId);
            log.info("Cascading delete of storage provider {} to {} image(s)", providerId, images.size());
            for (ImageEntity image : images) {
                imageRemover.remove(image);
            }
        }

        try {
            providerRepository.deleteById(provider.getId());
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Storage provider " + providerId + " gained new images during deletion");
        }
        log.info("Deleted storage provider {} of user {}", providerId, userId);
    }

    // ───────────── helpers ─────────────

    private StorageProviderEntity findOwned(Long providerId, String userId) {
        requireUser(userId);
        if (providerId == null) {
            throw new ValidationException("Provider id is required");
        }
        return providerRepository.findByIdAndUserId(providerId, userId)
                .orElseThrow(() -> NotFoundException.provider(providerId));
    }

    /**
     * Clears the default flag on all of the user's providers except
     * {@code keepId}, holding the user's default lock and row locks until
     * commit.
     */
    private void clearDefaults(String userId, Long keepId) {
        defaultLock.acquire(userId);
        for (StorageProviderEntity p : providerRepository.lockAllByUserId(userId)) {
            if (p.isDefault() && !p.getId().equals(keepId)) {
                p.setDefault(false);
            }
        }
    }

    private static void requireActiveForDefault(StorageProviderEntity provider) {
        if (!provider.isActive()) {
            throw new ValidationException("An inactive storage provider cannot be the default");
        }
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
    }

    private static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Provider name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Provider name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static ProviderType parseType(String value) {
        try {
            return ProviderType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    static void validateConfig(ProviderType type, Map<String, Object> config) {
        for (String key : type.getRequiredConfig()) {
            if (isBlank(config.get(key))) {
                throw new ValidationException(type.getDisplayName() + " requires config value '" + key + "'");
            }
        }
    }

    static void validateCredentials(ProviderType type, Map<String, Object> credentials) {
        for (String key : type.getRequiredCredentials()) {
            if (isBlank(credentials.get(key))) {
                throw new ValidationException(type.getDisplayName() + " requires credential '" + key + "'");
            }
        }
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }
}
