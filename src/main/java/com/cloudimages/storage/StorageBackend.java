package com.cloudimages.storage;

/**
 * Uniform operations against one remote storage system.
 *
 * Instances are built per operation from a provider's config and freshly
 * decrypted credentials, and closed when the operation ends. All paths are
 * relative to the provider's own namespace (bucket, container or remote
 * directory).
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Writes a blob. An existing blob at the same path is overwritten.
     *
     * @return the canonical backend-relative path
     * @throws Exception on any transport or authorization failure
     */
    String upload(byte[] data, String path, String contentType) throws Exception;

    /**
     * Reads a blob fully into memory.
     */
    byte[] download(String path) throws Exception;

    /**
     * Removes a blob. A blob that is already absent is reported as
     * {@link DeleteOutcome#NOT_FOUND}, not as an error.
     */
    DeleteOutcome delete(String path) throws Exception;

    boolean exists(String path) throws Exception;

    /**
     * Performs a cheap read-only round trip to verify reachability and
     * credentials. Never throws; failures are reported in the result.
     */
    ConnectionTestResult testConnection();

    /**
     * Public (or protocol) URL for a stored blob. Whether it is reachable
     * without credentials depends on the provider's own access settings.
     */
    String publicUrl(String path);

    @Override
    default void close() {
    }
}
