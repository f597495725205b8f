package com.cloudimages.storage;

import com.azure.core.util.BinaryData;
import com.azure.core.util.Context;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.options.BlobParallelUploadOptions;
import com.azure.storage.common.StorageSharedKeyCredential;

import java.util.Map;

/**
 * Blob-store backend on Azure Blob Storage.
 *
 * Config: {@code container}, optional {@code endpoint}.
 * Credentials: {@code account_name}, {@code account_key}.
 */
public class AzureBlobStorageBackend implements StorageBackend {

    private final BlobContainerClient containerClient;

    public AzureBlobStorageBackend(Map<String, Object> config, Map<String, Object> credentials) {
        String container = BackendParams.required(config, "container", "config");
        String accountName = BackendParams.required(credentials, "account_name", "credentials");
        String accountKey = BackendParams.required(credentials, "account_key", "credentials");
        String endpoint = BackendParams.optional(config, "endpoint",
                "https://" + accountName + ".blob.core.windows.net");

        this.containerClient = new BlobServiceClientBuilder()
                .endpoint(endpoint)
                .credential(new StorageSharedKeyCredential(accountName, accountKey))
                .buildClient()
                .getBlobContainerClient(container);
    }

    AzureBlobStorageBackend(BlobContainerClient containerClient) {
        this.containerClient = containerClient;
    }

    @Override
    public String upload(byte[] data, String path, String contentType) {
        BlobParallelUploadOptions options = new BlobParallelUploadOptions(BinaryData.fromBytes(data))
                .setHeaders(new BlobHttpHeaders().setContentType(contentType));
        // No request conditions: an existing blob is overwritten.
        blob(path).uploadWithResponse(options, null, Context.NONE);
        return path;
    }

    @Override
    public byte[] download(String path) {
        return blob(path).downloadContent().toBytes();
    }

    @Override
    public DeleteOutcome delete(String path) {
        return blob(path).deleteIfExists() ? DeleteOutcome.DELETED : DeleteOutcome.NOT_FOUND;
    }

    @Override
    public boolean exists(String path) {
        return blob(path).exists();
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            if (!containerClient.exists()) {
                return ConnectionTestResult.error(
                        "Connection failed: container '" + containerClient.getBlobContainerName() + "' does not exist");
            }
            return ConnectionTestResult.success("Connection successful");
        } catch (Exception e) {
            return ConnectionTestResult.error("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public String publicUrl(String path) {
        return blob(path).getBlobUrl();
    }

    private BlobClient blob(String path) {
        return containerClient.getBlobClient(path);
    }
}
