package com.cloudimages.storage;

import com.cloudimages.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Cloud-bucket backend on Google Cloud Storage.
 *
 * Config: {@code bucket}.
 * Credentials: {@code credentials_json}, a service account key either as a
 * JSON string or as a nested object.
 */
public class GcsStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(GcsStorageBackend.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Storage storage;
    private final String bucket;

    public GcsStorageBackend(Map<String, Object> config, Map<String, Object> credentials) {
        this.bucket = BackendParams.required(config, "bucket", "config");
        ServiceAccountCredentials serviceAccount = parseServiceAccount(credentials);
        this.storage = StorageOptions.newBuilder()
                .setCredentials(serviceAccount)
                .setProjectId(serviceAccount.getProjectId())
                .build()
                .getService();
    }

    GcsStorageBackend(Storage storage, String bucket) {
        this.storage = storage;
        this.bucket = bucket;
    }

    @Override
    public String upload(byte[] data, String path, String contentType) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, path))
                .setContentType(contentType)
                .build();
        storage.create(info, data);
        return path;
    }

    @Override
    public byte[] download(String path) {
        return storage.readAllBytes(BlobId.of(bucket, path));
    }

    @Override
    public DeleteOutcome delete(String path) {
        return storage.delete(BlobId.of(bucket, path)) ? DeleteOutcome.DELETED : DeleteOutcome.NOT_FOUND;
    }

    @Override
    public boolean exists(String path) {
        return storage.get(BlobId.of(bucket, path)) != null;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            Bucket found = storage.get(bucket);
            if (found == null) {
                return ConnectionTestResult.error("Connection failed: bucket '" + bucket + "' does not exist");
            }
            return ConnectionTestResult.success("Connection successful");
        } catch (Exception e) {
            return ConnectionTestResult.error("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public String publicUrl(String path) {
        return "https://storage.googleapis.com/" + bucket + "/" + path;
    }

    @Override
    public void close() {
        try {
            storage.close();
        } catch (Exception e) {
            log.debug("Failed to close GCS client: {}", e.getMessage());
        }
    }

    private static ServiceAccountCredentials parseServiceAccount(Map<String, Object> credentials) {
        Object raw = credentials != null ? credentials.get("credentials_json") : null;
        if (raw == null) {
            throw new ValidationException("Missing required credentials value: credentials_json");
        }
        try {
            String json = raw instanceof String ? (String) raw : MAPPER.writeValueAsString(raw);
            return ServiceAccountCredentials.fromStream(
                    new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            // Parser messages may echo key material, so only the type is reported.
            throw new ValidationException("credentials_json is not a valid service account key");
        }
    }
}
