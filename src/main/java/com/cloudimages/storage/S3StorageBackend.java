package com.cloudimages.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URI;
import java.util.Map;

/**
 * Object-store backend on AWS S3 (or an S3-compatible endpoint such as MinIO
 * when {@code endpoint} is set in the config).
 *
 * Config: {@code bucket}, {@code region}, optional {@code endpoint}.
 * Credentials: {@code access_key_id}, {@code secret_access_key}.
 */
public class S3StorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(S3StorageBackend.class);

    private final S3Client client;
    private final String bucket;
    private final String region;
    private final String endpoint;

    public S3StorageBackend(Map<String, Object> config, Map<String, Object> credentials) {
        this.bucket = BackendParams.required(config, "bucket", "config");
        this.region = BackendParams.required(config, "region", "config");
        this.endpoint = BackendParams.optional(config, "endpoint", null);

        AwsBasicCredentials awsCredentials = AwsBasicCredentials.create(
                BackendParams.required(credentials, "access_key_id", "credentials"),
                BackendParams.required(credentials, "secret_access_key", "credentials"));

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(StaticCredentialsProvider.create(awsCredentials))
                .region(Region.of(region));
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        this.client = builder.build();
    }

    S3StorageBackend(S3Client client, String bucket, String region) {
        this.client = client;
        this.bucket = bucket;
        this.region = region;
        this.endpoint = null;
    }

    @Override
    public String upload(byte[] data, String path, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(path)
                .contentType(contentType)
                .contentLength((long) data.length)
                .build();
        client.putObject(request, RequestBody.fromBytes(data));
        log.debug("Uploaded {} bytes to s3://{}/{}", data.length, bucket, path);
        return path;
    }

    @Override
    public byte[] download(String path) {
        return client.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(path).build())
                .asByteArray();
    }

    @Override
    public DeleteOutcome delete(String path) {
        // S3 deletes succeed for missing keys, so probe first to report the outcome.
        if (!exists(path)) {
            return DeleteOutcome.NOT_FOUND;
        }
        client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(path).build());
        return DeleteOutcome.DELETED;
    }

    @Override
    public boolean exists(String path) {
        try {
            client.headObject(HeadObjectRequest.builder().bucket(bucket).key(path).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return ConnectionTestResult.success("Connection successful");
        } catch (Exception e) {
            return ConnectionTestResult.error("Connection failed: " + e.getMessage());
        }
    }

    @Override
    public String publicUrl(String path) {
        if (endpoint != null) {
            return endpoint.replaceAll("/+$", "") + "/" + bucket + "/" + path;
        }
        return "https://" + bucket + ".s3." + region + ".amazonaws.com/" + path;
    }

    @Override
    public void close() {
        client.close();
    }
}
