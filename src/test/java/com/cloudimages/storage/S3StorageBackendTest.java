package com.cloudimages.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3StorageBackend Tests")
class S3StorageBackendTest {

    @Mock
    private S3Client client;

    private S3StorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new S3StorageBackend(client, "photos", "eu-west-1");
    }

    @Test
    @DisplayName("Should put the object with content type and length")
    void shouldUpload() {
        byte[] data = { 1, 2, 3 };

        String path = backend.upload(data, "user_1/a.jpg", "image/jpeg");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(client).putObject(captor.capture(), any(RequestBody.class));
        assertThat(path).isEqualTo("user_1/a.jpg");
        assertThat(captor.getValue().bucket()).isEqualTo("photos");
        assertThat(captor.getValue().key()).isEqualTo("user_1/a.jpg");
        assertThat(captor.getValue().contentType()).isEqualTo("image/jpeg");
        assertThat(captor.getValue().contentLength()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should report a missing key as NOT_FOUND without deleting")
    void shouldReportMissingKey() {
        when(client.headObject(any(HeadObjectRequest.class))).thenThrow(NoSuchKeyException.builder().build());

        assertThat(backend.delete("gone.jpg")).isEqualTo(DeleteOutcome.NOT_FOUND);
        verify(client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    @DisplayName("Should delete an existing key")
    void shouldDeleteExistingKey() {
        when(client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder().build());

        assertThat(backend.delete("a.jpg")).isEqualTo(DeleteOutcome.DELETED);
        verify(client).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    @DisplayName("Connection test should report a missing bucket as an error")
    void shouldReportMissingBucket() {
        when(client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(NoSuchBucketException.builder().message("bucket does not exist").build());

        ConnectionTestResult result = backend.testConnection();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("bucket does not exist");
    }

    @Test
    @DisplayName("Should build the virtual-hosted URL")
    void shouldBuildPublicUrl() {
        assertThat(backend.publicUrl("user_1/a.jpg"))
                .isEqualTo("https://photos.s3.eu-west-1.amazonaws.com/user_1/a.jpg");
    }
}
