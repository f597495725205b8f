package com.cloudimages.service;

import com.cloudimages.dto.ImageStats;
import com.cloudimages.dto.ImageUpdateRequest;
import com.cloudimages.dto.ProviderRequest;
import com.cloudimages.dto.UploadCommand;
import com.cloudimages.entity.ImageEntity;
import com.cloudimages.entity.StorageProviderEntity;
import com.cloudimages.exception.NotFoundException;
import com.cloudimages.exception.ProviderConnectionException;
import com.cloudimages.exception.UnsupportedFormatException;
import com.cloudimages.repository.ImageRepository;
import com.cloudimages.repository.StorageProviderRepository;
import com.cloudimages.storage.InMemoryStorageBackend;
import com.cloudimages.storage.StorageBackendFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
@DisplayName("Image upload end-to-end Tests")
class ImageUploadIntegrationTest {

    private static final String USER = "user-1";

    @Autowired
    private ImageUploadService imageService;

    @Autowired
    private StorageProviderService providerService;

    @Autowired
    private ImageRepository imageRepository;

    @Autowired
    private StorageProviderRepository providerRepository;

    @MockBean
    private StorageBackendFactory backendFactory;

    private final InMemoryStorageBackend storage = new InMemoryStorageBackend();

    private StorageProviderEntity defaultProvider;

    @BeforeEach
    void setUp() {
        when(backendFactory.create(any(), any(), any())).thenReturn(storage);
        defaultProvider = providerService.create(USER, StorageProviderServiceTest.s3Request("Primary", true));
    }

    @AfterEach
    void tearDown() {
        imageRepository.deleteAll();
        providerRepository.deleteAll();
        storage.reset();
    }

    private static byte[] jpeg(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setPaint(new GradientPaint(0, 0, Color.YELLOW, width, height, Color.MAGENTA));
        g.fillRect(0, 0, width, height);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "jpeg", out);
        return out.toByteArray();
    }

    @Nested
    @DisplayName("Upload")
    class UploadTests {

        @Test
        @DisplayName("Should optimize, store and record a large JPEG")
        void shouldOptimizeAndStore() throws IOException {
            byte[] original = jpeg(4000, 3000);
            UploadCommand command = new UploadCommand(original, "big.jpg", "image/jpeg");
            command.setTags(List.of("holiday"));

            ImageEntity image = imageService.upload(USER, command);

            assertThat(image.getId()).isNotNull();
            assertThat(image.isOptimized()).isTrue();
            assertThat(image.getWidth()).isEqualTo(2048);
            assertThat(image.getHeight()).isEqualTo(1536);
            assertThat(image.getFileSize()).isEqualTo(original.length);
            assertThat(image.getOptimizedSize()).isLessThan((long) original.length);
            assertThat(image.getOptimizationPercentage()).isPositive();
            assertThat(image.getStoragePath()).startsWith("user_user-1/").endsWith(".jpg");

            byte[] stored = storage.blobs().get(image.getStoragePath());
            assertThat(stored).hasSize(image.getOptimizedSize().intValue());
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(stored));
            assertThat(decoded.getWidth()).isEqualTo(2048);
            assertThat(storage.contentTypeOf(image.getStoragePath())).isEqualTo("image/jpeg");

            ImageEntity reloaded = imageService.get(image.getId(), USER);
            assertThat(reloaded.getTags()).containsExactly("holiday");
            assertThat(reloaded.getMetadata()).containsEntry("original_width", 4000);
            assertThat(reloaded.getStorageProvider().getId()).isEqualTo(defaultProvider.getId());
        }

        @Test
        @DisplayName("Should keep the original bytes when optimization is declined")
        void shouldStoreOriginal() throws IOException {
            byte[] original = jpeg(120, 80);
            UploadCommand command = new UploadCommand(original, "small.jpg", "image/jpeg");
            command.setOptimize(false);

            ImageEntity image = imageService.upload(USER, command);

            assertThat(image.isOptimized()).isFalse();
            assertThat(image.getOptimizedSize()).isNull();
            assertThat(image.getOptimizationPercentage()).isNull();
            assertThat(storage.blobs().get(image.getStoragePath())).isEqualTo(original);
        }

        @Test
        @DisplayName("An inactive explicit provider should fail with no record and no blob")
        void shouldRejectInactiveProvider() throws IOException {
            ProviderRequest request = StorageProviderServiceTest.s3Request("Disabled", false);
            request.setIsActive(false);
            StorageProviderEntity inactive = providerService.create(USER, request);
            UploadCommand command = new UploadCommand(jpeg(50, 50), "a.jpg", "image/jpeg");
            command.setProviderId(inactive.getId());

            assertThatThrownBy(() -> imageService.upload(USER, command)).isInstanceOf(NotFoundException.class);
            assertThat(imageRepository.count()).isZero();
            assertThat(storage.blobs()).isEmpty();
        }

        @Test
        @DisplayName("A user without a default provider cannot upload")
        void shouldRequireDefault() throws IOException {
            UploadCommand command = new UploadCommand(jpeg(50, 50), "a.jpg", "image/jpeg");

            assertThatThrownBy(() -> imageService.upload("user-without-providers", command))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("A failed remote write should leave no record")
        void shouldNotRecordFailedUpload() throws IOException {
            storage.setFailUploads(true);
            UploadCommand command = new UploadCommand(jpeg(50, 50), "a.jpg", "image/jpeg");

            assertThatThrownBy(() -> imageService.upload(USER, command))
                    .isInstanceOf(ProviderConnectionException.class)
                    .hasMessageContaining("simulated upload failure");
            assertThat(imageRepository.count()).isZero();
        }

        @Test
        @DisplayName("A write that lands after the timeout should be removed again")
        void shouldRemoveLateWrite() throws IOException {
            storage.setUploadStallMillis(3_000);
            UploadCommand command = new UploadCommand(jpeg(50, 50), "late.jpg", "image/jpeg");

            assertThatThrownBy(() -> imageService.upload(USER, command))
                    .isInstanceOf(ProviderConnectionException.class)
                    .hasMessageContaining("did not respond");

            await().atMost(Duration.ofSeconds(10))
                    .pollInterval(Duration.ofMillis(100))
                    .untilAsserted(() -> assertThat(storage.blobs()).isEmpty());
            assertThat(imageRepository.count()).isZero();
        }

        @Test
        @DisplayName("Content that is not an image should be refused before storing")
        void shouldRefuseNonImage() {
            UploadCommand command = new UploadCommand("GIF89a but not really".getBytes(), "x.gif", "image/gif");

            assertThatThrownBy(() -> imageService.upload(USER, command))
                    .isInstanceOf(UnsupportedFormatException.class);
            assertThat(storage.blobs()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Management")
    class ManagementTests {

        @Test
        @DisplayName("Should update only tags and metadata")
        void shouldUpdateTags() throws IOException {
            ImageEntity image = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "a.jpg", "image/jpeg"));
            ImageUpdateRequest update = new ImageUpdateRequest();
            update.setTags(List.of("a", "b"));
            update.setMetadata(Map.of("note", "edited"));

            ImageEntity updated = imageService.update(image.getId(), USER, update);

            assertThat(updated.getTags()).containsExactly("a", "b");
            assertThat(updated.getMetadata()).containsEntry("note", "edited");
            assertThat(updated.getStoragePath()).isEqualTo(image.getStoragePath());
            assertThat(updated.getFileSize()).isEqualTo(image.getFileSize());
        }

        @Test
        @DisplayName("Should download the stored bytes")
        void shouldDownload() throws IOException {
            ImageEntity image = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "a.jpg", "image/jpeg"));

            assertThat(imageService.download(image)).isEqualTo(storage.blobs().get(image.getStoragePath()));
            assertThat(imageService.publicUrl(image)).isEqualTo("memory://" + image.getStoragePath());
        }

        @Test
        @DisplayName("Delete should remove blob and record, even if the blob is already gone")
        void shouldDelete() throws IOException {
            ImageEntity first = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "a.jpg", "image/jpeg"));
            ImageEntity second = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "b.jpg", "image/jpeg"));
            storage.blobs().remove(second.getStoragePath());

            imageService.delete(first.getId(), USER);
            imageService.delete(second.getId(), USER);

            assertThat(imageRepository.count()).isZero();
            assertThat(storage.blobs()).isEmpty();
            assertThatThrownBy(() -> imageService.delete(first.getId(), USER)).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("A failed remote delete should keep the record")
        void shouldKeepRecordOnRemoteFailure() throws IOException {
            ImageEntity image = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "a.jpg", "image/jpeg"));
            storage.setFailDeletes(true);

            assertThatThrownBy(() -> imageService.delete(image.getId(), USER))
                    .isInstanceOf(ProviderConnectionException.class);
            assertThat(imageRepository.findById(image.getId())).isPresent();
        }

        @Test
        @DisplayName("Another user's image should look nonexistent")
        void shouldHideForeignImages() throws IOException {
            ImageEntity image = imageService.upload(USER, new UploadCommand(jpeg(60, 40), "a.jpg", "image/jpeg"));

            assertThatThrownBy(() -> imageService.get(image.getId(), "intruder")).isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> imageService.delete(image.getId(), "intruder")).isInstanceOf(NotFoundException.class);
            assertThat(storage.blobs()).containsKey(image.getStoragePath());
        }

        @Test
        @DisplayName("Stats should aggregate counts and savings")
        void shouldComputeStats() throws IOException {
            ImageEntity optimized = imageService.upload(USER, new UploadCommand(jpeg(3000, 2000), "a.jpg", "image/jpeg"));
            UploadCommand plain = new UploadCommand(jpeg(60, 40), "b.jpg", "image/jpeg");
            plain.setOptimize(false);
            ImageEntity original = imageService.upload(USER, plain);

            ImageStats stats = imageService.stats(USER);

            assertThat(stats.getTotalImages()).isEqualTo(2);
            assertThat(stats.getOptimizedImages()).isEqualTo(1);
            assertThat(stats.getTotalSizeBytes()).isEqualTo(optimized.getFileSize() + original.getFileSize());
            assertThat(stats.getTotalSavedBytes()).isEqualTo(optimized.getFileSize() - optimized.getOptimizedSize());
            assertThat(imageService.list(USER)).extracting(ImageEntity::getId)
                    .containsExactly(original.getId(), optimized.getId());
        }
    }
}
