package com.cloudimages.service;

import com.cloudimages.config.AppConfig;
import com.cloudimages.exception.UnsupportedFormatException;
import com.drew.metadata.Metadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImageOptimizationService Tests")
class ImageOptimizationServiceTest {

    private static final Map<String, Integer> QUADRANT_COLORS = Map.of(
            "RED", 0xFF0000,
            "GREEN", 0x00FF00,
            "BLUE", 0x0000FF,
            "YELLOW", 0xFFFF00);

    private ImageOptimizationService service;

    @BeforeEach
    void setUp() {
        service = new ImageOptimizationService(new AppConfig());
    }

    private static BufferedImage gradient(int width, int height, int type) {
        BufferedImage image = new BufferedImage(width, height, type);
        Graphics2D g = image.createGraphics();
        g.setPaint(new GradientPaint(0, 0, Color.ORANGE, width, height, Color.BLUE));
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    private static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThat(ImageIO.write(image, format, out)).isTrue();
        return out.toByteArray();
    }

    @Nested
    @DisplayName("Optimizing")
    class OptimizingTests {

        @Test
        @DisplayName("Should scale a large JPEG down to the maximum dimension")
        void shouldResizeLargeJpeg() throws IOException {
            byte[] original = encode(gradient(4000, 3000, BufferedImage.TYPE_INT_RGB), "jpeg");

            OptimizationResult result = service.process(original, true);

            assertThat(result.isOptimized()).isTrue();
            assertThat(result.getWidth()).isEqualTo(2048);
            assertThat(result.getHeight()).isEqualTo(1536);
            assertThat(result.getSize()).isLessThan(original.length);
            assertThat(result.getContentType()).isEqualTo("image/jpeg");
            assertThat(result.getExtension()).isEqualTo("jpg");

            BufferedImage stored = ImageIO.read(new ByteArrayInputStream(result.getData()));
            assertThat(stored.getWidth()).isEqualTo(2048);
            assertThat(stored.getHeight()).isEqualTo(1536);

            assertThat(result.getMetadata())
                    .containsEntry("format", "JPEG")
                    .containsEntry("original_width", 4000)
                    .containsEntry("original_height", 3000)
                    .containsEntry("optimized_width", 2048)
                    .containsEntry("optimized_height", 1536)
                    .containsEntry("orientation", 1);
        }

        @Test
        @DisplayName("Should never upscale a small image")
        void shouldNotUpscale() throws IOException {
            byte[] original = encode(gradient(300, 200, BufferedImage.TYPE_INT_RGB), "png");

            OptimizationResult result = service.process(original, true);

            assertThat(result.getWidth()).isEqualTo(300);
            assertThat(result.getHeight()).isEqualTo(200);
        }

        @Test
        @DisplayName("Should keep transparency for PNG input")
        void shouldKeepAlphaForPng() throws IOException {
            BufferedImage image = new BufferedImage(100, 50, BufferedImage.TYPE_INT_ARGB);
            image.setRGB(10, 10, 0x80FF0000);
            byte[] original = encode(image, "png");

            OptimizationResult result = service.process(original, true);

            assertThat(result.getOutputFormat()).isEqualTo("png");
            assertThat(result.getContentType()).isEqualTo("image/png");
            assertThat(result.getMetadata()).containsEntry("mode", "RGBA");
            BufferedImage stored = ImageIO.read(new ByteArrayInputStream(result.getData()));
            assertThat(stored.getColorModel().hasAlpha()).isTrue();
            assertThat(stored.getRGB(0, 0) >>> 24).isZero();
        }

        @Test
        @DisplayName("Should honour a custom maximum dimension")
        void shouldHonourConfiguredMaximum() throws IOException {
            AppConfig config = new AppConfig();
            config.getOptimization().setMaxDimension(100);
            ImageOptimizationService small = new ImageOptimizationService(config);

            OptimizationResult result = small.process(encode(gradient(200, 400, BufferedImage.TYPE_INT_RGB), "png"), true);

            assertThat(result.getWidth()).isEqualTo(50);
            assertThat(result.getHeight()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should still optimize when the EXIF block is malformed")
        void shouldSurviveMalformedExif() throws IOException {
            ImageOptimizationService brokenExif = new ImageOptimizationService(new AppConfig()) {
                @Override
                Metadata readMetadata(byte[] data) {
                    throw new ArrayIndexOutOfBoundsException("segment length 65535 exceeds buffer");
                }
            };
            byte[] original = encode(gradient(300, 200, BufferedImage.TYPE_INT_RGB), "jpeg");

            OptimizationResult result = brokenExif.process(original, true);

            assertThat(result.isOptimized()).isTrue();
            assertThat(result.getWidth()).isEqualTo(300);
            assertThat(result.getMetadata()).containsEntry("orientation", 1);
        }
    }

    @Nested
    @DisplayName("Declined optimization")
    class PassthroughTests {

        @Test
        @DisplayName("Should return the original bytes with metadata")
        void shouldKeepOriginalBytes() throws IOException {
            byte[] original = encode(gradient(4000, 3000, BufferedImage.TYPE_INT_RGB), "jpeg");

            OptimizationResult result = service.process(original, false);

            assertThat(result.isOptimized()).isFalse();
            assertThat(result.getData()).isSameAs(original);
            assertThat(result.getWidth()).isEqualTo(4000);
            assertThat(result.getHeight()).isEqualTo(3000);
            assertThat(result.getMetadata())
                    .containsEntry("format", "JPEG")
                    .containsEntry("mode", "RGB")
                    .doesNotContainKey("optimized_width");
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectionTests {

        @Test
        @DisplayName("Should reject bytes that are not an image")
        void shouldRejectGarbage() {
            byte[] garbage = "definitely not an image".getBytes();

            assertThatThrownBy(() -> service.process(garbage, true))
                    .isInstanceOf(UnsupportedFormatException.class);
        }

        @Test
        @DisplayName("Should reject a truncated image")
        void shouldRejectTruncatedImage() throws IOException {
            byte[] png = encode(gradient(64, 64, BufferedImage.TYPE_INT_RGB), "png");
            byte[] truncated = Arrays.copyOf(png, 40);

            assertThatThrownBy(() -> service.process(truncated, true))
                    .isInstanceOf(UnsupportedFormatException.class);
        }
    }

    @Nested
    @DisplayName("Pixel transforms")
    class TransformTests {

        @Test
        @DisplayName("Orientation 6 should rotate clockwise and swap dimensions")
        void shouldRotateClockwise() {
            BufferedImage image = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = image.createGraphics();
            g.setColor(Color.RED);
            g.fillRect(0, 0, 20, 20);
            g.setColor(Color.BLUE);
            g.fillRect(20, 0, 20, 20);
            g.dispose();

            BufferedImage rotated = ImageOptimizationService.applyOrientation(image, 6);

            assertThat(rotated.getWidth()).isEqualTo(20);
            assertThat(rotated.getHeight()).isEqualTo(40);
            assertThat(rotated.getRGB(10, 5) & 0xFFFFFF).isEqualTo(0xFF0000);
            assertThat(rotated.getRGB(10, 35) & 0xFFFFFF).isEqualTo(0x0000FF);
        }

        @ParameterizedTest(name = "orientation {0}")
        @CsvSource({
                "2, 40, 20, GREEN, RED, YELLOW, BLUE",
                "3, 40, 20, YELLOW, BLUE, GREEN, RED",
                "4, 40, 20, BLUE, YELLOW, RED, GREEN",
                "5, 20, 40, RED, BLUE, GREEN, YELLOW",
                "6, 20, 40, BLUE, RED, YELLOW, GREEN",
                "7, 20, 40, YELLOW, GREEN, BLUE, RED",
                "8, 20, 40, GREEN, YELLOW, RED, BLUE"
        })
        @DisplayName("Every EXIF orientation should move the quadrants to their upright place")
        void shouldOrientQuadrants(int orientation, int width, int height,
                String topLeft, String topRight, String bottomLeft, String bottomRight) {
            // 40x20 source: red | green over blue | yellow
            BufferedImage image = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = image.createGraphics();
            g.setColor(Color.RED);
            g.fillRect(0, 0, 20, 10);
            g.setColor(Color.GREEN);
            g.fillRect(20, 0, 20, 10);
            g.setColor(Color.BLUE);
            g.fillRect(0, 10, 20, 10);
            g.setColor(Color.YELLOW);
            g.fillRect(20, 10, 20, 10);
            g.dispose();

            BufferedImage oriented = ImageOptimizationService.applyOrientation(image, orientation);

            assertThat(oriented.getWidth()).isEqualTo(width);
            assertThat(oriented.getHeight()).isEqualTo(height);
            assertThat(oriented.getRGB(width / 4, height / 4) & 0xFFFFFF).isEqualTo(QUADRANT_COLORS.get(topLeft));
            assertThat(oriented.getRGB(3 * width / 4, height / 4) & 0xFFFFFF).isEqualTo(QUADRANT_COLORS.get(topRight));
            assertThat(oriented.getRGB(width / 4, 3 * height / 4) & 0xFFFFFF).isEqualTo(QUADRANT_COLORS.get(bottomLeft));
            assertThat(oriented.getRGB(3 * width / 4, 3 * height / 4) & 0xFFFFFF)
                    .isEqualTo(QUADRANT_COLORS.get(bottomRight));
        }

        @Test
        @DisplayName("Orientation 1 should leave the image untouched")
        void shouldIgnoreNormalOrientation() {
            BufferedImage image = new BufferedImage(4, 2, BufferedImage.TYPE_INT_RGB);

            assertThat(ImageOptimizationService.applyOrientation(image, 1)).isSameAs(image);
        }

        @Test
        @DisplayName("Flattening should paint transparent pixels white")
        void shouldFlattenOntoWhite() {
            BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
            image.setRGB(1, 0, 0xFF000000);

            BufferedImage flat = ImageOptimizationService.flattenOntoWhite(image);

            assertThat(flat.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
            assertThat(flat.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
            assertThat(flat.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0x000000);
        }

        @Test
        @DisplayName("Should name color modes")
        void shouldNameColorModes() {
            assertThat(ImageOptimizationService.colorMode(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB))).isEqualTo("RGB");
            assertThat(ImageOptimizationService.colorMode(new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB))).isEqualTo("RGBA");
            assertThat(ImageOptimizationService.colorMode(new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY))).isEqualTo("L");
            assertThat(ImageOptimizationService.colorMode(new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_INDEXED))).isEqualTo("P");
        }
    }
}
