package com.cloudimages.service;

import com.cloudimages.config.AppConfig;
import com.cloudimages.exception.UnsupportedFormatException;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns uploaded bytes into the artifact that is stored remotely.
 *
 * Stages, in order:
 * 1. Decode: ImageIO reader picked from the content, not the declared type
 * 2. Orient: apply the EXIF orientation to the pixels
 * 3. Normalize color mode: flatten alpha/palette onto white for non-alpha targets
 * 4. Resize: longer side down to the configured maximum, never up
 * 5. Recompress: lossy formats at the configured quality, lossless natively
 * 6. Extract metadata: format, mode, dimensions, selected EXIF fields
 *
 * When optimization is declined, stages 2-5 are skipped and the original
 * bytes are returned untouched; metadata is still extracted.
 * Re-encoding drops all embedded metadata, which also strips the orientation
 * tag so the image is not rotated twice downstream.
 */
@Service
public class ImageOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(ImageOptimizationService.class);

    private final AppConfig appConfig;

    public ImageOptimizationService(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * Runs the pipeline.
     *
     * @param data     raw upload bytes
     * @param optimize false to keep the original bytes
     * @throws UnsupportedFormatException if the bytes are not a decodable image
     */
    public OptimizationResult process(byte[] data, boolean optimize) {
        // ── 1. Decode ────────────────────────────────────────────────────
        Decoded decoded = decode(data);
        BufferedImage image = decoded.image;
        String sourceFormat = decoded.format;
        int originalWidth = image.getWidth();
        int originalHeight = image.getHeight();

        Map<String, Object> exif = new LinkedHashMap<>();
        int orientation = readExif(data, exif);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", sourceFormat.toUpperCase(Locale.ROOT));
        metadata.put("mode", colorMode(image));
        metadata.put("original_width", originalWidth);
        metadata.put("original_height", originalHeight);

        if (!optimize) {
            metadata.put("orientation", orientation);
            if (!exif.isEmpty()) {
                metadata.put("exif", exif);
            }
            OutputFormat passthrough = OutputFormat.of(sourceFormat);
            return new OptimizationResult(data, false, sourceFormat,
                    passthrough != null ? passthrough.contentType : "application/octet-stream",
                    passthrough != null ? passthrough.extension : "",
                    originalWidth, originalHeight, metadata);
        }

        OutputFormat target = OutputFormat.targetFor(sourceFormat, image.getColorModel().hasAlpha());

        // ── 2. Orient ────────────────────────────────────────────────────
        image = applyOrientation(image, orientation);

        // ── 3. Normalize color mode ──────────────────────────────────────
        if (!target.supportsAlpha) {
            image = flattenOntoWhite(image);
        }

        // ── 4. Resize ────────────────────────────────────────────────────
        int imageType = target.supportsAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        image = resize(image, appConfig.getOptimization().getMaxDimension(), imageType);

        // ── 5. Recompress ────────────────────────────────────────────────
        byte[] encoded = encode(image, target, imageType);

        // ── 6. Extract metadata ──────────────────────────────────────────
        metadata.put("mode", colorMode(image));
        metadata.put("optimized_width", image.getWidth());
        metadata.put("optimized_height", image.getHeight());
        metadata.put("output_format", target.formatName.toUpperCase(Locale.ROOT));
        metadata.put("orientation", 1);
        if (orientation > 1) {
            metadata.put("applied_orientation", orientation);
        }
        if (!exif.isEmpty()) {
            metadata.put("exif", exif);
        }

        log.debug("Optimized {}x{} {} ({} bytes) to {}x{} {} ({} bytes)",
                originalWidth, originalHeight, sourceFormat, data.length,
                image.getWidth(), image.getHeight(), target.formatName, encoded.length);

        return new OptimizationResult(encoded, true, target.formatName, target.contentType, target.extension,
                image.getWidth(), image.getHeight(), metadata);
    }

    private Decoded decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new UnsupportedFormatException("Empty content is not an image");
        }
        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (iis == null) {
                throw new UnsupportedFormatException("Content could not be opened as an image");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new UnsupportedFormatException("Content is not a recognized image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                String format = normalizeFormat(reader.getFormatName());
                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new UnsupportedFormatException("Image could not be decoded");
                }
                return new Decoded(format, image);
            } finally {
                reader.dispose();
            }
        } catch (UnsupportedFormatException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new UnsupportedFormatException("Image could not be decoded: " + e.getMessage(), e);
        }
    }

    /**
     * Collects selected EXIF fields into {@code exif} and returns the
     * orientation tag (1 when absent).
     */
    private int readExif(byte[] data, Map<String, Object> exif) {
        int orientation = 1;
        try {
            Metadata metadata = readMetadata(data);

            ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (ifd0 != null) {
                Integer tag = ifd0.getInteger(ExifIFD0Directory.TAG_ORIENTATION);
                if (tag != null && tag >= 1 && tag <= 8) {
                    orientation = tag;
                }
                putIfPresent(exif, "camera_make", ifd0.getString(ExifIFD0Directory.TAG_MAKE));
                putIfPresent(exif, "camera_model", ifd0.getString(ExifIFD0Directory.TAG_MODEL));
                putIfPresent(exif, "software", ifd0.getString(ExifIFD0Directory.TAG_SOFTWARE));
            }

            ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
            if (subIfd != null) {
                putIfPresent(exif, "date_taken", subIfd.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
                putIfPresent(exif, "exposure_time", subIfd.getDescription(ExifSubIFDDirectory.TAG_EXPOSURE_TIME));
                putIfPresent(exif, "f_number", subIfd.getDescription(ExifSubIFDDirectory.TAG_FNUMBER));
                putIfPresent(exif, "iso", subIfd.getString(ExifSubIFDDirectory.TAG_ISO_EQUIVALENT));
                putIfPresent(exif, "focal_length", subIfd.getDescription(ExifSubIFDDirectory.TAG_FOCAL_LENGTH));
                putIfPresent(exif, "flash", subIfd.getDescription(ExifSubIFDDirectory.TAG_FLASH));
            }
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable EXIF metadata: {}", e.getMessage());
        } catch (RuntimeException e) {
            // malformed segments in an otherwise decodable image
            log.debug("Skipping malformed EXIF metadata: {}", e.toString());
        }
        return orientation;
    }

    Metadata readMetadata(byte[] data) throws ImageProcessingException, IOException {
        return ImageMetadataReader.readMetadata(new ByteArrayInputStream(data));
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.trim());
        }
    }

    /**
     * Rotates/flips the pixels so that EXIF orientation 1 is correct.
     */
    static BufferedImage applyOrientation(BufferedImage image, int orientation) {
        if (orientation <= 1 || orientation > 8) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        AffineTransform t = new AffineTransform();
        switch (orientation) {
            case 2: // mirror horizontal
                t.scale(-1, 1);
                t.translate(-w, 0);
                break;
            case 3: // rotate 180
                t.translate(w, h);
                t.rotate(Math.PI);
                break;
            case 4: // mirror vertical
                t.scale(1, -1);
                t.translate(0, -h);
                break;
            case 5: // transpose
                t.rotate(-Math.PI / 2);
                t.scale(-1, 1);
                break;
            case 6: // rotate 90 CW
                t.translate(h, 0);
                t.rotate(Math.PI / 2);
                break;
            case 7: // transverse
                t.scale(-1, 1);
                t.translate(-h, 0);
                t.translate(0, w);
                t.rotate(3 * Math.PI / 2);
                break;
            default: // 8: rotate 90 CCW
                t.translate(0, w);
                t.rotate(3 * Math.PI / 2);
                break;
        }

        boolean swap = orientation >= 5;
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage rotated = new BufferedImage(swap ? h : w, swap ? w : h, type);
        Graphics2D g = rotated.createGraphics();
        try {
            g.drawImage(image, t, null);
        } finally {
            g.dispose();
        }
        return rotated;
    }

    /**
     * Draws the image onto an opaque white RGB canvas.
     */
    static BufferedImage flattenOntoWhite(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage resize(BufferedImage image, int maxDimension, int imageType) {
        if (Math.max(image.getWidth(), image.getHeight()) <= maxDimension) {
            return image;
        }
        try {
            return Thumbnails.of(image)
                    .size(maxDimension, maxDimension)
                    .keepAspectRatio(true)
                    .imageType(imageType)
                    .asBufferedImage();
        } catch (IOException e) {
            throw new IllegalStateException("Resizing failed", e);
        }
    }

    private byte[] encode(BufferedImage image, OutputFormat target, int imageType) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(image)
                    .scale(1.0)
                    .imageType(imageType)
                    .outputFormat(target.formatName);
            if (target.lossy) {
                builder.outputQuality(appConfig.getOptimization().getQuality());
            }
            builder.toOutputStream(out);
        } catch (IOException e) {
            throw new IllegalStateException("Encoding to " + target.formatName + " failed", e);
        }
        return out.toByteArray();
    }

    static String colorMode(BufferedImage image) {
        ColorModel cm = image.getColorModel();
        if (cm instanceof IndexColorModel) {
            return "P";
        }
        int space = cm.getColorSpace().getType();
        if (space == ColorSpace.TYPE_GRAY) {
            return cm.hasAlpha() ? "LA" : "L";
        }
        if (space == ColorSpace.TYPE_CMYK) {
            return "CMYK";
        }
        return cm.hasAlpha() ? "RGBA" : "RGB";
    }

    private static String normalizeFormat(String readerFormat) {
        String format = readerFormat == null ? "unknown" : readerFormat.toLowerCase(Locale.ROOT);
        return format.equals("jpg") ? "jpeg" : format;
    }

    private static final class Decoded {
        private final String format;
        private final BufferedImage image;

        private Decoded(String format, BufferedImage image) {
            this.format = format;
            this.image = image;
        }
    }

    /**
     * Encodings the pipeline can write.
     */
    enum OutputFormat {
        JPEG("jpeg", "image/jpeg", "jpg", true, false),
        PNG("png", "image/png", "png", false, true),
        GIF("gif", "image/gif", "gif", false, true),
        BMP("bmp", "image/bmp", "bmp", false, false),
        // Read-only: kept only when optimization is declined
        WEBP("webp", "image/webp", "webp", true, true);

        final String formatName;
        final String contentType;
        final String extension;
        final boolean lossy;
        final boolean supportsAlpha;

        OutputFormat(String formatName, String contentType, String extension, boolean lossy, boolean supportsAlpha) {
            this.formatName = formatName;
            this.contentType = contentType;
            this.extension = extension;
            this.lossy = lossy;
            this.supportsAlpha = supportsAlpha;
        }

        static OutputFormat of(String format) {
            for (OutputFormat f : values()) {
                if (f.formatName.equals(format)) {
                    return f;
                }
            }
            return null;
        }

        /**
         * Keeps the source encoding where a writer exists; otherwise PNG for
         * images with alpha and JPEG for opaque ones.
         */
        static OutputFormat targetFor(String sourceFormat, boolean hasAlpha) {
            OutputFormat source = of(sourceFormat);
            if (source != null && source != WEBP) {
                return source;
            }
            return hasAlpha ? PNG : JPEG;
        }
    }
}
