package com.cloudimages.storage;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates backend-relative storage paths.
 *
 * Layout: {@code user_{id}/{yyyy}/{MM}/{yyyyMMdd_HHmmss}_{8 hex}{.ext}}.
 * The random suffix keeps concurrent uploads by the same user apart without
 * any shared lock.
 */
public final class StoragePaths {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final SecureRandom RANDOM = new SecureRandom();

    private StoragePaths() {
    }

    public static String generate(String userNamespace, String filename) {
        return generate(userNamespace, filename, Clock.systemDefaultZone());
    }

    public static String generate(String userNamespace, String filename, Clock clock) {
        LocalDateTime now = LocalDateTime.now(clock);
        byte[] suffix = new byte[4];
        RANDOM.nextBytes(suffix);

        return String.format("user_%s/%04d/%02d/%s_%s%s",
                sanitizeSegment(userNamespace),
                now.getYear(),
                now.getMonthValue(),
                now.format(TIMESTAMP),
                HexFormat.of().formatHex(suffix),
                extensionOf(filename));
    }

    /**
     * Returns the lower-cased extension including the dot, or "" if none.
     */
    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        String ext = name.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,10}") ? ext : "";
    }

    private static String sanitizeSegment(String segment) {
        if (segment == null || segment.isBlank()) {
            return "anonymous";
        }
        return segment.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
