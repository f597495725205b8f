package com.cloudimages.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StoragePaths Tests")
class StoragePathsTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-07T14:05:09Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Should lay out user, year, month, timestamp, suffix and extension")
    void shouldFollowLayout() {
        String path = StoragePaths.generate("42", "Holiday.JPG", FIXED);

        assertThat(path).matches("user_42/2024/03/20240307_140509_[0-9a-f]{8}\\.jpg");
    }

    @Test
    @DisplayName("Should not collide for the same user, name and second")
    void shouldNotCollide() {
        Set<String> paths = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            paths.add(StoragePaths.generate("42", "a.png", FIXED));
        }
        assertThat(paths).hasSize(1000);
    }

    @Test
    @DisplayName("Should drop missing or suspicious extensions")
    void shouldHandleExtensions() {
        assertThat(StoragePaths.extensionOf("noext")).isEmpty();
        assertThat(StoragePaths.extensionOf(".hidden")).isEmpty();
        assertThat(StoragePaths.extensionOf("trailing.")).isEmpty();
        assertThat(StoragePaths.extensionOf("a.b/c")).isEmpty();
        assertThat(StoragePaths.extensionOf("C:\\photos\\img.PNG")).isEqualTo(".png");
        assertThat(StoragePaths.extensionOf("x.p$g")).isEmpty();
        assertThat(StoragePaths.extensionOf(null)).isEmpty();
    }

    @Test
    @DisplayName("Should sanitize the user namespace")
    void shouldSanitizeNamespace() {
        assertThat(StoragePaths.generate("../evil user", "a.gif", FIXED)).startsWith("user_.._evil_user/");
        assertThat(StoragePaths.generate(" ", "a.gif", FIXED)).startsWith("user_anonymous/");
    }
}
