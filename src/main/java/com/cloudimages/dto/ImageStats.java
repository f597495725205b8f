package com.cloudimages.dto;

/**
 * Per-user storage totals.
 */
public class ImageStats {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final long totalImages;
    private final long totalSizeBytes;
    private final long optimizedImages;
    private final long totalSavedBytes;

    public ImageStats(long totalImages, long totalSizeBytes, long optimizedImages, long totalSavedBytes) {
        this.totalImages = totalImages;
        this.totalSizeBytes = totalSizeBytes;
        this.optimizedImages = optimizedImages;
        this.totalSavedBytes = totalSavedBytes;
    }

    public long getTotalImages() {
        return totalImages;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public double getTotalSizeMb() {
        return toMb(totalSizeBytes);
    }

    public long getOptimizedImages() {
        return optimizedImages;
    }

    public long getTotalSavedBytes() {
        return totalSavedBytes;
    }

    public double getTotalSavedMb() {
        return toMb(totalSavedBytes);
    }

    private static double toMb(long bytes) {
        return Math.round(bytes / BYTES_PER_MB * 100.0) / 100.0;
    }
}
