package com.cloudimages.service;

import java.util.Map;

/**
 * Output of the optimization pipeline: the bytes to store plus what was
 * learned about the image on the way.
 */
public class OptimizationResult {

    private final byte[] data;
    private final boolean optimized;
    private final String outputFormat;
    private final String contentType;
    private final String extension;
    private final int width;
    private final int height;
    private final Map<String, Object> metadata;

    public OptimizationResult(byte[] data, boolean optimized, String outputFormat, String contentType,
            String extension, int width, int height, Map<String, Object> metadata) {
        this.data = data;
        this.optimized = optimized;
        this.outputFormat = outputFormat;
        this.contentType = contentType;
        this.extension = extension;
        this.width = width;
        this.height = height;
        this.metadata = metadata;
    }

    public byte[] getData() {
        return data;
    }

    public long getSize() {
        return data.length;
    }

    public boolean isOptimized() {
        return optimized;
    }

    /** ImageIO format name of the stored bytes, e.g. "jpeg" or "png" */
    public String getOutputFormat() {
        return outputFormat;
    }

    public String getContentType() {
        return contentType;
    }

    /** File extension matching the stored bytes, without the dot */
    public String getExtension() {
        return extension;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
