package com.cloudimages.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the upload flow needs from one request.
 */
public class UploadCommand {

    private byte[] data;
    private String filename;
    private String contentType;
    private Long providerId;
    private List<String> tags = new ArrayList<>();
    private boolean optimize = true;

    public UploadCommand() {
    }

    public UploadCommand(byte[] data, String filename, String contentType) {
        this.data = data;
        this.filename = filename;
        this.contentType = contentType;
    }

    public byte[] getData() {
        return data;
    }

    public void setData(byte[] data) {
        this.data = data;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    /** Explicit target provider, or null for the user's default */
    public Long getProviderId() {
        return providerId;
    }

    public void setProviderId(Long providerId) {
        this.providerId = providerId;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public boolean isOptimize() {
        return optimize;
    }

    public void setOptimize(boolean optimize) {
        this.optimize = optimize;
    }
}
