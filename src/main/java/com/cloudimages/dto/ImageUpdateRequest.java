package com.cloudimages.dto;

import java.util.List;
import java.util.Map;

/**
 * PATCH body for an image. Only tags and metadata are mutable; null means
 * "leave unchanged".
 */
public class ImageUpdateRequest {

    private List<String> tags;
    private Map<String, Object> metadata;

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
