package com.cloudimages.storage;

import com.cloudimages.exception.ValidationException;

import java.util.Map;

/**
 * Typed access to provider config and credential maps.
 */
final class BackendParams {

    private BackendParams() {
    }

    static String required(Map<String, Object> values, String key, String section) {
        String value = optional(values, key, null);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required " + section + " value: " + key);
        }
        return value;
    }

    static String optional(Map<String, Object> values, String key, String defaultValue) {
        if (values == null) {
            return defaultValue;
        }
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? defaultValue : text;
    }

    static int optionalInt(Map<String, Object> values, String key, int defaultValue) {
        String value = optional(values, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Value of " + key + " must be an integer");
        }
    }

    static boolean optionalBoolean(Map<String, Object> values, String key, boolean defaultValue) {
        String value = optional(values, key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
