package com.largomodo.platelayout.core.config;

/**
 * Whether the running number labels each image or each page.
 */
public enum NumberingScope {
    IMAGE,
    PAGE;

    public static NumberingScope fromOption(String value) {
        if (value == null || value.isBlank()) {
            return IMAGE;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidLayoutConfigException("Invalid numbering scope: " + value + ". Supported: image, page", e);
        }
    }
}
