package com.largomodo.platelayout.core.config;

public enum SortOrder {
    ASCENDING,
    DESCENDING;

    public static SortOrder fromOption(String value) {
        if (value == null || value.isBlank()) {
            return ASCENDING;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "asc", "ascending" -> ASCENDING;
            case "desc", "descending" -> DESCENDING;
            default -> throw new InvalidLayoutConfigException("Invalid sort order: " + value + ". Supported: asc, desc");
        };
    }
}
