package com.largomodo.platelayout.core.config;

/**
 * What happens where the primary sort field changes value.
 */
public enum BreakKind {
    NEW_PAGE,
    DIVIDER;

    public static BreakKind fromOption(String value) {
        if (value == null || value.isBlank()) {
            return NEW_PAGE;
        }
        return switch (value.trim().toLowerCase()) {
            case "new_page", "page" -> NEW_PAGE;
            case "divider", "line" -> DIVIDER;
            default -> throw new InvalidLayoutConfigException(
                    "Invalid break kind: " + value + ". Supported: new_page, divider");
        };
    }
}
