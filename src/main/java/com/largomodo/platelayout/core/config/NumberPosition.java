package com.largomodo.platelayout.core.config;

public enum NumberPosition {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_LEFT,
    BOTTOM_RIGHT;

    public static NumberPosition fromOption(String value) {
        if (value == null || value.isBlank()) {
            return TOP_LEFT;
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidLayoutConfigException("Invalid number position: " + value
                    + ". Supported: top_left, top_right, bottom_left, bottom_right", e);
        }
    }

    public boolean isRight() {
        return this == TOP_RIGHT || this == BOTTOM_RIGHT;
    }

    public boolean isBottom() {
        return this == BOTTOM_LEFT || this == BOTTOM_RIGHT;
    }
}
