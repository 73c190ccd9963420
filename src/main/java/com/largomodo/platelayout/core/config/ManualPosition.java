package com.largomodo.platelayout.core.config;

/**
 * Caller supplied placement for one image in manual mode.
 *
 * @param page   zero-based page index
 * @param x      left edge in content coordinates
 * @param y      top edge in content coordinates
 * @param width  explicit width, 0 uses the scaled intrinsic size
 * @param height explicit height, 0 uses the scaled intrinsic size
 */
public record ManualPosition(int page, int x, int y, int width, int height) {

    public ManualPosition {
        if (page < 0) {
            throw new InvalidLayoutConfigException("Manual page index cannot be negative: " + page);
        }
        if (width < 0 || height < 0) {
            throw new InvalidLayoutConfigException("Manual size cannot be negative: " + width + "x" + height);
        }
    }

    public static ManualPosition at(int page, int x, int y) {
        return new ManualPosition(page, x, y, 0, 0);
    }

    public boolean hasSize() {
        return width > 0 && height > 0;
    }
}
