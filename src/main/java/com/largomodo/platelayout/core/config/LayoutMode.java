package com.largomodo.platelayout.core.config;

/**
 * Placement algorithms selectable per request.
 */
public enum LayoutMode {
    GRID,       // fixed rows x columns
    PUZZLE,     // rectangle packing, no rotation
    MASONRY,    // equal-width columns, shortest column first
    MANUAL;     // caller supplied positions

    public static LayoutMode fromCliArgument(String arg) {
        if (arg == null) {
            throw new InvalidLayoutConfigException("Layout mode cannot be null. Supported: grid, puzzle, masonry, manual");
        }
        try {
            return valueOf(arg.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidLayoutConfigException(
                    "Invalid layout mode: " + arg + ". Supported: grid, puzzle, masonry, manual", e);
        }
    }
}
