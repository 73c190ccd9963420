package com.largomodo.platelayout.core.config;

/**
 * Thrown when a layout configuration cannot produce any page at all: content box collapsed by
 * margins, grid cells below one pixel, non-positive scale, unknown mode.
 * <p>
 * This is the only failure that aborts a whole generation request. Problems with individual
 * images are reported on the document instead.
 */
public class InvalidLayoutConfigException extends RuntimeException {

    public InvalidLayoutConfigException(String message) {
        super(message);
    }

    public InvalidLayoutConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
