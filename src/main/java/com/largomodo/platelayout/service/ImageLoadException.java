package com.largomodo.platelayout.service;

import java.io.IOException;

/**
 * Thrown when an image file cannot be read or decoded.
 */
public class ImageLoadException extends IOException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
