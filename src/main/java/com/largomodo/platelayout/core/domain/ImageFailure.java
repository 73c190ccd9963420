package com.largomodo.platelayout.core.domain;

/**
 * A per-image error. Never fatal to the request as a whole.
 */
public record ImageFailure(String imageId, FailureKind kind, String message) {

    public ImageFailure {
        if (imageId == null || kind == null) {
            throw new IllegalArgumentException("Image failure requires an id and a kind");
        }
        message = message == null ? "" : message;
    }
}
