package com.largomodo.platelayout.core.domain;

/**
 * Why an image did not make it into the document.
 */
public enum FailureKind {
    /** The file could not be read or decoded, or decoding timed out. */
    IMAGE_LOAD_FAILURE,
    /** The image cannot fit the content box even at the minimum scale. */
    OVERSIZED_IMAGE,
    /** Manual mode has no position for the image. */
    MISSING_POSITION
}
