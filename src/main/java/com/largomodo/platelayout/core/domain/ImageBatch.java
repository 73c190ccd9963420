package com.largomodo.platelayout.core.domain;

import java.util.List;

/**
 * Result of loading a folder: the images that decoded plus the ones that did not.
 */
public record ImageBatch(List<ImageItem> images, List<ImageFailure> failures) {

    public ImageBatch {
        images = List.copyOf(images);
        failures = List.copyOf(failures);
    }

    public static ImageBatch of(List<ImageItem> images) {
        return new ImageBatch(images, List.of());
    }
}
