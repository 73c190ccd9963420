package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;

/**
 * Space an image's caption needs below it, padding included.
 */
@FunctionalInterface
public interface CaptionMetrics {

    CaptionMetrics NONE = item -> Size.EMPTY;

    Size reserve(ImageItem item);
}
