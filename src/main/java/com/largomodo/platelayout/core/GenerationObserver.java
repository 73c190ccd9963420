package com.largomodo.platelayout.core;

import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.scale.ScaleResolution;

/**
 * Observer interface for layout generation events.
 * <p>
 * All methods have default no-op implementations, so consumers override only the events they
 * care about. Callbacks run on the thread calling {@link LayoutEngine}.
 * </p>
 *
 * @see LayoutEngine
 */
public interface GenerationObserver {

    /**
     * Called once per request after the render scale is known.
     *
     * @param resolution the chosen scale and, in auto mode, how close it came to the target
     */
    default void onScaleResolved(ScaleResolution resolution) {}

    /**
     * Called for every page once its overlays are in place.
     *
     * @param page the finished page
     */
    default void onPageCompleted(Page page) {}

    /**
     * Called for every image left out of the document.
     *
     * @param failure which image and why
     */
    default void onImageRejected(ImageFailure failure) {}
}
