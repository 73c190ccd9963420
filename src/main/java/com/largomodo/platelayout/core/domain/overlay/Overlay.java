package com.largomodo.platelayout.core.domain.overlay;

/**
 * A non-image element drawn on a page after the images.
 */
public interface Overlay {

    <R> R accept(OverlayVisitor<R> visitor);
}
