package com.largomodo.platelayout.core.domain;

/**
 * An image at its final position, in content-box coordinates.
 *
 * @param item      the source image
 * @param x         left edge relative to the content box
 * @param y         top edge relative to the content box
 * @param width     rendered width
 * @param height    rendered height
 * @param pageIndex zero-based page the image sits on
 * @param fitted    true when the image was shrunk below the requested scale to fit its slot
 */
public record PlacedImage(ImageItem item, int x, int y, int width, int height, int pageIndex, boolean fitted) {

    public PlacedImage {
        if (item == null) {
            throw new IllegalArgumentException("Placed image requires an item");
        }
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Placed image " + item.name() + " must be at least 1x1");
        }
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index cannot be negative: " + pageIndex);
        }
    }

    public Rect bounds() {
        return new Rect(x, y, width, height);
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public PlacedImage withPageIndex(int newIndex) {
        return new PlacedImage(item, x, y, width, height, newIndex, fitted);
    }
}
