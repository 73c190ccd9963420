package com.largomodo.platelayout.core.domain;

/**
 * Width and height in pixels.
 *
 * @param width  horizontal extent, never negative
 * @param height vertical extent, never negative
 */
public record Size(int width, int height) {

    public static final Size EMPTY = new Size(0, 0);

    public Size {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Size cannot be negative: " + width + "x" + height);
        }
    }

    public long area() {
        return (long) width * height;
    }
}
