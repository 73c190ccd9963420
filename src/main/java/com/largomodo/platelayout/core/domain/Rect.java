package com.largomodo.platelayout.core.domain;

/**
 * Axis-aligned rectangle in pixel coordinates, origin top-left.
 */
public record Rect(int x, int y, int width, int height) {

    public Rect {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Rect cannot have negative extent: " + width + "x" + height);
        }
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public long area() {
        return (long) width * height;
    }

    /**
     * Interior overlap test. Rectangles that only share an edge do not intersect.
     */
    public boolean intersects(Rect other) {
        return x < other.right() && other.x < right()
                && y < other.bottom() && other.y < bottom();
    }

    public boolean contains(Rect other) {
        return other.x >= x && other.y >= y
                && other.right() <= right() && other.bottom() <= bottom();
    }
}
