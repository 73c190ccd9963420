package com.largomodo.platelayout.core.scale;

import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;

/**
 * Pixel size arithmetic shared by the placement strategies.
 */
public final class RenderSizer {

    private RenderSizer() {
        // Static utility class - prevent instantiation
    }

    /**
     * Intrinsic size times {@code scale}, rounded, never below 1x1.
     */
    public static Size render(ImageItem item, double scale) {
        return new Size(
                Math.max(1, (int) Math.round(item.width() * scale)),
                Math.max(1, (int) Math.round(item.height() * scale)));
    }

    /**
     * Largest scale at which the item fits a {@code maxWidth x maxHeight} box.
     */
    public static double fitScale(ImageItem item, int maxWidth, int maxHeight) {
        if (maxWidth < 1 || maxHeight < 1) {
            return 0;
        }
        return Math.min((double) maxWidth / item.width(), (double) maxHeight / item.height());
    }

    /**
     * Shrinks {@code size} proportionally until it fits the box, or returns it unchanged when it
     * already fits. The box must be at least 1x1.
     */
    public static Size fitWithin(Size size, int maxWidth, int maxHeight) {
        if (size.width() <= maxWidth && size.height() <= maxHeight) {
            return size;
        }
        double factor = Math.min((double) maxWidth / size.width(), (double) maxHeight / size.height());
        int w = Math.min(maxWidth, Math.max(1, (int) Math.floor(size.width() * factor)));
        int h = Math.min(maxHeight, Math.max(1, (int) Math.floor(size.height() * factor)));
        return new Size(w, h);
    }

    /**
     * Scales to an exact width, preserving aspect ratio.
     */
    public static Size toWidth(ImageItem item, int width) {
        int h = Math.max(1, (int) Math.round((double) item.height() * width / item.width()));
        return new Size(width, h);
    }
}
