package com.largomodo.platelayout.core.domain.overlay;

import java.util.List;

/**
 * Text block centered under an image.
 *
 * @param imageId    the image the caption belongs to
 * @param centerX    horizontal center of every line
 * @param top        top of the first line
 * @param lines      caption lines, top to bottom
 * @param fontSize   font size in pixels
 * @param lineHeight distance between consecutive baselines
 */
public record Caption(String imageId, int centerX, int top, List<String> lines, int fontSize, int lineHeight)
        implements Overlay {

    public Caption {
        lines = List.copyOf(lines);
    }

    @Override
    public <R> R accept(OverlayVisitor<R> visitor) {
        return visitor.visitCaption(this);
    }
}
