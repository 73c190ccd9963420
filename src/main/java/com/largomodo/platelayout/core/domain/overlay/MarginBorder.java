package com.largomodo.platelayout.core.domain.overlay;

import com.largomodo.platelayout.core.domain.Rect;

/**
 * Outline of the page edge and of the content box.
 *
 * @param content content box, always at the origin
 * @param margin  distance from the content box to the page edge
 */
public record MarginBorder(Rect content, int margin) implements Overlay {

    public Rect outer() {
        return new Rect(-margin, -margin, content.width() + 2 * margin, content.height() + 2 * margin);
    }

    @Override
    public <R> R accept(OverlayVisitor<R> visitor) {
        return visitor.visitMarginBorder(this);
    }
}
