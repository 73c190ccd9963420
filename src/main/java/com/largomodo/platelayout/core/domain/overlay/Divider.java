package com.largomodo.platelayout.core.domain.overlay;

/**
 * Filled rule separating two metadata groups on the same page.
 */
public record Divider(int x, int y, int width, int height) implements Overlay {

    public boolean horizontal() {
        return width >= height;
    }

    @Override
    public <R> R accept(OverlayVisitor<R> visitor) {
        return visitor.visitDivider(this);
    }
}
