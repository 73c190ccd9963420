package com.largomodo.platelayout.core.domain.overlay;

/**
 * Segmented bar of alternating black and white blocks with "0" at the left end and the
 * physical length at the right end.
 *
 * @param x         left edge of the bar
 * @param y         top edge of the bar
 * @param length    bar length in pixels at the document scale
 * @param barHeight bar thickness
 * @param segments  number of alternating blocks
 * @param label     text for the right end, for example "5 cm"
 * @param fontSize  label font size, labels sit directly under the bar
 */
public record ScaleBar(int x, int y, int length, int barHeight, int segments, String label, int fontSize)
        implements Overlay {

    @Override
    public <R> R accept(OverlayVisitor<R> visitor) {
        return visitor.visitScaleBar(this);
    }
}
