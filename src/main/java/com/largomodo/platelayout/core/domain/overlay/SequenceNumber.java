package com.largomodo.platelayout.core.domain.overlay;

/**
 * Plate number label, for example "Tav. 3".
 *
 * @param x        left edge of the text box
 * @param y        top edge of the text box
 * @param text     rendered label
 * @param number   the running number inside the label
 * @param fontSize font size in pixels
 */
public record SequenceNumber(int x, int y, String text, int number, int fontSize) implements Overlay {

    @Override
    public <R> R accept(OverlayVisitor<R> visitor) {
        return visitor.visitSequenceNumber(this);
    }
}
