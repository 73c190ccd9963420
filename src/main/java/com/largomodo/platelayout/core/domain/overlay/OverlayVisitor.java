package com.largomodo.platelayout.core.domain.overlay;

/**
 * Dispatch over the overlay kinds. Encoders implement one of these per output format.
 */
public interface OverlayVisitor<R> {

    R visitCaption(Caption caption);

    R visitScaleBar(ScaleBar scaleBar);

    R visitMarginBorder(MarginBorder border);

    R visitDivider(Divider divider);

    R visitSequenceNumber(SequenceNumber number);
}
