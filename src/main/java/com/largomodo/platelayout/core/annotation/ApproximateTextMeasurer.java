package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.domain.Size;

/**
 * Font-independent estimate: every glyph advances 0.6 em, lines are 1.2 em high.
 * <p>
 * Deterministic on every machine, which makes it the measurer of choice for tests and for
 * environments without fonts.
 */
public class ApproximateTextMeasurer implements TextMeasurer {

    private static final double ADVANCE_EM = 0.6;
    private static final double LINE_HEIGHT_EM = 1.2;

    @Override
    public Size measure(String text, int fontSize) {
        int width = (int) Math.ceil(text.codePointCount(0, text.length()) * ADVANCE_EM * fontSize);
        int height = (int) Math.ceil(LINE_HEIGHT_EM * fontSize);
        return new Size(width, height);
    }
}
