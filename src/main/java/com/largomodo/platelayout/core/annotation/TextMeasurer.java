package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.domain.Size;

/**
 * Font metrics capability. Implementations must be safe for concurrent use.
 */
public interface TextMeasurer {

    /**
     * Bounding box of a single line of text.
     *
     * @param text     the line, never {@code null}
     * @param fontSize font size in pixels
     * @return advance width and line height in pixels
     */
    Size measure(String text, int fontSize);

    default int lineHeight(int fontSize) {
        return measure("Hg", fontSize).height();
    }
}
