package com.largomodo.platelayout.service;

import com.largomodo.platelayout.core.annotation.TextMeasurer;
import com.largomodo.platelayout.core.domain.Size;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.awt.geom.Rectangle2D;

/**
 * {@link TextMeasurer} on Java2D font metrics. Works headless; no graphics context is created.
 */
public class AwtTextMeasurer implements TextMeasurer {

    public static final String DEFAULT_FAMILY = Font.SANS_SERIF;

    private final String family;
    private final FontRenderContext context = new FontRenderContext(null, true, true);

    public AwtTextMeasurer() {
        this(DEFAULT_FAMILY);
    }

    public AwtTextMeasurer(String family) {
        this.family = family;
    }

    @Override
    public Size measure(String text, int fontSize) {
        Font font = new Font(family, Font.PLAIN, fontSize);
        Rectangle2D bounds = font.getStringBounds(text, context);
        LineMetrics metrics = font.getLineMetrics(text.isEmpty() ? "Hg" : text, context);
        return new Size((int) Math.ceil(bounds.getWidth()), (int) Math.ceil(metrics.getHeight()));
    }

    public String getFamily() {
        return family;
    }
}
