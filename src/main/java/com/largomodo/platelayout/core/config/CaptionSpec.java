package com.largomodo.platelayout.core.config;

import java.util.List;

/**
 * Caption text under each image.
 *
 * @param enabled         draw captions
 * @param fontSize        font size in pixels
 * @param padding         gap between image and caption, also added around the text block
 * @param fields          metadata fields to print, in order; empty prints every field the image has
 * @param hideFieldNames  print {@code value} instead of {@code field: value}
 * @param stripExtension  drop the file extension from the name line
 */
public record CaptionSpec(boolean enabled, int fontSize, int padding, List<String> fields,
                          boolean hideFieldNames, boolean stripExtension) {

    public static final int DEFAULT_FONT_SIZE = 12;
    public static final int DEFAULT_PADDING = 5;

    public CaptionSpec {
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (fontSize < 1) {
            throw new InvalidLayoutConfigException("Caption font size must be at least 1: " + fontSize);
        }
        if (padding < 0) {
            throw new InvalidLayoutConfigException("Caption padding cannot be negative: " + padding);
        }
    }

    public static CaptionSpec disabled() {
        return new CaptionSpec(false, DEFAULT_FONT_SIZE, DEFAULT_PADDING, List.of(), false, false);
    }

    public static CaptionSpec names() {
        return new CaptionSpec(true, DEFAULT_FONT_SIZE, DEFAULT_PADDING, List.of(), false, false);
    }
}
