package com.largomodo.platelayout.core.config;

/**
 * Plate numbering.
 *
 * @param enabled     draw numbers
 * @param startNumber first number in the document
 * @param position    corner the label sits in
 * @param prefix      text before the number, joined with a single space; blank prints the bare number
 * @param fontSize    font size in pixels
 * @param scope       one number per image or per page
 */
public record NumberingSpec(boolean enabled, int startNumber, NumberPosition position, String prefix,
                            int fontSize, NumberingScope scope) {

    public static final String DEFAULT_PREFIX = "Tav.";
    public static final int DEFAULT_FONT_SIZE = 18;

    public NumberingSpec {
        position = position == null ? NumberPosition.TOP_LEFT : position;
        scope = scope == null ? NumberingScope.IMAGE : scope;
        prefix = prefix == null ? "" : prefix;
        if (fontSize < 1) {
            throw new InvalidLayoutConfigException("Number font size must be at least 1: " + fontSize);
        }
    }

    public static NumberingSpec standard() {
        return new NumberingSpec(true, 1, NumberPosition.TOP_LEFT, DEFAULT_PREFIX, DEFAULT_FONT_SIZE,
                NumberingScope.IMAGE);
    }

    public static NumberingSpec disabled() {
        return new NumberingSpec(false, 1, NumberPosition.TOP_LEFT, DEFAULT_PREFIX, DEFAULT_FONT_SIZE,
                NumberingScope.IMAGE);
    }

    public String label(int number) {
        return prefix.isBlank() ? Integer.toString(number) : prefix.trim() + " " + number;
    }
}
