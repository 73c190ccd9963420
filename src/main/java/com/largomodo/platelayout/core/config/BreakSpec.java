package com.largomodo.platelayout.core.config;

/**
 * Break-on-primary-change settings.
 *
 * @param enabled          whether value changes of the primary sort field are honored
 * @param kind             start a new page or draw a divider
 * @param dividerThickness divider thickness in pixels
 * @param dividerWidth     horizontal divider length, 0 spans the content width
 */
public record BreakSpec(boolean enabled, BreakKind kind, int dividerThickness, int dividerWidth) {

    public static final int DEFAULT_THICKNESS = 2;

    public BreakSpec {
        kind = kind == null ? BreakKind.NEW_PAGE : kind;
        if (dividerThickness < 1) {
            throw new InvalidLayoutConfigException("Divider thickness must be at least 1: " + dividerThickness);
        }
        if (dividerWidth < 0) {
            throw new InvalidLayoutConfigException("Divider width cannot be negative: " + dividerWidth);
        }
    }

    public static BreakSpec disabled() {
        return new BreakSpec(false, BreakKind.NEW_PAGE, DEFAULT_THICKNESS, 0);
    }

    public static BreakSpec newPage() {
        return new BreakSpec(true, BreakKind.NEW_PAGE, DEFAULT_THICKNESS, 0);
    }

    public static BreakSpec divider(int thickness, int width) {
        return new BreakSpec(true, BreakKind.DIVIDER, thickness, width);
    }
}
