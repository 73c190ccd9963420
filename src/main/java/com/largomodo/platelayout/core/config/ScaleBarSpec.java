package com.largomodo.platelayout.core.config;

/**
 * Physical scale reference drawn at the bottom-left of the content box.
 *
 * @param enabled     draw the bar
 * @param lengthCm    physical length represented by the bar
 * @param pixelsPerCm source image resolution
 */
public record ScaleBarSpec(boolean enabled, double lengthCm, double pixelsPerCm) {

    public static final double DEFAULT_LENGTH_CM = 5;
    public static final double DEFAULT_PIXELS_PER_CM = 118;

    public ScaleBarSpec {
        if (!(lengthCm > 0) || Double.isInfinite(lengthCm)) {
            throw new InvalidLayoutConfigException("Scale bar length must be positive: " + lengthCm);
        }
        if (!(pixelsPerCm > 0) || Double.isInfinite(pixelsPerCm)) {
            throw new InvalidLayoutConfigException("Pixels per centimetre must be positive: " + pixelsPerCm);
        }
    }

    public static ScaleBarSpec standard() {
        return new ScaleBarSpec(true, DEFAULT_LENGTH_CM, DEFAULT_PIXELS_PER_CM);
    }

    public static ScaleBarSpec disabled() {
        return new ScaleBarSpec(false, DEFAULT_LENGTH_CM, DEFAULT_PIXELS_PER_CM);
    }
}
