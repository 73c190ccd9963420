package com.largomodo.platelayout.core.config;

/**
 * Either a fixed scale factor or a target image count for page 0.
 *
 * @param kind          fixed or automatic
 * @param factor        scale factor for {@link Kind#FIXED}
 * @param targetPerPage images wanted on page 0 for {@link Kind#AUTO}
 * @param minScale      smallest scale an image may be drawn at before it counts as oversized
 */
public record ScaleSpec(Kind kind, double factor, int targetPerPage, double minScale) {

    public static final double DEFAULT_FACTOR = 0.4;
    public static final double DEFAULT_MIN_SCALE = 0.05;

    public enum Kind {
        FIXED,
        AUTO
    }

    public ScaleSpec {
        if (kind == null) {
            throw new InvalidLayoutConfigException("Scale kind is required");
        }
        if (!(minScale > 0) || Double.isInfinite(minScale)) {
            throw new InvalidLayoutConfigException("Minimum scale must be positive: " + minScale);
        }
        if (kind == Kind.FIXED && (!(factor > 0) || Double.isInfinite(factor))) {
            throw new InvalidLayoutConfigException("Scale factor must be positive: " + factor);
        }
        if (kind == Kind.AUTO && targetPerPage < 1) {
            throw new InvalidLayoutConfigException("Images per page must be at least 1: " + targetPerPage);
        }
    }

    public static ScaleSpec fixed(double factor) {
        return new ScaleSpec(Kind.FIXED, factor, 0, DEFAULT_MIN_SCALE);
    }

    public static ScaleSpec auto(int targetPerPage) {
        return new ScaleSpec(Kind.AUTO, 0, targetPerPage, DEFAULT_MIN_SCALE);
    }

    public ScaleSpec withMinScale(double newMinScale) {
        return new ScaleSpec(kind, factor, targetPerPage, newMinScale);
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }
}
