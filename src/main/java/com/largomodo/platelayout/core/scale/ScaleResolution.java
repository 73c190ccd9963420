package com.largomodo.platelayout.core.scale;

/**
 * Outcome of scale resolution.
 *
 * @param factor   scale every image is rendered at
 * @param auto     true when the factor came from a search
 * @param target   requested images on page 0, 0 for a fixed scale
 * @param achieved images page 0 actually holds at {@code factor}, 0 for a fixed scale
 * @param feasible false when an automatic search could not reach the target
 */
public record ScaleResolution(double factor, boolean auto, int target, int achieved, boolean feasible) {

    public ScaleResolution {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Scale factor must be positive: " + factor);
        }
    }

    public static ScaleResolution fixed(double factor) {
        return new ScaleResolution(factor, false, 0, 0, true);
    }
}
