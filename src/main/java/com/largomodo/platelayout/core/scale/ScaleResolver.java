package com.largomodo.platelayout.core.scale;

import com.largomodo.platelayout.core.config.ScaleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Picks the scale factor for a request.
 * <p>
 * A fixed spec is returned as is. An automatic spec is resolved by bisection over
 * {@code [minScale, upperBound]} for the largest scale at which page 0 still holds the target
 * number of images without shrinking any of them. The target is first capped at what page 0
 * can hold at the minimum scale; when that cap is below the requested target the result is
 * flagged infeasible and the nearest reachable count is used instead.
 * <p>
 * The resolver holds no state between calls. Every candidate is evaluated through the
 * supplied {@link FirstPageProbe}, which must run a fresh simulation.
 */
public class ScaleResolver {

    private static final Logger log = LoggerFactory.getLogger(ScaleResolver.class);

    static final int MAX_ITERATIONS = 40;
    static final double RELATIVE_TOLERANCE = 1e-4;

    public ScaleResolution resolve(ScaleSpec spec, double upperBound, FirstPageProbe probe) {
        if (!spec.isAuto()) {
            return ScaleResolution.fixed(spec.factor());
        }

        int target = spec.targetPerPage();
        double lo = spec.minScale();
        double hi = Math.max(lo, upperBound);

        FirstPageProbe.Result atMin = probe.probe(lo);
        int reachable = Math.min(target, atMin.placed());

        double best;
        if (reachable == 0 || !accepts(atMin, reachable)) {
            best = lo;
        } else if (accepts(probe.probe(hi), reachable)) {
            best = hi;
        } else {
            // lo always accepted, hi never
            for (int i = 0; i < MAX_ITERATIONS && (hi - lo) > lo * RELATIVE_TOLERANCE; i++) {
                double mid = (lo + hi) / 2;
                if (accepts(probe.probe(mid), reachable)) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            best = lo;
        }

        int achieved = probe.probe(best).placed();
        boolean feasible = achieved == target;
        if (feasible) {
            log.info("Auto scale resolved to {} for {} images per page", format(best), target);
        } else {
            log.warn("Cannot fit {} images on the first page; using scale {} which places {}",
                    target, format(best), achieved);
        }
        return new ScaleResolution(best, true, target, achieved, feasible);
    }

    private static boolean accepts(FirstPageProbe.Result result, int wanted) {
        return result.placed() >= wanted && result.uniform();
    }

    private static String format(double scale) {
        return String.format(Locale.ROOT, "%.4f", scale);
    }
}
