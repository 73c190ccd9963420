package com.largomodo.platelayout.core.scale;

/**
 * Dry-run placement used by the scale search. Each call must be an independent simulation.
 */
@FunctionalInterface
public interface FirstPageProbe {

    Result probe(double scale);

    /**
     * @param placed  images that landed on page 0
     * @param uniform true when none of those images had to be shrunk below the probed scale
     */
    record Result(int placed, boolean uniform) {
    }
}
