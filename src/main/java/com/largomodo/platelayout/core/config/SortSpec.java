package com.largomodo.platelayout.core.config;

/**
 * Primary and secondary sort. The secondary key only reorders ties of the primary one.
 *
 * @param primary   first key
 * @param secondary tie breaker, {@link SortCriterion#NONE} when unused
 * @param seed      seed for random keys, {@code null} for a fresh shuffle on every call
 */
public record SortSpec(SortCriterion primary, SortCriterion secondary, Long seed) {

    public SortSpec {
        primary = primary == null ? SortCriterion.NONE : primary;
        secondary = secondary == null ? SortCriterion.NONE : secondary;
    }

    public static SortSpec alphabetical() {
        return new SortSpec(new SortCriterion(SortCriterion.Key.ALPHABETICAL, null, SortOrder.ASCENDING),
                SortCriterion.NONE, null);
    }

    public static SortSpec by(SortCriterion primary) {
        return new SortSpec(primary, SortCriterion.NONE, null);
    }

    public SortSpec withSeed(Long newSeed) {
        return new SortSpec(primary, secondary, newSeed);
    }
}
