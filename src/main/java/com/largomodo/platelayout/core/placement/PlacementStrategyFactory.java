package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.config.LayoutMode;

/**
 * Maps a layout mode to its placement strategy. Strategies are stateless and shared.
 */
public class PlacementStrategyFactory {

    private final PlacementStrategy grid = new GridPlacement();
    private final PlacementStrategy puzzle = new PuzzlePlacement();
    private final PlacementStrategy masonry = new MasonryPlacement();
    private final PlacementStrategy manual = new ManualPlacement();

    public PlacementStrategy get(LayoutMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Layout mode cannot be null");
        }
        return switch (mode) {
            case GRID -> grid;
            case PUZZLE -> puzzle;
            case MASONRY -> masonry;
            case MANUAL -> manual;
        };
    }
}
