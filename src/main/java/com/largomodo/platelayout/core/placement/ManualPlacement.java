package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.ManualPosition;
import com.largomodo.platelayout.core.domain.FailureKind;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.scale.RenderSizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Passes caller supplied positions through.
 * <p>
 * Positions are not checked against the page bounds or each other. An image without a
 * position is rejected. Pages between the used indices are emitted empty so page indices
 * stay contiguous.
 */
public class ManualPlacement implements PlacementStrategy {

    @Override
    public Placement place(List<ImageItem> images, LayoutConfig config, double scale, CaptionMetrics captions) {
        Map<String, ManualPosition> positions = config.manualPositions();
        List<ImageFailure> rejected = new ArrayList<>();
        TreeMap<Integer, List<PlacedImage>> byPage = new TreeMap<>();

        for (ImageItem item : images) {
            ManualPosition position = positions.get(item.id());
            if (position == null) {
                rejected.add(new ImageFailure(item.id(), FailureKind.MISSING_POSITION,
                        "No manual position for " + item.name()));
                continue;
            }
            Size size = position.hasSize()
                    ? new Size(position.width(), position.height())
                    : RenderSizer.render(item, scale);
            byPage.computeIfAbsent(position.page(), p -> new ArrayList<>())
                    .add(new PlacedImage(item, position.x(), position.y(), size.width(), size.height(),
                            position.page(), false));
        }

        List<List<PlacedImage>> pages = new ArrayList<>();
        if (!byPage.isEmpty()) {
            for (int i = 0; i <= byPage.lastKey(); i++) {
                pages.add(byPage.getOrDefault(i, List.of()));
            }
        }
        return new Placement(pages, rejected);
    }
}
