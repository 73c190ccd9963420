package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.domain.FailureKind;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.scale.RenderSizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed rows x columns, filled row-major.
 * <p>
 * Each image is centered in its cell, together with its caption block, and shrunk to the cell
 * when the requested scale would overflow it. A row with fewer images than columns is centered
 * horizontally. A page closes after rows x columns images.
 */
public class GridPlacement implements PlacementStrategy {

    private static final Logger log = LoggerFactory.getLogger(GridPlacement.class);

    @Override
    public Placement place(List<ImageItem> images, LayoutConfig config, double scale, CaptionMetrics captions) {
        int cols = config.gridCols();
        int perPage = config.gridRows() * cols;
        int spacing = config.spacing();
        int cellW = config.gridCellWidth();
        int cellH = config.gridCellHeight();

        List<ImageFailure> rejected = new ArrayList<>();
        List<ImageItem> placeable = new ArrayList<>();
        for (ImageItem item : images) {
            if (cellH - captions.reserve(item).height() < 1) {
                rejected.add(new ImageFailure(item.id(), FailureKind.OVERSIZED_IMAGE,
                        "Caption of " + item.name() + " does not fit a " + cellW + "x" + cellH + " grid cell"));
            } else {
                placeable.add(item);
            }
        }

        List<List<PlacedImage>> pages = new ArrayList<>();
        for (int start = 0; start < placeable.size(); start += perPage) {
            int pageIndex = pages.size();
            List<ImageItem> pageItems = placeable.subList(start, Math.min(start + perPage, placeable.size()));
            List<PlacedImage> page = new ArrayList<>(pageItems.size());

            for (int slot = 0; slot < pageItems.size(); slot++) {
                int row = slot / cols;
                int col = slot % cols;
                int inRow = Math.min(cols, pageItems.size() - row * cols);
                int rowOffset = (cols - inRow) * (cellW + spacing) / 2;
                int cellX = rowOffset + col * (cellW + spacing);
                int cellY = row * (cellH + spacing);

                ImageItem item = pageItems.get(slot);
                int captionH = captions.reserve(item).height();
                Size requested = RenderSizer.render(item, scale);
                Size size = RenderSizer.fitWithin(requested, cellW, cellH - captionH);

                int x = cellX + (cellW - size.width()) / 2;
                int y = cellY + (cellH - size.height() - captionH) / 2;
                page.add(new PlacedImage(item, x, y, size.width(), size.height(), pageIndex,
                        !size.equals(requested)));
                log.debug("Grid: {} -> page {} cell ({},{}) at {},{} size {}x{}",
                        item.name(), pageIndex, row, col, x, y, size.width(), size.height());
            }
            pages.add(page);
        }
        return new Placement(pages, rejected);
    }
}
