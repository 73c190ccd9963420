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
import java.util.Arrays;
import java.util.List;

/**
 * Equal-width columns, each image appended to the shortest one.
 * <p>
 * Images are scaled to the column width whatever the requested scale, so the scale only
 * matters when an image would be taller than the page; such an image is shrunk and centered
 * in its column. Ties between equally short columns go to the leftmost. When the next
 * footprint does not fit below the shortest column, no column can take it and the page
 * closes.
 */
public class MasonryPlacement implements PlacementStrategy {

    private static final Logger log = LoggerFactory.getLogger(MasonryPlacement.class);

    @Override
    public Placement place(List<ImageItem> images, LayoutConfig config, double scale, CaptionMetrics captions) {
        int columns = config.masonryColumns();
        int spacing = config.spacing();
        int columnW = config.masonryColumnWidth();
        int contentH = config.contentHeight();

        List<ImageFailure> rejected = new ArrayList<>();
        List<List<PlacedImage>> pages = new ArrayList<>();
        List<PlacedImage> current = new ArrayList<>();
        int[] heights = new int[columns];

        for (ImageItem item : images) {
            int captionH = captions.reserve(item).height();
            int maxImageH = contentH - captionH;
            if (maxImageH < 1) {
                rejected.add(new ImageFailure(item.id(), FailureKind.OVERSIZED_IMAGE,
                        "Caption of " + item.name() + " is taller than the page content area"));
                continue;
            }
            Size requested = RenderSizer.toWidth(item, columnW);
            Size size = RenderSizer.fitWithin(requested, columnW, maxImageH);
            int footprint = size.height() + captionH;

            int column = shortest(heights);
            int top = heights[column] == 0 ? 0 : heights[column] + spacing;
            if (top + footprint > contentH && !current.isEmpty()) {
                pages.add(current);
                current = new ArrayList<>();
                Arrays.fill(heights, 0);
                column = 0;
                top = 0;
            }

            int x = column * (columnW + spacing) + (columnW - size.width()) / 2;
            current.add(new PlacedImage(item, x, top, size.width(), size.height(), pages.size(),
                    !size.equals(requested)));
            heights[column] = top + footprint;
            log.debug("Masonry: {} -> page {} column {} at {},{} size {}x{}",
                    item.name(), pages.size(), column, x, top, size.width(), size.height());
        }
        if (!current.isEmpty()) {
            pages.add(current);
        }
        return new Placement(pages, rejected);
    }

    private static int shortest(int[] heights) {
        int best = 0;
        for (int i = 1; i < heights.length; i++) {
            if (heights[i] < heights[best]) {
                best = i;
            }
        }
        return best;
    }
}
