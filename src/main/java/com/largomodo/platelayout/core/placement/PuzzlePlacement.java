package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.domain.FailureKind;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.scale.RenderSizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rectangle packing, best-area-fit over maximal free rectangles, no rotation.
 * <p>
 * Every image occupies a footprint made of the image plus its caption block, as wide as the
 * wider of the two. Footprints are packed largest area first (stable for equal areas) into
 * the current page; the first one that does not fit closes the page and opens the next.
 * Spacing is enforced by packing footprints grown by {@code spacing} on the right and bottom
 * into a bin grown by the same amount, so neighbors keep the gap and the last row and column
 * still reach the content edge.
 */
public class PuzzlePlacement implements PlacementStrategy {

    private static final Logger log = LoggerFactory.getLogger(PuzzlePlacement.class);

    @Override
    public Placement place(List<ImageItem> images, LayoutConfig config, double scale, CaptionMetrics captions) {
        int contentW = config.contentWidth();
        int contentH = config.contentHeight();
        int spacing = config.spacing();

        List<ImageFailure> rejected = new ArrayList<>();
        List<Footprint> footprints = new ArrayList<>();
        for (ImageItem item : images) {
            Size caption = captions.reserve(item);
            int maxImageH = contentH - caption.height();
            if (maxImageH < 1) {
                rejected.add(new ImageFailure(item.id(), FailureKind.OVERSIZED_IMAGE,
                        "Caption of " + item.name() + " is taller than the page content area"));
                continue;
            }
            Size requested = RenderSizer.render(item, scale);
            Size size = RenderSizer.fitWithin(requested, contentW, maxImageH);
            int width = Math.min(contentW, Math.max(size.width(), caption.width()));
            footprints.add(new Footprint(item, size, !size.equals(requested), width, size.height() + caption.height()));
        }

        List<Footprint> ordered = new ArrayList<>(footprints);
        ordered.sort(Comparator.comparingLong(Footprint::area).reversed());

        List<List<PlacedImage>> pages = new ArrayList<>();
        List<PlacedImage> current = new ArrayList<>();
        FreeRectangles space = new FreeRectangles(contentW + spacing, contentH + spacing);

        for (Footprint fp : ordered) {
            Rect slot = space.find(fp.width() + spacing, fp.height() + spacing);
            if (slot == null && !current.isEmpty()) {
                pages.add(current);
                current = new ArrayList<>();
                space = new FreeRectangles(contentW + spacing, contentH + spacing);
                slot = space.find(fp.width() + spacing, fp.height() + spacing);
            }
            if (slot == null) {
                // footprint is clamped to the content box, so an empty page always fits it
                throw new IllegalStateException("Footprint of " + fp.item().name() + " does not fit an empty page");
            }
            space.occupy(slot);

            int x = slot.x() + (fp.width() - fp.size().width()) / 2;
            current.add(new PlacedImage(fp.item(), x, slot.y(), fp.size().width(), fp.size().height(),
                    pages.size(), fp.fitted()));
            log.debug("Puzzle: {} -> page {} at {},{} size {}x{}", fp.item().name(), pages.size(), x, slot.y(),
                    fp.size().width(), fp.size().height());
        }
        if (!current.isEmpty()) {
            pages.add(current);
        }
        return new Placement(pages, rejected);
    }

    private record Footprint(ImageItem item, Size size, boolean fitted, int width, int height) {
        long area() {
            return (long) width * height;
        }
    }
}
