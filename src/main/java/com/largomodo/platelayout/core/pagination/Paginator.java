package com.largomodo.platelayout.core.pagination;

import com.largomodo.platelayout.core.config.BreakKind;
import com.largomodo.platelayout.core.config.BreakSpec;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.SortCriterion;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.overlay.Divider;
import com.largomodo.platelayout.core.domain.overlay.Overlay;
import com.largomodo.platelayout.core.placement.CaptionMetrics;
import com.largomodo.platelayout.core.placement.Placement;
import com.largomodo.platelayout.core.placement.PlacementStrategy;
import com.largomodo.platelayout.core.sort.SortEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a placement strategy and applies the break-on-primary-change policy on top of it.
 * <p>
 * Images are expected in sorted order. Consecutive images with the same value of the primary
 * sort field form a group; images without the field form a group of their own. With
 * {@link BreakKind#NEW_PAGE} every group is placed separately, so each group starts on a fresh
 * page even if the previous page had room left. With {@link BreakKind#DIVIDER} placement is not
 * interrupted and dividers are drawn in the spacing gaps that separate two groups: between grid
 * cells, or between stacked images of a masonry column. Puzzle pages have no such gaps, since
 * images are packed largest first, and get no dividers. A divider that would cross an image is
 * dropped.
 */
public class Paginator {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    public Pagination paginate(List<ImageItem> images, LayoutConfig config, double scale,
                               CaptionMetrics captions, PlacementStrategy strategy) {
        return paginate(images, config, scale, captions, strategy, false);
    }

    /**
     * Same as {@link #paginate} but stops after page 0. With page breaks only the first group is
     * placed at all.
     */
    public Pagination paginateFirstPage(List<ImageItem> images, LayoutConfig config, double scale,
                                        CaptionMetrics captions, PlacementStrategy strategy) {
        Pagination full = paginate(images, config, scale, captions, strategy, true);
        if (full.pages().size() <= 1) {
            return full;
        }
        return new Pagination(full.pages().subList(0, 1), full.rejected());
    }

    private Pagination paginate(List<ImageItem> images, LayoutConfig config, double scale,
                                CaptionMetrics captions, PlacementStrategy strategy, boolean firstOnly) {
        if (!config.breaksOnPrimaryChange()) {
            return toPagination(strategy.place(images, config, scale, captions));
        }
        SortCriterion primary = config.sort().primary();
        BreakSpec breakSpec = config.pageBreak();

        if (breakSpec.kind() == BreakKind.DIVIDER) {
            Pagination placed = toPagination(strategy.place(images, config, scale, captions));
            List<Page> pages = new ArrayList<>(placed.pages().size());
            for (Page page : placed.pages()) {
                pages.add(page.withOverlays(dividers(page, primary, config)));
            }
            return new Pagination(pages, placed.rejected());
        }

        List<List<ImageItem>> groups = groups(images, primary);
        log.debug("Breaking {} images into {} groups on field '{}'", images.size(), groups.size(), primary.field());

        List<Page> pages = new ArrayList<>();
        List<ImageFailure> rejected = new ArrayList<>();
        for (List<ImageItem> group : groups) {
            Placement placement = strategy.place(group, config, scale, captions);
            rejected.addAll(placement.rejected());
            for (List<PlacedImage> placed : placement.pages()) {
                pages.add(new Page(0, placed, List.of()).withIndex(pages.size()));
            }
            if (firstOnly && !pages.isEmpty()) {
                break;
            }
        }
        return new Pagination(pages, rejected);
    }

    /**
     * Splits {@code images} into runs of equal primary field values, keeping order.
     */
    public static List<List<ImageItem>> groups(List<ImageItem> images, SortCriterion primary) {
        List<List<ImageItem>> groups = new ArrayList<>();
        List<ImageItem> current = new ArrayList<>();
        String currentKey = null;
        for (ImageItem item : images) {
            String key = SortEngine.groupKey(item, primary);
            if (!current.isEmpty() && !Objects.equals(key, currentKey)) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(item);
            currentKey = key;
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private List<Overlay> dividers(Page page, SortCriterion primary, LayoutConfig config) {
        List<Divider> candidates = switch (config.mode()) {
            case GRID -> gridDividers(page.images(), primary, config);
            case MASONRY -> masonryDividers(page.images(), primary, config);
            default -> {
                log.debug("No divider positions in {} mode, page {} left without dividers",
                        config.mode(), page.index() + 1);
                yield List.of();
            }
        };
        List<Overlay> overlays = new ArrayList<>(page.overlays());
        for (Divider divider : candidates) {
            Rect bounds = new Rect(divider.x(), divider.y(), divider.width(), divider.height());
            if (page.images().stream().anyMatch(image -> image.bounds().intersects(bounds))) {
                log.debug("Dropping divider {} on page {}: it would cross an image", divider, page.index() + 1);
                continue;
            }
            overlays.add(divider);
        }
        return overlays;
    }

    /**
     * Dividers in the gaps between grid cells. A group starting a row gets one rule across the
     * row gap above it. A group starting mid-row gets a rule in the column gap before it and,
     * when the page has a next row, a rule in the row gap under the cells to its left.
     */
    private List<Divider> gridDividers(List<PlacedImage> images, SortCriterion primary, LayoutConfig config) {
        int cols = config.gridCols();
        int spacing = config.spacing();
        int cellW = config.gridCellWidth();
        int cellH = config.gridCellHeight();
        int thickness = config.pageBreak().dividerThickness();
        int contentW = config.contentWidth();
        int count = images.size();

        List<Divider> dividers = new ArrayList<>();
        for (int slot = 1; slot < count; slot++) {
            if (sameGroup(images.get(slot - 1), images.get(slot), primary)) {
                continue;
            }
            int row = slot / cols;
            int col = slot % cols;
            if (col == 0) {
                int length = config.pageBreak().dividerWidth() > 0
                        ? Math.min(config.pageBreak().dividerWidth(), contentW)
                        : contentW;
                dividers.add(new Divider((contentW - length) / 2, gapStart(row, cellH, spacing, thickness),
                        length, thickness));
                continue;
            }
            int cellX = cellX(row, col, count, cols, cellW, spacing);
            dividers.add(new Divider(Math.max(0, cellX - spacing / 2 - thickness / 2), row * (cellH + spacing),
                    thickness, cellH));

            int nextRowFirst = (row + 1) * cols;
            if (nextRowFirst < count) {
                int left = cellX(row, 0, count, cols, cellW, spacing);
                int right = cellX - spacing;
                int nextLeft = cellX(row + 1, 0, count, cols, cellW, spacing);
                int nextRight = cellX(row + 1, Math.min(cols, count - nextRowFirst) - 1, count, cols, cellW, spacing)
                        + cellW;
                int from = Math.max(left, nextLeft);
                int to = Math.min(right, nextRight);
                if (to > from) {
                    dividers.add(new Divider(from, gapStart(row + 1, cellH, spacing, thickness), to - from, thickness));
                }
            }
        }
        return dividers;
    }

    private static int cellX(int row, int col, int count, int cols, int cellW, int spacing) {
        int inRow = Math.min(cols, count - row * cols);
        int rowOffset = (cols - inRow) * (cellW + spacing) / 2;
        return rowOffset + col * (cellW + spacing);
    }

    private static int gapStart(int row, int cellH, int spacing, int thickness) {
        return Math.max(0, row * (cellH + spacing) - spacing / 2 - thickness / 2);
    }

    /**
     * Dividers across a column, in the gap between two stacked images of different groups.
     */
    private List<Divider> masonryDividers(List<PlacedImage> images, SortCriterion primary, LayoutConfig config) {
        int columns = config.masonryColumns();
        int spacing = config.spacing();
        int columnW = config.masonryColumnWidth();
        int thickness = config.pageBreak().dividerThickness();

        PlacedImage[] lastInColumn = new PlacedImage[columns];
        List<Divider> dividers = new ArrayList<>();
        for (PlacedImage image : images) {
            int column = Math.min(columns - 1, image.x() / (columnW + spacing));
            PlacedImage above = lastInColumn[column];
            if (above != null && !sameGroup(above, image, primary)) {
                int y = Math.max(0, image.y() - spacing / 2 - thickness / 2);
                dividers.add(new Divider(column * (columnW + spacing), y, columnW, thickness));
            }
            lastInColumn[column] = image;
        }
        return dividers;
    }

    private static boolean sameGroup(PlacedImage a, PlacedImage b, SortCriterion primary) {
        return Objects.equals(SortEngine.groupKey(a.item(), primary), SortEngine.groupKey(b.item(), primary));
    }

    private static Pagination toPagination(Placement placement) {
        List<Page> pages = new ArrayList<>(placement.pages().size());
        for (List<PlacedImage> images : placement.pages()) {
            pages.add(new Page(0, images, List.of()).withIndex(pages.size()));
        }
        return new Pagination(pages, placement.rejected());
    }
}
