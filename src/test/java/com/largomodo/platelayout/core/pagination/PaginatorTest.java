package com.largomodo.platelayout.core.pagination;

import com.largomodo.platelayout.core.LayoutFixtures;
import com.largomodo.platelayout.core.config.BreakSpec;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.config.SortCriterion;
import com.largomodo.platelayout.core.config.SortOrder;
import com.largomodo.platelayout.core.config.SortSpec;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.overlay.Divider;
import com.largomodo.platelayout.core.domain.overlay.Overlay;
import com.largomodo.platelayout.core.placement.CaptionMetrics;
import com.largomodo.platelayout.core.placement.GridPlacement;
import com.largomodo.platelayout.core.placement.MasonryPlacement;
import com.largomodo.platelayout.core.placement.PlacementStrategy;
import com.largomodo.platelayout.core.placement.PuzzlePlacement;
import com.largomodo.platelayout.core.sort.SortEngine;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PaginatorTest {

    private static final SortSpec BY_PERIOD = SortSpec.by(SortCriterion.field("Period", SortOrder.ASCENDING));

    private final Paginator paginator = new Paginator();
    private final PlacementStrategy grid = new GridPlacement();

    @Test
    void testNewPageOnEveryGroupChange() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.newPage())
                .build();
        List<ImageItem> images = periods("A", "A", "B", "B", "A");

        Pagination pagination = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, grid);

        assertEquals(3, pagination.pages().size(), "Each run of equal values starts a new page");
        assertEquals(List.of(2, 2, 1), pagination.pages().stream().map(Page::imageCount).toList());
        for (Page page : pagination.pages()) {
            assertTrue(page.images().stream().allMatch(i -> i.pageIndex() == page.index()),
                    "Image page indices follow their page");
        }
        assertEquals(2, pagination.pages().get(2).index());
    }

    @Test
    void testLargeGroupSpillsOverBeforeBreaking() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(1, 2)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.newPage())
                .build();

        Pagination pagination = paginator.paginate(periods("A", "A", "A", "B"), config, 1.0,
                CaptionMetrics.NONE, grid);

        assertEquals(List.of(2, 1, 1), pagination.pages().stream().map(Page::imageCount).toList());
    }

    @Test
    void testMissingValuesFormTheirOwnGroup() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.newPage())
                .build();
        List<ImageItem> images = List.of(
                LayoutFixtures.withField("a.jpg", "Period", "A"),
                ImageItem.of("b.jpg", 100, 100),
                ImageItem.of("c.jpg", 100, 100));

        Pagination pagination = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, grid);
        assertEquals(List.of(1, 2), pagination.pages().stream().map(Page::imageCount).toList());
    }

    @Test
    void testBreaksIgnoredWithoutFieldSort() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .pageBreak(BreakSpec.newPage())
                .build();

        Pagination pagination = paginator.paginate(periods("A", "B", "C"), config, 1.0, CaptionMetrics.NONE, grid);
        assertEquals(1, pagination.pages().size(), "Name sorts have no groups to break on");
    }

    @Test
    void testVerticalDividerInColumnGap() {
        // cells 326 x 1000 at x = 0, 336, 672; the gap before the third cell is 662..672
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(1, 3)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();

        Pagination pagination = paginator.paginate(periods("A", "A", "B"), config, 1.0, CaptionMetrics.NONE, grid);

        Page page = pagination.firstPage();
        assertEquals(3, page.imageCount(), "Dividers never interrupt placement");
        assertEquals(List.of(new Divider(666, 0, 2, 1000)), page.overlays(), "Centered in the gap, full cell height");
    }

    @Test
    void testHorizontalDividerInRowGap() {
        // cells 1000 x 495, the row gap is 495..505
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(2, 1)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();

        Page page = paginator.paginate(periods("A", "B"), config, 1.0, CaptionMetrics.NONE, grid).firstPage();
        assertEquals(List.of(new Divider(0, 499, 1000, 2)), page.overlays(), "Full width by default");

        LayoutConfig narrow = config.toBuilder().pageBreak(BreakSpec.divider(2, 400)).build();
        Page centered = paginator.paginate(periods("A", "B"), narrow, 1.0, CaptionMetrics.NONE, grid).firstPage();
        assertEquals(List.of(new Divider(300, 499, 400, 2)), centered.overlays(), "Fixed width is centered");
    }

    @Test
    void testRowDividerStaysClearOfTallNeighbour() {
        // 2x2 cells 495 x 495; the small a2 is centered in its cell, b2 fills most of its own
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(2, 2)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();
        List<ImageItem> images = List.of(
                ImageItem.of("a1.jpg", 400, 450, Map.of("Period", "A")),
                ImageItem.of("a2.jpg", 50, 50, Map.of("Period", "A")),
                ImageItem.of("b1.jpg", 50, 50, Map.of("Period", "B")),
                ImageItem.of("b2.jpg", 400, 450, Map.of("Period", "B")));

        Page page = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, grid).firstPage();

        assertEquals(List.of(new Divider(0, 499, 1000, 2)), page.overlays());
        assertNoDividerCrossesAnImage(page);
    }

    @Test
    void testGroupChangeMidRowStepsAroundCells() {
        // 2x3 cells 326 x 495; the short second row is shifted right by 168
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(2, 3)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();

        Page page = paginator.paginate(periods("A", "A", "B", "B", "B"), config, 1.0, CaptionMetrics.NONE, grid)
                .firstPage();

        assertEquals(List.of(
                        new Divider(666, 0, 2, 495),
                        new Divider(168, 499, 494, 2)),
                page.overlays(),
                "Column gap before the new group, then the row gap under the old group's cells");
        assertNoDividerCrossesAnImage(page);
    }

    @Test
    void testMasonryDividerBetweenStackedImages() {
        // two 495 wide columns; b1 lands under the short a1, not under the tall a2
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.MASONRY)
                .masonryColumns(2)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();
        List<ImageItem> images = List.of(
                ImageItem.of("a1.jpg", 400, 200, Map.of("Period", "A")),
                ImageItem.of("a2.jpg", 100, 1000, Map.of("Period", "A")),
                ImageItem.of("b1.jpg", 400, 200, Map.of("Period", "B")));

        Page page = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, new MasonryPlacement()).firstPage();

        PlacedImage b1 = page.images().get(2);
        assertEquals(0, b1.x(), "b1 goes to the left column");
        assertEquals(List.of(new Divider(0, b1.y() - 6, 495, 2)), page.overlays(),
                "One column-wide rule in the gap above b1");
        assertNoDividerCrossesAnImage(page);
    }

    @Test
    void testPuzzlePagesHaveNoDividers() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();

        Page page = paginator.paginate(periods("A", "A", "B"), config, 1.0, CaptionMetrics.NONE,
                new PuzzlePlacement()).firstPage();

        assertEquals(3, page.imageCount());
        assertTrue(page.overlays().isEmpty(), "Largest-first packing leaves no gap that separates groups");
    }

    @Test
    void testThickDividerThatWouldTouchImagesIsDropped() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .grid(1, 2)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(40, 0))
                .build();
        List<ImageItem> images = List.of(
                ImageItem.of("a.jpg", 495, 1000, Map.of("Period", "A")),
                ImageItem.of("b.jpg", 495, 1000, Map.of("Period", "B")));

        Page page = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, grid).firstPage();

        assertTrue(page.overlays().isEmpty(), "A 40px rule does not fit a 10px gap between full cells");
    }

    @Provide
    Arbitrary<List<ImageItem>> groupedBatches() {
        Arbitrary<ImageItem> item = Combinators.combine(
                        Arbitraries.integers().between(1, 1500),
                        Arbitraries.integers().between(1, 1500),
                        Arbitraries.of("A", "B", "C", "D"))
                .as((w, h, period) -> ImageItem.of("img_" + w + "x" + h, w, h, Map.of("Period", period)));
        return item.list().ofMaxSize(30)
                .map(list -> new SortEngine().sort(list, BY_PERIOD));
    }

    @Property(tries = 200)
    void testDividersNeverCrossImages(@ForAll("groupedBatches") List<ImageItem> images,
                                      @ForAll @IntRange(min = 1, max = 4) int rows,
                                      @ForAll @IntRange(min = 1, max = 4) int cols,
                                      @ForAll boolean masonry) {
        LayoutConfig config = LayoutFixtures.bare(masonry ? LayoutMode.MASONRY : LayoutMode.GRID)
                .grid(rows, cols)
                .masonryColumns(cols)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();
        PlacementStrategy strategy = masonry ? new MasonryPlacement() : grid;

        Pagination pagination = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, strategy);

        Rect content = new Rect(0, 0, config.contentWidth(), config.contentHeight());
        for (Page page : pagination.pages()) {
            assertNoDividerCrossesAnImage(page);
            for (Overlay overlay : page.overlays()) {
                Divider d = (Divider) overlay;
                assertTrue(content.contains(new Rect(d.x(), d.y(), d.width(), d.height())), d + " escapes the content box");
            }
        }
    }

    private static void assertNoDividerCrossesAnImage(Page page) {
        for (Overlay overlay : page.overlays()) {
            if (!(overlay instanceof Divider)) {
                continue;
            }
            Divider d = (Divider) overlay;
            Rect rule = new Rect(d.x(), d.y(), d.width(), d.height());
            for (PlacedImage image : page.images()) {
                assertFalse(image.bounds().intersects(rule), d + " crosses " + image.item().name());
            }
        }
    }

    @Test
    void testNoDividerWithinGroup() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.divider(2, 0))
                .build();

        Page page = paginator.paginate(periods("A", "A", "A"), config, 1.0, CaptionMetrics.NONE, grid).firstPage();
        assertTrue(page.overlays().isEmpty());
    }

    @Test
    void testFirstPageOnlyPlacesFirstGroup() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .sort(BY_PERIOD)
                .pageBreak(BreakSpec.newPage())
                .build();
        List<ImageItem> images = periods("A", "A", "B", "B", "A");

        Pagination first = paginator.paginateFirstPage(images, config, 1.0, CaptionMetrics.NONE, grid);
        Pagination full = paginator.paginate(images, config, 1.0, CaptionMetrics.NONE, grid);

        assertEquals(1, first.pages().size());
        assertEquals(full.pages().get(0), first.firstPage(), "Preview page equals the first generated page");
    }

    @Test
    void testEmptyInputHasEmptyFirstPage() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID).build();
        Pagination pagination = paginator.paginateFirstPage(List.of(), config, 1.0, CaptionMetrics.NONE, grid);
        assertTrue(pagination.pages().isEmpty());
        assertEquals(Page.empty(0), pagination.firstPage());
    }

    @Test
    void testGroups() {
        List<List<ImageItem>> groups = Paginator.groups(periods("A", "A", "B", "A"), BY_PERIOD.primary());
        assertEquals(List.of(2, 1, 1), groups.stream().map(List::size).toList());
    }

    private static List<ImageItem> periods(String... values) {
        ImageItem[] items = new ImageItem[values.length];
        for (int i = 0; i < values.length; i++) {
            items[i] = LayoutFixtures.withField(String.format("img%02d.jpg", i), "Period", values[i]);
        }
        return List.of(items);
    }
}
