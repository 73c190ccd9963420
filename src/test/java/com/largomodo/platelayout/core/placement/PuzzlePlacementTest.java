package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.LayoutFixtures;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.Size;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PuzzlePlacementTest {

    private final PuzzlePlacement strategy = new PuzzlePlacement();

    @Test
    void testLargestImageIsPlacedFirst() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).build();
        List<ImageItem> images = List.of(ImageItem.of("small.jpg", 100, 100), ImageItem.of("big.jpg", 500, 500));

        Placement placement = strategy.place(images, config, 1.0, CaptionMetrics.NONE);

        PlacedImage first = placement.firstPage().get(0);
        assertEquals("big.jpg", first.item().name(), "Largest footprint goes first");
        assertEquals(0, first.x());
        assertEquals(0, first.y());
    }

    @Test
    void testSpacingSeparatesNeighbours() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).build();
        Placement placement = strategy.place(LayoutFixtures.squares(2, 400), config, 1.0, CaptionMetrics.NONE);

        PlacedImage second = placement.firstPage().get(1);
        assertEquals(410, second.x(), "Second image keeps the 10px gap to the first");
        assertEquals(0, second.y(), "Ties between free areas go to the topmost");
    }

    @Test
    void testOverflowOpensNewPage() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).spacing(0).build();
        Placement placement = strategy.place(LayoutFixtures.squares(2, 600), config, 1.0, CaptionMetrics.NONE);

        assertEquals(2, placement.pages().size());
        assertEquals(1, placement.pages().get(1).get(0).pageIndex());
    }

    @Test
    void testImageLargerThanPageIsShrunk() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).build();
        Placement placement = strategy.place(List.of(ImageItem.of("huge.jpg", 4000, 2000)), config, 1.0,
                CaptionMetrics.NONE);

        PlacedImage image = placement.firstPage().get(0);
        assertTrue(image.fitted());
        assertTrue(image.width() <= 1000 && image.height() <= 1000);
    }

    @Test
    void testImageCenteredOverWiderCaption() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).build();
        CaptionMetrics captions = item -> new Size(300, 40);
        Placement placement = strategy.place(LayoutFixtures.squares(1, 100), config, 1.0, captions);

        PlacedImage image = placement.firstPage().get(0);
        assertEquals(100, image.x(), "Image is centered in a footprint as wide as its caption");
    }

    @Test
    void testEmptyInput() {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).build();
        assertTrue(strategy.place(List.of(), config, 1.0, CaptionMetrics.NONE).pages().isEmpty());
    }

    @Provide
    Arbitrary<List<ImageItem>> batches() {
        Arbitrary<ImageItem> item = Combinators.combine(
                        Arbitraries.integers().between(1, 1500),
                        Arbitraries.integers().between(1, 1500))
                .as((w, h) -> ImageItem.of("img_" + w + "x" + h, w, h));
        return item.list().ofMaxSize(30);
    }

    @Property(tries = 200)
    void testNoOverlapAndSpacing(@ForAll("batches") List<ImageItem> images,
                                 @ForAll @IntRange(min = 0, max = 30) int spacing) {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.PUZZLE).spacing(spacing).build();
        Placement placement = strategy.place(images, config, 1.0, CaptionMetrics.NONE);
        Rect content = new Rect(0, 0, config.contentWidth(), config.contentHeight());

        int total = 0;
        for (List<PlacedImage> page : placement.pages()) {
            assertFalse(page.isEmpty(), "Pages are never empty");
            for (int i = 0; i < page.size(); i++) {
                PlacedImage a = page.get(i);
                assertTrue(content.contains(a.bounds()), a + " escapes the content box");
                Rect padded = new Rect(a.x(), a.y(), a.width() + spacing, a.height() + spacing);
                for (int j = i + 1; j < page.size(); j++) {
                    PlacedImage b = page.get(j);
                    Rect other = new Rect(b.x(), b.y(), b.width() + spacing, b.height() + spacing);
                    assertFalse(padded.intersects(other), a + " and " + b + " are closer than the spacing");
                }
            }
            total += page.size();
        }
        assertEquals(images.size(), total, "Every image is placed exactly once");
    }
}
