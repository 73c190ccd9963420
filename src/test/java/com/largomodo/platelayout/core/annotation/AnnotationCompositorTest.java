package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.LayoutFixtures;
import com.largomodo.platelayout.core.config.CaptionSpec;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.config.NumberPosition;
import com.largomodo.platelayout.core.config.NumberingScope;
import com.largomodo.platelayout.core.config.NumberingSpec;
import com.largomodo.platelayout.core.config.ScaleBarSpec;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.domain.overlay.Caption;
import com.largomodo.platelayout.core.domain.overlay.Divider;
import com.largomodo.platelayout.core.domain.overlay.MarginBorder;
import com.largomodo.platelayout.core.domain.overlay.Overlay;
import com.largomodo.platelayout.core.domain.overlay.ScaleBar;
import com.largomodo.platelayout.core.domain.overlay.SequenceNumber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationCompositorTest {

    // 10px per character, 20px per line
    private static final TextMeasurer FIXED = (text, fontSize) -> new Size(text.length() * 10, 20);

    private AnnotationCompositor compositor;
    private LayoutConfig config;

    @BeforeEach
    void setUp() {
        compositor = new AnnotationCompositor(FIXED);
        // content box 900 x 900
        config = LayoutFixtures.bare(LayoutMode.GRID)
                .margin(50)
                .marginBorder(true)
                .caption(CaptionSpec.names())
                .scaleBar(ScaleBarSpec.standard())
                .numbering(NumberingSpec.standard())
                .build();
    }

    @Test
    void testOverlaysInPaintOrder() {
        Page page = compositor.compose(page(0), config, 0.4, new SequenceCounter(1));

        List<Overlay> overlays = page.overlays();
        assertEquals(6, overlays.size());
        assertEquals(new MarginBorder(new Rect(0, 0, 900, 900), 50), overlays.get(0));
        assertEquals(new Caption("a.jpg", 100, 105, List.of("a.jpg"), 12, 20), overlays.get(1));
        assertEquals(new Caption("b.jpg", 400, 105, List.of("b.jpg"), 12, 20), overlays.get(2));
        assertEquals(new ScaleBar(0, 868, 236, 10, 5, "5 cm", 14), overlays.get(3));
        assertEquals(new SequenceNumber(5, 5, "Tav. 1", 1, 18), overlays.get(4));
        assertEquals(new SequenceNumber(305, 5, "Tav. 2", 2, 18), overlays.get(5));
    }

    @Test
    void testExistingOverlaysComeFirst() {
        Divider divider = new Divider(250, 0, 2, 100);
        Page input = page(0).withOverlays(List.of(divider));

        Page page = compositor.compose(input, config, 0.4, new SequenceCounter(1));
        assertEquals(divider, page.overlays().get(0));
    }

    @Test
    void testCounterRunsAcrossPages() {
        SequenceCounter counter = new SequenceCounter(1);
        compositor.compose(page(0), config, 0.4, counter);
        Page second = compositor.compose(page(1), config, 0.4, counter);

        List<Integer> numbers = second.overlays().stream()
                .filter(o -> o instanceof SequenceNumber)
                .map(o -> ((SequenceNumber) o).number())
                .toList();
        assertEquals(List.of(3, 4), numbers);
        assertEquals(5, counter.peek());
    }

    @Test
    void testBottomRightNumber() {
        LayoutConfig bottomRight = config.toBuilder()
                .caption(CaptionSpec.disabled())
                .scaleBar(ScaleBarSpec.disabled())
                .marginBorder(false)
                .numbering(new NumberingSpec(true, 1, NumberPosition.BOTTOM_RIGHT, "Tav.", 18, NumberingScope.IMAGE))
                .build();

        Page page = compositor.compose(page(0), bottomRight, 0.4, new SequenceCounter(1));
        assertEquals(new SequenceNumber(135, 75, "Tav. 1", 1, 18), page.overlays().get(0));
    }

    @Test
    void testPageScopeNumbersContentCorner() {
        LayoutConfig perPage = config.toBuilder()
                .caption(CaptionSpec.disabled())
                .scaleBar(ScaleBarSpec.disabled())
                .marginBorder(false)
                .numbering(new NumberingSpec(true, 7, NumberPosition.TOP_RIGHT, " ", 18, NumberingScope.PAGE))
                .build();

        Page page = compositor.compose(page(0), perPage, 0.4, new SequenceCounter(7));
        assertEquals(List.of(new SequenceNumber(900 - 10 - 5, 5, "7", 7, 18)), page.overlays(),
                "One number per page, blank prefix leaves the bare number");
    }

    @Test
    void testScaleBarFollowsScale() {
        LayoutConfig halfCm = config.toBuilder().scaleBar(new ScaleBarSpec(true, 2.5, 100)).build();

        ScaleBar bar = compositor.scaleBar(halfCm, 2.0);
        assertEquals(500, bar.length());
        assertEquals(2, bar.segments());
        assertEquals("2.5 cm", bar.label());
    }

    @Test
    void testEmptyPageStillGetsBorderAndScaleBar() {
        Page page = compositor.compose(Page.empty(0), config, 0.4, new SequenceCounter(1));
        assertEquals(2, page.overlays().size());
        assertTrue(page.overlays().get(0) instanceof MarginBorder);
        assertTrue(page.overlays().get(1) instanceof ScaleBar);
    }

    @Test
    void testFormatCm() {
        assertEquals("5", AnnotationCompositor.formatCm(5.0));
        assertEquals("2.5", AnnotationCompositor.formatCm(2.5));
    }

    private static Page page(int index) {
        List<PlacedImage> images = List.of(
                new PlacedImage(ImageItem.of("a.jpg", 400, 200), 0, 0, 200, 100, index, false),
                new PlacedImage(ImageItem.of("b.jpg", 400, 200), 300, 0, 200, 100, index, false));
        return new Page(index, images, List.of());
    }
}
