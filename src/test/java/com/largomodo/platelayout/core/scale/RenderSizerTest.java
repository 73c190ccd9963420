package com.largomodo.platelayout.core.scale;

import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RenderSizerTest {

    @Test
    void testRenderRoundsAndNeverCollapses() {
        assertEquals(new Size(400, 300), RenderSizer.render(ImageItem.of("a", 1000, 750), 0.4));
        assertEquals(new Size(1, 1), RenderSizer.render(ImageItem.of("a", 3, 2), 0.01), "At least one pixel");
    }

    @Test
    void testFitScale() {
        ImageItem item = ImageItem.of("a", 2000, 1000);
        assertEquals(0.5, RenderSizer.fitScale(item, 1000, 1000));
        assertEquals(0.0, RenderSizer.fitScale(item, 1000, 0), "No room at all");
    }

    @Test
    void testFitWithinKeepsSizeThatFits() {
        Size size = new Size(100, 50);
        assertSame(size, RenderSizer.fitWithin(size, 100, 50));
    }

    @Test
    void testFitWithinShrinksProportionally() {
        Size fitted = RenderSizer.fitWithin(new Size(400, 200), 100, 100);
        assertEquals(100, fitted.width());
        assertEquals(50, fitted.height());
    }

    @Test
    void testToWidth() {
        assertEquals(new Size(300, 150), RenderSizer.toWidth(ImageItem.of("a", 800, 400), 300));
    }
}
