package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.config.CaptionSpec;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CaptionLayoutTest {

    private final TextMeasurer measurer = new ApproximateTextMeasurer();

    @Test
    void testAllFieldsInSpreadsheetOrder() {
        CaptionLayout layout = new CaptionLayout(new CaptionSpec(true, 10, 5, List.of(), false, false), measurer);

        assertEquals(List.of("US12_03.jpg", "Site: Aquileia", "Period: Roman"), layout.lines(item()));
    }

    @Test
    void testSelectedFieldsSkipEmptyValues() {
        CaptionSpec spec = new CaptionSpec(true, 10, 5, List.of("Period", "Layer", "Site"), false, false);
        CaptionLayout layout = new CaptionLayout(spec, measurer);

        assertEquals(List.of("US12_03.jpg", "Period: Roman", "Site: Aquileia"), layout.lines(item()),
                "Blank Layer is left out, selection order is kept");
    }

    @Test
    void testHiddenNamesAndStrippedExtension() {
        CaptionSpec spec = new CaptionSpec(true, 10, 5, List.of("Period"), true, true);
        CaptionLayout layout = new CaptionLayout(spec, measurer);

        assertEquals(List.of("US12_03", "Roman"), layout.lines(item()));
    }

    @Test
    void testReserveCoversWidestLineAndPadding() {
        CaptionLayout layout = new CaptionLayout(new CaptionSpec(true, 10, 5, List.of(), false, false), measurer);

        Size widest = measurer.measure("Site: Aquileia", 10);
        assertEquals(new Size(widest.width() + 10, 3 * measurer.lineHeight(10) + 10), layout.reserve(item()));
    }

    @Test
    void testDisabledReservesNothing() {
        CaptionLayout layout = new CaptionLayout(CaptionSpec.disabled(), measurer);
        assertEquals(Size.EMPTY, layout.reserve(item()));
    }

    private static ImageItem item() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("Site", "Aquileia");
        metadata.put("Layer", " ");
        metadata.put("Period", "Roman");
        return ImageItem.of("US12_03.jpg", 800, 600, metadata);
    }
}
