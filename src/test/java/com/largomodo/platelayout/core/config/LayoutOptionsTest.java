package com.largomodo.platelayout.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LayoutOptionsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEmptyOptionsGiveDefaults() {
        assertEquals(LayoutConfig.builder().build(), new LayoutOptions(Map.of()).toConfig());
    }

    @Test
    void testOptionsAreApplied() {
        LayoutConfig config = new LayoutOptions(Map.ofEntries(
                Map.entry("mode", "Puzzle"),
                Map.entry("page_size", "4K"),
                Map.entry("margin_px", "20"),
                Map.entry("spacing_px", "0"),
                Map.entry("scale_factor", "0.25"),
                Map.entry("sort_by", "Period"),
                Map.entry("sort_order", "desc"),
                Map.entry("sort_by_secondary", "natural_name"),
                Map.entry("page_break_on_primary_change", "yes"),
                Map.entry("page_break_kind", "divider"),
                Map.entry("caption_fields", "Period, Site,,"),
                Map.entry("hide_field_names", "true"),
                Map.entry("add_scale_bar", "off"),
                Map.entry("table_prefix", "Fig."),
                Map.entry("table_position", "bottom_right"),
                Map.entry("table_scope", "page"),
                Map.entry("show_margin_border", "1"))).toConfig();

        assertEquals(LayoutMode.PUZZLE, config.mode());
        assertEquals(3840, config.pageWidth());
        assertEquals(2160, config.pageHeight());
        assertEquals(20, config.margin());
        assertEquals(0, config.spacing());
        assertEquals(0.25, config.scale().factor());
        assertEquals(SortCriterion.field("Period", SortOrder.DESCENDING), config.sort().primary());
        assertEquals(SortCriterion.Key.NATURAL_NAME, config.sort().secondary().key());
        assertEquals(BreakKind.DIVIDER, config.pageBreak().kind());
        assertTrue(config.breaksOnPrimaryChange());
        assertEquals(List.of("Period", "Site"), config.caption().fields());
        assertTrue(config.caption().hideFieldNames());
        assertFalse(config.scaleBar().enabled());
        assertEquals("Fig. 3", config.numbering().label(3));
        assertEquals(NumberPosition.BOTTOM_RIGHT, config.numbering().position());
        assertEquals(NumberingScope.PAGE, config.numbering().scope());
        assertTrue(config.marginBorder());
    }

    @Test
    void testImagesPerPageSelectsAutoScale() {
        LayoutConfig config = new LayoutOptions(Map.of("images_per_page", "8", "min_scale", "0.1")).toConfig();
        assertTrue(config.scale().isAuto());
        assertEquals(8, config.scale().targetPerPage());
        assertEquals(0.1, config.scale().minScale());
    }

    @Test
    void testMalformedNumbersFallBackToDefaults() {
        LayoutConfig config = new LayoutOptions(Map.of(
                "margin_px", "fifty",
                "scale_factor", "NaN",
                "add_caption", "maybe",
                "min_scale", "-1")).toConfig();

        assertEquals(LayoutConfig.DEFAULT_MARGIN, config.margin());
        assertEquals(ScaleSpec.DEFAULT_FACTOR, config.scale().factor());
        assertTrue(config.caption().enabled());
        assertEquals(ScaleSpec.DEFAULT_MIN_SCALE, config.scale().minScale());
    }

    @Test
    void testUnknownChoicesAreErrors() {
        assertThrows(InvalidLayoutConfigException.class, () -> new LayoutOptions(Map.of("mode", "spiral")).toConfig());
        assertThrows(InvalidLayoutConfigException.class, () -> new LayoutOptions(Map.of("page_size", "B5")).toConfig());
        assertThrows(InvalidLayoutConfigException.class,
                () -> new LayoutOptions(Map.of("sort_order", "sideways")).toConfig());
        assertThrows(InvalidLayoutConfigException.class,
                () -> new LayoutOptions(Map.of("table_position", "middle")).toConfig());
    }

    @Test
    void testManualPositions() {
        LayoutConfig config = new LayoutOptions(Map.of(
                "mode", "manual",
                "manual.a.jpg", "0, 10, 20",
                "manual.b.jpg", "1,5,5,300,200")).toConfig();

        assertEquals(ManualPosition.at(0, 10, 20), config.manualPositions().get("a.jpg"));
        assertEquals(new ManualPosition(1, 5, 5, 300, 200), config.manualPositions().get("b.jpg"));
    }

    @Test
    void testMalformedPositionIsAnError() {
        assertThrows(InvalidLayoutConfigException.class, () -> LayoutOptions.parsePosition("a", "1,2"));
        assertThrows(InvalidLayoutConfigException.class, () -> LayoutOptions.parsePosition("a", "1,x,2"));
    }

    @Test
    void testLoadAndMerge() throws IOException {
        Path file = tempDir.resolve("layout.properties");
        Files.writeString(file, "# plate settings\nmode=masonry\nmasonry_cols=4\nmargin_px=30\n");

        LayoutOptions options = LayoutOptions.load(file).merge(Map.of("margin_px", "40"));
        LayoutConfig config = options.toConfig();

        assertEquals(LayoutMode.MASONRY, config.mode());
        assertEquals(4, config.masonryColumns());
        assertEquals(40, config.margin(), "Overrides win over the file");
        assertEquals("masonry", options.asMap().get("mode"));
    }
}
