package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.core.LayoutEngine;
import com.largomodo.platelayout.core.LayoutFixtures;
import com.largomodo.platelayout.core.annotation.ApproximateTextMeasurer;
import com.largomodo.platelayout.core.config.BreakSpec;
import com.largomodo.platelayout.core.config.CaptionSpec;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.config.NumberingSpec;
import com.largomodo.platelayout.core.config.ScaleBarSpec;
import com.largomodo.platelayout.core.config.ScaleSpec;
import com.largomodo.platelayout.core.config.SortCriterion;
import com.largomodo.platelayout.core.config.SortOrder;
import com.largomodo.platelayout.core.config.SortSpec;
import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.service.ImageIoDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SvgDocumentEncoderTest {

    @TempDir
    Path tempDir;

    private SvgDocumentEncoder encoder;
    private LayoutEngine engine;

    @BeforeEach
    void setUp() {
        encoder = new SvgDocumentEncoder(new ImageIoDecoder());
        engine = new LayoutEngine(new ApproximateTextMeasurer());
    }

    @Test
    void testGroupsInPaintOrder() throws EncodingException {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID)
                .margin(40)
                .marginBorder(true)
                .caption(CaptionSpec.names())
                .scaleBar(ScaleBarSpec.standard())
                .numbering(NumberingSpec.standard())
                .sort(SortSpec.by(SortCriterion.field("Period", SortOrder.ASCENDING)))
                .pageBreak(BreakSpec.divider(2, 0))
                .scale(ScaleSpec.fixed(0.2))
                .build();
        Document document = engine.generate(List.of(
                ImageItem.of("a.jpg", 400, 300, Map.of("Period", "Iron Age")),
                ImageItem.of("b.jpg", 400, 300, Map.of("Period", "Roman"))), config);

        String svg = encoder.render(document, document.pages().get(0));

        assertTrue(svg.startsWith("<?xml"));
        assertTrue(svg.contains("width=\"1000\" height=\"1000\""));
        assertTrue(svg.contains("<g transform=\"translate(40,40)\">"), "Content is offset by the margin");
        int images = svg.indexOf("<g id=\"images\">");
        int dividers = svg.indexOf("<g id=\"dividers\">");
        int border = svg.indexOf("<g id=\"border\">");
        int captions = svg.indexOf("<g id=\"captions\">");
        int scaleBar = svg.indexOf("<g id=\"scale-bar\">");
        int numbers = svg.indexOf("<g id=\"numbers\">");
        assertTrue(images >= 0 && images < dividers && dividers < border && border < captions
                && captions < scaleBar && scaleBar < numbers, svg);
        assertTrue(svg.contains("data:image/png;base64,"), "Pixels are embedded");
        assertTrue(svg.contains(">Tav. 2</text>"));
    }

    @Test
    void testEmptyGroupsAreOmitted() throws EncodingException {
        Document document = engine.generate(List.of(ImageItem.of("a.jpg", 400, 300)),
                LayoutFixtures.bare(LayoutMode.GRID).build());

        String svg = encoder.render(document, document.pages().get(0));

        assertTrue(svg.contains("<g id=\"images\">"));
        assertFalse(svg.contains("id=\"captions\""));
        assertFalse(svg.contains("id=\"numbers\""));
    }

    @Test
    void testTextIsEscaped() throws EncodingException {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID).caption(CaptionSpec.names()).build();
        Document document = engine.generate(List.of(ImageItem.of("R&D <1>.jpg", 400, 300)), config);

        String svg = encoder.render(document, document.pages().get(0));

        assertTrue(svg.contains("R&amp;D &lt;1&gt;.jpg"), svg);
        assertEquals("&quot;a&apos;", SvgDocumentEncoder.escape("\"a'"));
    }

    @Test
    void testOneFilePerPage() throws IOException {
        LayoutConfig config = LayoutFixtures.bare(LayoutMode.GRID).grid(1, 1).build();
        Document document = engine.generate(LayoutFixtures.squares(3, 100), config);

        List<Path> written = encoder.write(document, tempDir.resolve("plates.svg"));

        assertEquals(List.of(
                tempDir.resolve("plates_page_1.svg"),
                tempDir.resolve("plates_page_2.svg"),
                tempDir.resolve("plates_page_3.svg")), written);
        for (Path file : written) {
            assertTrue(Files.readString(file).contains("</svg>"));
        }
    }
}
