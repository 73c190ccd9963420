package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.overlay.Caption;
import com.largomodo.platelayout.core.domain.overlay.Divider;
import com.largomodo.platelayout.core.domain.overlay.MarginBorder;
import com.largomodo.platelayout.core.domain.overlay.Overlay;
import com.largomodo.platelayout.core.domain.overlay.OverlayVisitor;
import com.largomodo.platelayout.core.domain.overlay.ScaleBar;
import com.largomodo.platelayout.core.domain.overlay.SequenceNumber;
import com.largomodo.platelayout.service.ImageDecoder;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the whole document as one PDF, one page per plate, via PDFBox.
 * <p>
 * Page geometry is converted from pixels to points at the output DPI. Images are embedded
 * losslessly, each source file once. Text uses the standard Helvetica fonts, so characters
 * outside WinAnsi are replaced with '?'.
 */
public class PdfDocumentEncoder implements DocumentEncoder {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentEncoder.class);

    private static final PDFont TEXT_FONT = PDType1Font.HELVETICA;
    private static final PDFont NUMBER_FONT = PDType1Font.HELVETICA_BOLD;

    private final ImageDecoder decoder;
    private final int dpi;

    public PdfDocumentEncoder(ImageDecoder decoder) {
        this(decoder, 300);
    }

    public PdfDocumentEncoder(ImageDecoder decoder, int dpi) {
        if (dpi < 1) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        this.decoder = decoder;
        this.dpi = dpi;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.PDF;
    }

    @Override
    public List<Path> write(Document document, Path target) throws EncodingException {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                write(document, out);
            }
        } catch (EncodingException e) {
            throw e;
        } catch (IOException e) {
            throw new EncodingException("Cannot write " + target + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} pages to {}", document.totalPages(), target);
        return List.of(target);
    }

    /**
     * Streams the PDF to {@code out}. The stream is not closed.
     */
    public void write(Document document, OutputStream out) throws EncodingException {
        ImagePixels pixels = new ImagePixels(decoder);
        try (PDDocument pdf = new PDDocument()) {
            Map<BufferedImage, PDImageXObject> embedded = new HashMap<>();
            for (Page page : document.pages()) {
                writePage(pdf, document, page, pixels, embedded);
            }
            pdf.save(out);
        } catch (EncodingException e) {
            throw e;
        } catch (IOException | UncheckedIOException e) {
            throw new EncodingException("PDF encoding failed: " + e.getMessage(), e);
        }
    }

    private void writePage(PDDocument pdf, Document document, Page page, ImagePixels pixels,
                           Map<BufferedImage, PDImageXObject> embedded) throws IOException {
        Geometry geo = new Geometry(72f / dpi, document.pageHeight(), document.margin());
        PDPage pdPage = new PDPage(new PDRectangle(document.pageWidth() * geo.k(), document.pageHeight() * geo.k()));
        pdf.addPage(pdPage);

        try (PDPageContentStream cs = new PDPageContentStream(pdf, pdPage)) {
            for (PlacedImage image : page.images()) {
                BufferedImage source = pixels.get(image.item());
                PDImageXObject xObject = embedded.get(source);
                if (xObject == null) {
                    xObject = LosslessFactory.createFromImage(pdf, source);
                    embedded.put(source, xObject);
                }
                cs.drawImage(xObject, geo.x(image.x()), geo.y(image.y() + image.height()),
                        geo.len(image.width()), geo.len(image.height()));
            }
            OverlayWriter writer = new OverlayWriter(cs, geo);
            for (Overlay overlay : page.overlays()) {
                overlay.accept(writer);
            }
        }
    }

    static String sanitize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            boolean printable = (c >= 0x20 && c < 0x7F) || (c >= 0xA0 && c <= 0xFF);
            sb.append(printable ? c : '?');
        }
        return sb.toString();
    }

    /**
     * Pixel to point conversion. PDF has its origin bottom-left.
     */
    private record Geometry(float k, int pageHeight, int margin) {
        float x(int px) {
            return (margin + px) * k;
        }

        float y(int px) {
            return (pageHeight - margin - px) * k;
        }

        float len(int px) {
            return px * k;
        }
    }

    private static final class OverlayWriter implements OverlayVisitor<Void> {

        private final PDPageContentStream cs;
        private final Geometry geo;

        OverlayWriter(PDPageContentStream cs, Geometry geo) {
            this.cs = cs;
            this.geo = geo;
        }

        @Override
        public Void visitCaption(Caption caption) {
            float size = geo.len(caption.fontSize());
            for (int i = 0; i < caption.lines().size(); i++) {
                String line = sanitize(caption.lines().get(i));
                float width = width(TEXT_FONT, line, size);
                float baseline = geo.y(caption.top() + i * caption.lineHeight()) - ascent(TEXT_FONT, size);
                text(TEXT_FONT, size, geo.x(caption.centerX()) - width / 2, baseline, line);
            }
            return null;
        }

        @Override
        public Void visitScaleBar(ScaleBar bar) {
            int segments = bar.segments();
            int segmentWidth = bar.length() / segments;
            try {
                for (int i = 0; i < segments; i++) {
                    int x = bar.x() + i * segmentWidth;
                    int w = i == segments - 1 ? bar.length() - i * segmentWidth : segmentWidth;
                    cs.setNonStrokingColor(i % 2 == 0 ? Color.BLACK : Color.WHITE);
                    cs.addRect(geo.x(x), geo.y(bar.y() + bar.barHeight()), geo.len(w), geo.len(bar.barHeight()));
                    cs.fill();
                }
                cs.setStrokingColor(Color.BLACK);
                cs.setLineWidth(geo.len(1));
                cs.addRect(geo.x(bar.x()), geo.y(bar.y() + bar.barHeight()), geo.len(bar.length()),
                        geo.len(bar.barHeight()));
                cs.stroke();
                cs.setNonStrokingColor(Color.BLACK);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            float size = geo.len(bar.fontSize());
            float baseline = geo.y(bar.y() + bar.barHeight() + 2) - ascent(TEXT_FONT, size);
            text(TEXT_FONT, size, geo.x(bar.x()), baseline, "0");
            String label = sanitize(bar.label());
            text(TEXT_FONT, size, geo.x(bar.x() + bar.length()) - width(TEXT_FONT, label, size), baseline, label);
            return null;
        }

        @Override
        public Void visitMarginBorder(MarginBorder border) {
            try {
                cs.setStrokingColor(Color.BLACK);
                cs.setLineWidth(geo.len(1));
                for (Rect r : new Rect[]{border.outer(), border.content()}) {
                    cs.addRect(geo.x(r.x()), geo.y(r.bottom()), geo.len(r.width()), geo.len(r.height()));
                }
                cs.stroke();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitDivider(Divider divider) {
            try {
                cs.setNonStrokingColor(Color.BLACK);
                cs.addRect(geo.x(divider.x()), geo.y(divider.y() + divider.height()),
                        geo.len(divider.width()), geo.len(divider.height()));
                cs.fill();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return null;
        }

        @Override
        public Void visitSequenceNumber(SequenceNumber number) {
            float size = geo.len(number.fontSize());
            float baseline = geo.y(number.y()) - ascent(NUMBER_FONT, size);
            text(NUMBER_FONT, size, geo.x(number.x()), baseline, sanitize(number.text()));
            return null;
        }

        private void text(PDFont font, float size, float x, float baseline, String text) {
            try {
                cs.setNonStrokingColor(Color.BLACK);
                cs.beginText();
                cs.setFont(font, size);
                cs.newLineAtOffset(x, baseline);
                cs.showText(text);
                cs.endText();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private static float width(PDFont font, String text, float size) {
            try {
                return font.getStringWidth(text) / 1000f * size;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private static float ascent(PDFont font, float size) {
            return font.getFontDescriptor().getAscent() / 1000f * size;
        }
    }
}
