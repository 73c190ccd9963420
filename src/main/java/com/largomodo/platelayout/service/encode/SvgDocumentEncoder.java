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
import com.largomodo.platelayout.util.FileNameUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes every page as a standalone SVG file.
 * <p>
 * Images are embedded as PNG data URIs. Overlays stay editable: captions, labels and numbers
 * are {@code <text>} elements and each overlay kind sits in its own named group
 * ({@code images}, {@code dividers}, {@code border}, {@code captions}, {@code scale-bar},
 * {@code numbers}).
 */
public class SvgDocumentEncoder implements DocumentEncoder {

    private static final Logger log = LoggerFactory.getLogger(SvgDocumentEncoder.class);

    private static final String FONT_FAMILY = "Helvetica, Arial, sans-serif";

    private final ImageDecoder decoder;

    public SvgDocumentEncoder(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.SVG;
    }

    @Override
    public List<Path> write(Document document, Path target) throws EncodingException {
        ImagePixels pixels = new ImagePixels(decoder);
        Map<BufferedImage, String> dataUris = new IdentityHashMap<>();
        List<Path> written = new ArrayList<>(document.totalPages());
        for (Page page : document.pages()) {
            Path file = FileNameUtil.pagePath(target, page.index(), document.totalPages(), format().getExtension());
            String svg = render(document, page, pixels, dataUris);
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, svg, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new EncodingException("Cannot write " + file + ": " + e.getMessage(), e);
            }
            log.debug("Wrote page {} to {}", page.index() + 1, file);
            written.add(file);
        }
        return written;
    }

    /**
     * SVG markup for one page.
     */
    public String render(Document document, Page page) throws EncodingException {
        return render(document, page, new ImagePixels(decoder), new IdentityHashMap<>());
    }

    private String render(Document document, Page page, ImagePixels pixels, Map<BufferedImage, String> dataUris)
            throws EncodingException {
        StringBuilder images = new StringBuilder();
        for (PlacedImage image : page.images()) {
            BufferedImage source = pixels.get(image.item());
            String uri = dataUris.get(source);
            if (uri == null) {
                uri = dataUri(source);
                dataUris.put(source, uri);
            }
            images.append(String.format(Locale.ROOT, "    <image id=\"%s\" x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\""
                            + " preserveAspectRatio=\"none\" href=\"%s\"/>%n",
                    escape(image.item().id()), image.x(), image.y(), image.width(), image.height(), uri));
        }

        GroupWriter groups = new GroupWriter();
        for (Overlay overlay : page.overlays()) {
            overlay.accept(groups);
        }

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(String.format(Locale.ROOT, "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\""
                        + " viewBox=\"0 0 %d %d\">%n",
                document.pageWidth(), document.pageHeight(), document.pageWidth(), document.pageHeight()));
        svg.append(String.format(Locale.ROOT, "  <rect width=\"%d\" height=\"%d\" fill=\"white\"/>%n",
                document.pageWidth(), document.pageHeight()));
        svg.append(String.format(Locale.ROOT, "  <g transform=\"translate(%d,%d)\">%n", document.margin(), document.margin()));
        group(svg, "images", images);
        group(svg, "dividers", groups.dividers);
        group(svg, "border", groups.border);
        group(svg, "captions", groups.captions);
        group(svg, "scale-bar", groups.scaleBar);
        group(svg, "numbers", groups.numbers);
        svg.append("  </g>\n");
        svg.append("</svg>\n");
        return svg.toString();
    }

    private static void group(StringBuilder svg, String id, StringBuilder content) {
        if (content.length() == 0) {
            return;
        }
        svg.append("  <g id=\"").append(id).append("\">\n").append(content).append("  </g>\n");
    }

    private static String dataUri(BufferedImage image) throws EncodingException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", bytes);
        } catch (IOException e) {
            throw new EncodingException("Cannot embed image: " + e.getMessage(), e);
        }
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static final class GroupWriter implements OverlayVisitor<Void> {

        final StringBuilder captions = new StringBuilder();
        final StringBuilder scaleBar = new StringBuilder();
        final StringBuilder border = new StringBuilder();
        final StringBuilder dividers = new StringBuilder();
        final StringBuilder numbers = new StringBuilder();

        @Override
        public Void visitCaption(Caption caption) {
            for (int i = 0; i < caption.lines().size(); i++) {
                captions.append(String.format(Locale.ROOT, "    <text x=\"%d\" y=\"%d\" font-family=\"%s\" font-size=\"%d\""
                                + " text-anchor=\"middle\" dominant-baseline=\"hanging\">%s</text>%n",
                        caption.centerX(), caption.top() + i * caption.lineHeight(), FONT_FAMILY,
                        caption.fontSize(), escape(caption.lines().get(i))));
            }
            return null;
        }

        @Override
        public Void visitScaleBar(ScaleBar bar) {
            int segments = bar.segments();
            int segmentWidth = bar.length() / segments;
            for (int i = 0; i < segments; i++) {
                int x = bar.x() + i * segmentWidth;
                int w = i == segments - 1 ? bar.length() - i * segmentWidth : segmentWidth;
                scaleBar.append(String.format(Locale.ROOT, "    <rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"%s\"/>%n",
                        x, bar.y(), w, bar.barHeight(), i % 2 == 0 ? "black" : "white"));
            }
            scaleBar.append(String.format(Locale.ROOT, "    <rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"none\""
                    + " stroke=\"black\" stroke-width=\"1\"/>%n", bar.x(), bar.y(), bar.length(), bar.barHeight()));
            int labelY = bar.y() + bar.barHeight() + 2;
            scaleBar.append(String.format(Locale.ROOT, "    <text x=\"%d\" y=\"%d\" font-family=\"%s\" font-size=\"%d\""
                    + " dominant-baseline=\"hanging\">0</text>%n", bar.x(), labelY, FONT_FAMILY, bar.fontSize()));
            scaleBar.append(String.format(Locale.ROOT, "    <text x=\"%d\" y=\"%d\" font-family=\"%s\" font-size=\"%d\""
                            + " text-anchor=\"end\" dominant-baseline=\"hanging\">%s</text>%n",
                    bar.x() + bar.length(), labelY, FONT_FAMILY, bar.fontSize(), escape(bar.label())));
            return null;
        }

        @Override
        public Void visitMarginBorder(MarginBorder b) {
            for (Rect r : new Rect[]{b.outer(), b.content()}) {
                border.append(String.format(Locale.ROOT, "    <rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"none\""
                        + " stroke=\"black\" stroke-width=\"1\"/>%n", r.x(), r.y(), r.width(), r.height()));
            }
            return null;
        }

        @Override
        public Void visitDivider(Divider d) {
            dividers.append(String.format(Locale.ROOT, "    <rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"black\"/>%n",
                    d.x(), d.y(), d.width(), d.height()));
            return null;
        }

        @Override
        public Void visitSequenceNumber(SequenceNumber n) {
            numbers.append(String.format(Locale.ROOT, "    <text x=\"%d\" y=\"%d\" font-family=\"%s\" font-size=\"%d\""
                            + " font-weight=\"bold\" dominant-baseline=\"hanging\">%s</text>%n",
                    n.x(), n.y(), FONT_FAMILY, n.fontSize(), escape(n.text())));
            return null;
        }
    }
}
