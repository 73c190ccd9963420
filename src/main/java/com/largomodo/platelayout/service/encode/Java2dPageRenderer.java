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

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Paints one page onto an RGB raster at full page size, margins included.
 */
class Java2dPageRenderer {

    private final String fontFamily;

    Java2dPageRenderer(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    BufferedImage render(Document document, Page page, ImagePixels pixels) throws EncodingException {
        BufferedImage canvas = new BufferedImage(document.pageWidth(), document.pageHeight(),
                BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, document.pageWidth(), document.pageHeight());
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.translate(document.margin(), document.margin());

            for (PlacedImage image : page.images()) {
                g.drawImage(pixels.get(image.item()), image.x(), image.y(), image.width(), image.height(), null);
            }
            OverlayPainter painter = new OverlayPainter(g);
            for (Overlay overlay : page.overlays()) {
                overlay.accept(painter);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    private final class OverlayPainter implements OverlayVisitor<Void> {

        private final Graphics2D g;

        OverlayPainter(Graphics2D g) {
            this.g = g;
        }

        @Override
        public Void visitCaption(Caption caption) {
            g.setColor(Color.BLACK);
            g.setFont(new Font(fontFamily, Font.PLAIN, caption.fontSize()));
            FontMetrics fm = g.getFontMetrics();
            for (int i = 0; i < caption.lines().size(); i++) {
                String line = caption.lines().get(i);
                int x = caption.centerX() - fm.stringWidth(line) / 2;
                int baseline = caption.top() + i * caption.lineHeight() + fm.getAscent();
                g.drawString(line, x, baseline);
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
                g.setColor(i % 2 == 0 ? Color.BLACK : Color.WHITE);
                g.fillRect(x, bar.y(), w, bar.barHeight());
            }
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1));
            g.drawRect(bar.x(), bar.y(), bar.length(), bar.barHeight());

            g.setFont(new Font(fontFamily, Font.PLAIN, bar.fontSize()));
            FontMetrics fm = g.getFontMetrics();
            int baseline = bar.y() + bar.barHeight() + 2 + fm.getAscent();
            g.drawString("0", bar.x(), baseline);
            g.drawString(bar.label(), bar.x() + bar.length() - fm.stringWidth(bar.label()), baseline);
            return null;
        }

        @Override
        public Void visitMarginBorder(MarginBorder border) {
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(1));
            Rect outer = border.outer();
            g.drawRect(outer.x(), outer.y(), outer.width() - 1, outer.height() - 1);
            Rect inner = border.content();
            g.drawRect(inner.x(), inner.y(), inner.width() - 1, inner.height() - 1);
            return null;
        }

        @Override
        public Void visitDivider(Divider divider) {
            g.setColor(Color.BLACK);
            g.fillRect(divider.x(), divider.y(), divider.width(), divider.height());
            return null;
        }

        @Override
        public Void visitSequenceNumber(SequenceNumber number) {
            g.setColor(Color.BLACK);
            g.setFont(new Font(fontFamily, Font.BOLD, number.fontSize()));
            g.drawString(number.text(), number.x(), number.y() + g.getFontMetrics().getAscent());
            return null;
        }
    }
}
