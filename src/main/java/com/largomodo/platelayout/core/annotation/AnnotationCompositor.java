package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.config.CaptionSpec;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.NumberPosition;
import com.largomodo.platelayout.core.config.NumberingScope;
import com.largomodo.platelayout.core.config.NumberingSpec;
import com.largomodo.platelayout.core.config.ScaleBarSpec;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.domain.Rect;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.domain.overlay.Caption;
import com.largomodo.platelayout.core.domain.overlay.MarginBorder;
import com.largomodo.platelayout.core.domain.overlay.Overlay;
import com.largomodo.platelayout.core.domain.overlay.ScaleBar;
import com.largomodo.platelayout.core.domain.overlay.SequenceNumber;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds border, captions, scale bar and plate numbers to a page, in that order, after any
 * overlays the page already carries.
 * <p>
 * Apart from the running number, the overlays depend only on the page and the configuration.
 * The counter is passed in so it can run across every page of a document.
 */
public class AnnotationCompositor {

    static final int SCALE_BAR_HEIGHT = 10;
    static final int SCALE_BAR_FONT_SIZE = 14;
    static final int LABEL_GAP = 2;
    static final int NUMBER_OFFSET = 5;

    private final TextMeasurer measurer;

    public AnnotationCompositor(TextMeasurer measurer) {
        this.measurer = measurer;
    }

    public Page compose(Page page, LayoutConfig config, double scale, SequenceCounter counter) {
        List<Overlay> overlays = new ArrayList<>(page.overlays());

        if (config.marginBorder()) {
            overlays.add(new MarginBorder(new Rect(0, 0, config.contentWidth(), config.contentHeight()),
                    config.margin()));
        }
        if (config.caption().enabled()) {
            addCaptions(page, config.caption(), overlays);
        }
        if (config.scaleBar().enabled()) {
            overlays.add(scaleBar(config, scale));
        }
        if (config.numbering().enabled()) {
            addNumbers(page, config, counter, overlays);
        }
        return page.withOverlays(overlays);
    }

    private void addCaptions(Page page, CaptionSpec spec, List<Overlay> overlays) {
        CaptionLayout layout = new CaptionLayout(spec, measurer);
        int lineHeight = layout.lineHeight();
        for (PlacedImage image : page.images()) {
            overlays.add(new Caption(image.item().id(),
                    image.x() + image.width() / 2,
                    image.bottom() + spec.padding(),
                    layout.lines(image.item()),
                    spec.fontSize(),
                    lineHeight));
        }
    }

    ScaleBar scaleBar(LayoutConfig config, double scale) {
        ScaleBarSpec spec = config.scaleBar();
        int length = Math.max(1, (int) Math.round(spec.lengthCm() * spec.pixelsPerCm() * scale));
        int segments = Math.max(1, (int) spec.lengthCm());
        String label = formatCm(spec.lengthCm()) + " cm";
        int labelHeight = measurer.measure(label, SCALE_BAR_FONT_SIZE).height();
        int y = Math.max(0, config.contentHeight() - SCALE_BAR_HEIGHT - LABEL_GAP - labelHeight);
        return new ScaleBar(0, y, length, SCALE_BAR_HEIGHT, segments, label, SCALE_BAR_FONT_SIZE);
    }

    private void addNumbers(Page page, LayoutConfig config, SequenceCounter counter, List<Overlay> overlays) {
        NumberingSpec spec = config.numbering();
        if (spec.scope() == NumberingScope.PAGE) {
            int number = counter.next();
            String text = spec.label(number);
            Rect content = new Rect(0, 0, config.contentWidth(), config.contentHeight());
            overlays.add(numberAt(content, spec.position(), text, number, spec.fontSize()));
            return;
        }
        for (PlacedImage image : page.images()) {
            int number = counter.next();
            overlays.add(numberAt(image.bounds(), spec.position(), spec.label(number), number, spec.fontSize()));
        }
    }

    private SequenceNumber numberAt(Rect box, NumberPosition position, String text, int number, int fontSize) {
        Size size = measurer.measure(text, fontSize);
        int x = position.isRight()
                ? box.right() - size.width() - NUMBER_OFFSET
                : box.x() + NUMBER_OFFSET;
        int y = position.isBottom()
                ? box.bottom() - size.height() - NUMBER_OFFSET
                : box.y() + NUMBER_OFFSET;
        return new SequenceNumber(x, y, text, number, fontSize);
    }

    static String formatCm(double cm) {
        return BigDecimal.valueOf(cm).stripTrailingZeros().toPlainString();
    }
}
