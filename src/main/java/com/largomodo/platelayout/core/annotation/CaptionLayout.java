package com.largomodo.platelayout.core.annotation;

import com.largomodo.platelayout.core.config.CaptionSpec;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.core.placement.CaptionMetrics;
import com.largomodo.platelayout.util.FileNameUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Caption text and the space it takes.
 * <p>
 * The first line is the image name, then one line per metadata field: the selected fields in
 * the configured order, or every field of the image when none are selected. Fields with an
 * empty value are left out. The reserved block is the widest line plus padding on both sides
 * and all lines plus padding above and below.
 */
public class CaptionLayout implements CaptionMetrics {

    private final CaptionSpec spec;
    private final TextMeasurer measurer;

    public CaptionLayout(CaptionSpec spec, TextMeasurer measurer) {
        this.spec = spec;
        this.measurer = measurer;
    }

    public List<String> lines(ImageItem item) {
        List<String> lines = new ArrayList<>();
        lines.add(spec.stripExtension() ? FileNameUtil.stripExtension(item.name()) : item.name());

        List<String> fields = spec.fields().isEmpty() ? new ArrayList<>(item.metadata().keySet()) : spec.fields();
        for (String field : fields) {
            String value = item.field(field);
            if (value == null) {
                continue;
            }
            lines.add(spec.hideFieldNames() ? value : field + ": " + value);
        }
        return lines;
    }

    public int lineHeight() {
        return measurer.lineHeight(spec.fontSize());
    }

    @Override
    public Size reserve(ImageItem item) {
        if (!spec.enabled()) {
            return Size.EMPTY;
        }
        List<String> lines = lines(item);
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, measurer.measure(line, spec.fontSize()).width());
        }
        int padding = spec.padding();
        return new Size(width + 2 * padding, lines.size() * lineHeight() + 2 * padding);
    }
}
