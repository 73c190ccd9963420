package com.largomodo.platelayout.core.config;

import com.largomodo.platelayout.core.domain.Size;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete, validated description of one layout request.
 * <p>
 * Construction fails with {@link InvalidLayoutConfigException} when the configuration cannot
 * produce a page: margins consuming the page, grid cells or masonry columns narrower than one
 * pixel, negative spacing. Everything downstream may therefore assume a content box of at least
 * 1x1.
 * </p>
 * <p>
 * Use {@link #builder()} to start from the defaults.
 * </p>
 */
public record LayoutConfig(
        LayoutMode mode,
        int pageWidth,
        int pageHeight,
        int margin,
        int spacing,
        int gridRows,
        int gridCols,
        int masonryColumns,
        ScaleSpec scale,
        SortSpec sort,
        BreakSpec pageBreak,
        CaptionSpec caption,
        ScaleBarSpec scaleBar,
        NumberingSpec numbering,
        boolean marginBorder,
        Map<String, ManualPosition> manualPositions,
        int dpi) {

    public static final int DEFAULT_MARGIN = 50;
    public static final int DEFAULT_SPACING = 10;
    public static final int DEFAULT_GRID_ROWS = 4;
    public static final int DEFAULT_GRID_COLS = 3;
    public static final int DEFAULT_MASONRY_COLUMNS = 3;
    public static final int DEFAULT_DPI = 300;

    public LayoutConfig {
        if (mode == null) {
            throw new InvalidLayoutConfigException("Layout mode is required");
        }
        if (scale == null || sort == null || pageBreak == null || caption == null
                || scaleBar == null || numbering == null) {
            throw new InvalidLayoutConfigException("Layout configuration is incomplete");
        }
        if (pageWidth < 1 || pageHeight < 1) {
            throw new InvalidLayoutConfigException("Page size must be positive: " + pageWidth + "x" + pageHeight);
        }
        if (margin < 0) {
            throw new InvalidLayoutConfigException("Margin cannot be negative: " + margin);
        }
        if (spacing < 0) {
            throw new InvalidLayoutConfigException("Spacing cannot be negative: " + spacing);
        }
        if (pageWidth - 2 * margin < 1 || pageHeight - 2 * margin < 1) {
            throw new InvalidLayoutConfigException("Margin " + margin + " leaves no content area on a "
                    + pageWidth + "x" + pageHeight + " page");
        }
        if (dpi < 1) {
            throw new InvalidLayoutConfigException("Output DPI must be positive: " + dpi);
        }
        if (gridRows < 1 || gridCols < 1) {
            throw new InvalidLayoutConfigException("Grid needs at least one row and one column: "
                    + gridRows + "x" + gridCols);
        }
        if (masonryColumns < 1) {
            throw new InvalidLayoutConfigException("Masonry needs at least one column: " + masonryColumns);
        }
        Map<String, ManualPosition> positions = new LinkedHashMap<>();
        if (manualPositions != null) {
            positions.putAll(manualPositions);
        }
        manualPositions = Collections.unmodifiableMap(positions);

        int contentWidth = pageWidth - 2 * margin;
        int contentHeight = pageHeight - 2 * margin;
        if (mode == LayoutMode.GRID) {
            int cellW = (contentWidth - (gridCols - 1) * spacing) / gridCols;
            int cellH = (contentHeight - (gridRows - 1) * spacing) / gridRows;
            if (cellW < 1 || cellH < 1) {
                throw new InvalidLayoutConfigException("Grid " + gridRows + "x" + gridCols
                        + " with spacing " + spacing + " leaves cells smaller than one pixel");
            }
        }
        if (mode == LayoutMode.MASONRY
                && (contentWidth - (masonryColumns - 1) * spacing) / masonryColumns < 1) {
            throw new InvalidLayoutConfigException(masonryColumns + " masonry columns with spacing "
                    + spacing + " leave columns narrower than one pixel");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .pageSize(pageWidth, pageHeight)
                .margin(margin)
                .spacing(spacing)
                .grid(gridRows, gridCols)
                .masonryColumns(masonryColumns)
                .scale(scale)
                .sort(sort)
                .pageBreak(pageBreak)
                .caption(caption)
                .scaleBar(scaleBar)
                .numbering(numbering)
                .marginBorder(marginBorder)
                .manualPositions(manualPositions)
                .dpi(dpi);
    }

    public int contentWidth() {
        return pageWidth - 2 * margin;
    }

    public int contentHeight() {
        return pageHeight - 2 * margin;
    }

    public Size contentSize() {
        return new Size(contentWidth(), contentHeight());
    }

    public int gridCellWidth() {
        return (contentWidth() - (gridCols - 1) * spacing) / gridCols;
    }

    public int gridCellHeight() {
        return (contentHeight() - (gridRows - 1) * spacing) / gridRows;
    }

    public int masonryColumnWidth() {
        return (contentWidth() - (masonryColumns - 1) * spacing) / masonryColumns;
    }

    /**
     * True when a value change of the primary sort field splits or separates groups.
     */
    public boolean breaksOnPrimaryChange() {
        return pageBreak.enabled() && sort.primary().isField() && mode != LayoutMode.MANUAL;
    }

    public static final class Builder {
        private LayoutMode mode = LayoutMode.GRID;
        private int pageWidth = PageSize.A4.toSize().width();
        private int pageHeight = PageSize.A4.toSize().height();
        private int margin = DEFAULT_MARGIN;
        private int spacing = DEFAULT_SPACING;
        private int gridRows = DEFAULT_GRID_ROWS;
        private int gridCols = DEFAULT_GRID_COLS;
        private int masonryColumns = DEFAULT_MASONRY_COLUMNS;
        private ScaleSpec scale = ScaleSpec.fixed(ScaleSpec.DEFAULT_FACTOR);
        private SortSpec sort = SortSpec.alphabetical();
        private BreakSpec pageBreak = BreakSpec.disabled();
        private CaptionSpec caption = CaptionSpec.names();
        private ScaleBarSpec scaleBar = ScaleBarSpec.standard();
        private NumberingSpec numbering = NumberingSpec.standard();
        private boolean marginBorder;
        private Map<String, ManualPosition> manualPositions = new LinkedHashMap<>();
        private int dpi = DEFAULT_DPI;

        private Builder() {
        }

        public Builder mode(LayoutMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder pageSize(int width, int height) {
            this.pageWidth = width;
            this.pageHeight = height;
            return this;
        }

        public Builder pageSize(Size size) {
            return pageSize(size.width(), size.height());
        }

        public Builder pageSize(PageSize preset) {
            return pageSize(preset.toSize());
        }

        public Builder margin(int margin) {
            this.margin = margin;
            return this;
        }

        public Builder spacing(int spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder grid(int rows, int cols) {
            this.gridRows = rows;
            this.gridCols = cols;
            return this;
        }

        public Builder masonryColumns(int columns) {
            this.masonryColumns = columns;
            return this;
        }

        public Builder scale(ScaleSpec scale) {
            this.scale = scale;
            return this;
        }

        public Builder sort(SortSpec sort) {
            this.sort = sort;
            return this;
        }

        public Builder pageBreak(BreakSpec pageBreak) {
            this.pageBreak = pageBreak;
            return this;
        }

        public Builder caption(CaptionSpec caption) {
            this.caption = caption;
            return this;
        }

        public Builder scaleBar(ScaleBarSpec scaleBar) {
            this.scaleBar = scaleBar;
            return this;
        }

        public Builder numbering(NumberingSpec numbering) {
            this.numbering = numbering;
            return this;
        }

        public Builder marginBorder(boolean marginBorder) {
            this.marginBorder = marginBorder;
            return this;
        }

        public Builder manualPositions(Map<String, ManualPosition> positions) {
            this.manualPositions = new LinkedHashMap<>(positions);
            return this;
        }

        public Builder manualPosition(String imageId, ManualPosition position) {
            this.manualPositions.put(imageId, position);
            return this;
        }

        public Builder dpi(int dpi) {
            this.dpi = dpi;
            return this;
        }

        public LayoutConfig build() {
            return new LayoutConfig(mode, pageWidth, pageHeight, margin, spacing, gridRows, gridCols,
                    masonryColumns, scale, sort, pageBreak, caption, scaleBar, numbering, marginBorder,
                    manualPositions, dpi);
        }
    }
}
