package com.largomodo.platelayout.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Converts a flat set of named options into a {@link LayoutConfig}.
 * <p>
 * Option names follow the original plate tool ({@code margin_px}, {@code add_caption},
 * {@code table_prefix}, ...). Missing options take the builder defaults. A malformed number or
 * boolean is logged at WARN and also falls back to the default, so a typo in one option does
 * not abort the request. Names that select behavior (mode, page size, sort order, positions)
 * are not guessed: an unknown value is an {@link InvalidLayoutConfigException}.
 * </p>
 * <p>
 * Manual positions use one option per image: {@code manual.<imageId>=page,x,y[,width,height]}.
 * </p>
 */
public final class LayoutOptions {

    public static final String MODE = "mode";
    public static final String PAGE_SIZE = "page_size";
    public static final String MARGIN = "margin_px";
    public static final String SPACING = "spacing_px";
    public static final String GRID_ROWS = "grid_rows";
    public static final String GRID_COLS = "grid_cols";
    public static final String MASONRY_COLUMNS = "masonry_cols";
    public static final String SCALE_FACTOR = "scale_factor";
    public static final String IMAGES_PER_PAGE = "images_per_page";
    public static final String MIN_SCALE = "min_scale";
    public static final String SORT_BY = "sort_by";
    public static final String SORT_ORDER = "sort_order";
    public static final String SORT_BY_SECONDARY = "sort_by_secondary";
    public static final String SORT_ORDER_SECONDARY = "sort_order_secondary";
    public static final String RANDOM_SEED = "random_seed";
    public static final String PAGE_BREAK = "page_break_on_primary_change";
    public static final String BREAK_KIND = "page_break_kind";
    public static final String DIVIDER_THICKNESS = "divider_thickness";
    public static final String DIVIDER_WIDTH = "divider_width";
    public static final String ADD_CAPTION = "add_caption";
    public static final String CAPTION_FONT_SIZE = "caption_font_size";
    public static final String CAPTION_PADDING = "caption_padding";
    public static final String CAPTION_FIELDS = "caption_fields";
    public static final String HIDE_FIELD_NAMES = "hide_field_names";
    public static final String REMOVE_EXTENSION = "remove_extension";
    public static final String ADD_SCALE_BAR = "add_scale_bar";
    public static final String SCALE_BAR_CM = "scale_bar_cm";
    public static final String PIXELS_PER_CM = "pixels_per_cm";
    public static final String ADD_TABLE_NUMBER = "add_table_number";
    public static final String TABLE_START = "table_start_number";
    public static final String TABLE_POSITION = "table_position";
    public static final String TABLE_PREFIX = "table_prefix";
    public static final String TABLE_FONT_SIZE = "table_font_size";
    public static final String TABLE_SCOPE = "table_scope";
    public static final String MARGIN_BORDER = "show_margin_border";
    public static final String OUTPUT_DPI = "output_dpi";
    public static final String MANUAL_PREFIX = "manual.";

    private static final Logger log = LoggerFactory.getLogger(LayoutOptions.class);

    private final Map<String, String> options;

    public LayoutOptions(Map<String, String> options) {
        this.options = new LinkedHashMap<>();
        options.forEach((k, v) -> {
            if (k != null && v != null) {
                this.options.put(k.trim(), v.trim());
            }
        });
    }

    public static LayoutOptions fromProperties(Properties properties) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return new LayoutOptions(map);
    }

    /**
     * Reads a {@code .properties} file.
     */
    public static LayoutOptions load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    public Map<String, String> asMap() {
        return Map.copyOf(options);
    }

    /**
     * Returns a copy with {@code overrides} applied on top of these options.
     */
    public LayoutOptions merge(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(options);
        overrides.forEach((k, v) -> {
            if (v != null) {
                merged.put(k, v);
            }
        });
        return new LayoutOptions(merged);
    }

    public LayoutConfig toConfig() {
        LayoutConfig.Builder builder = LayoutConfig.builder();

        if (has(MODE)) {
            builder.mode(LayoutMode.fromCliArgument(options.get(MODE)));
        }
        if (has(PAGE_SIZE)) {
            builder.pageSize(PageSize.resolve(options.get(PAGE_SIZE)));
        }
        builder.margin(intOption(MARGIN, LayoutConfig.DEFAULT_MARGIN));
        builder.spacing(intOption(SPACING, LayoutConfig.DEFAULT_SPACING));
        builder.grid(intOption(GRID_ROWS, LayoutConfig.DEFAULT_GRID_ROWS),
                intOption(GRID_COLS, LayoutConfig.DEFAULT_GRID_COLS));
        builder.masonryColumns(intOption(MASONRY_COLUMNS, LayoutConfig.DEFAULT_MASONRY_COLUMNS));
        builder.dpi(intOption(OUTPUT_DPI, LayoutConfig.DEFAULT_DPI));

        builder.scale(scaleSpec());
        builder.sort(sortSpec());
        builder.pageBreak(new BreakSpec(
                boolOption(PAGE_BREAK, false),
                BreakKind.fromOption(options.get(BREAK_KIND)),
                intOption(DIVIDER_THICKNESS, BreakSpec.DEFAULT_THICKNESS),
                intOption(DIVIDER_WIDTH, 0)));
        builder.caption(new CaptionSpec(
                boolOption(ADD_CAPTION, true),
                intOption(CAPTION_FONT_SIZE, CaptionSpec.DEFAULT_FONT_SIZE),
                intOption(CAPTION_PADDING, CaptionSpec.DEFAULT_PADDING),
                listOption(CAPTION_FIELDS),
                boolOption(HIDE_FIELD_NAMES, false),
                boolOption(REMOVE_EXTENSION, false)));
        builder.scaleBar(new ScaleBarSpec(
                boolOption(ADD_SCALE_BAR, true),
                doubleOption(SCALE_BAR_CM, ScaleBarSpec.DEFAULT_LENGTH_CM),
                doubleOption(PIXELS_PER_CM, ScaleBarSpec.DEFAULT_PIXELS_PER_CM)));
        builder.numbering(new NumberingSpec(
                boolOption(ADD_TABLE_NUMBER, true),
                intOption(TABLE_START, 1),
                NumberPosition.fromOption(options.get(TABLE_POSITION)),
                options.getOrDefault(TABLE_PREFIX, NumberingSpec.DEFAULT_PREFIX),
                intOption(TABLE_FONT_SIZE, NumberingSpec.DEFAULT_FONT_SIZE),
                NumberingScope.fromOption(options.get(TABLE_SCOPE))));
        builder.marginBorder(boolOption(MARGIN_BORDER, false));
        builder.manualPositions(manualPositions());

        return builder.build();
    }

    private ScaleSpec scaleSpec() {
        double minScale = doubleOption(MIN_SCALE, ScaleSpec.DEFAULT_MIN_SCALE);
        if (minScale <= 0) {
            log.warn("Option {}={} is not positive, using {}", MIN_SCALE, minScale, ScaleSpec.DEFAULT_MIN_SCALE);
            minScale = ScaleSpec.DEFAULT_MIN_SCALE;
        }
        int target = intOption(IMAGES_PER_PAGE, 0);
        if (target > 0) {
            return ScaleSpec.auto(target).withMinScale(minScale);
        }
        return ScaleSpec.fixed(doubleOption(SCALE_FACTOR, ScaleSpec.DEFAULT_FACTOR)).withMinScale(minScale);
    }

    private SortSpec sortSpec() {
        SortCriterion primary = has(SORT_BY)
                ? SortCriterion.parse(options.get(SORT_BY), SortOrder.fromOption(options.get(SORT_ORDER)))
                : SortSpec.alphabetical().primary();
        SortCriterion secondary = SortCriterion.parse(options.get(SORT_BY_SECONDARY),
                SortOrder.fromOption(options.get(SORT_ORDER_SECONDARY)));
        Long seed = null;
        if (has(RANDOM_SEED)) {
            try {
                seed = Long.parseLong(options.get(RANDOM_SEED));
            } catch (NumberFormatException e) {
                log.warn("Option {}={} is not a number, random order will not be reproducible",
                        RANDOM_SEED, options.get(RANDOM_SEED));
            }
        }
        return new SortSpec(primary, secondary, seed);
    }

    private Map<String, ManualPosition> manualPositions() {
        Map<String, ManualPosition> positions = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            if (!entry.getKey().startsWith(MANUAL_PREFIX)) {
                continue;
            }
            String imageId = entry.getKey().substring(MANUAL_PREFIX.length());
            if (imageId.isBlank()) {
                throw new InvalidLayoutConfigException("Manual position without image id: " + entry.getKey());
            }
            positions.put(imageId, parsePosition(imageId, entry.getValue()));
        }
        return positions;
    }

    static ManualPosition parsePosition(String imageId, String value) {
        String[] parts = value.split(",");
        if (parts.length != 3 && parts.length != 5) {
            throw new InvalidLayoutConfigException("Manual position for " + imageId
                    + " must be page,x,y or page,x,y,width,height: " + value);
        }
        int[] numbers = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                numbers[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidLayoutConfigException("Manual position for " + imageId
                        + " is not numeric: " + value, e);
            }
        }
        return parts.length == 3
                ? ManualPosition.at(numbers[0], numbers[1], numbers[2])
                : new ManualPosition(numbers[0], numbers[1], numbers[2], numbers[3], numbers[4]);
    }

    private boolean has(String key) {
        String value = options.get(key);
        return value != null && !value.isEmpty();
    }

    private int intOption(String key, int defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        String raw = options.get(key);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Option {}={} is not an integer, using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double doubleOption(String key, double defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        String raw = options.get(key);
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException(raw);
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Option {}={} is not a number, using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean boolOption(String key, boolean defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        String raw = options.get(key).toLowerCase(Locale.ROOT);
        return switch (raw) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> {
                log.warn("Option {}={} is not a boolean, using default {}", key, options.get(key), defaultValue);
                yield defaultValue;
            }
        };
    }

    private List<String> listOption(String key) {
        if (!has(key)) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        Arrays.stream(options.get(key).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(values::add);
        return values;
    }
}
