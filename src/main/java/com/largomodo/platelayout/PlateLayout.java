package com.largomodo.platelayout;

import com.largomodo.platelayout.core.GenerationObserver;
import com.largomodo.platelayout.core.LayoutEngine;
import com.largomodo.platelayout.core.config.InvalidLayoutConfigException;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.config.LayoutOptions;
import com.largomodo.platelayout.core.config.NumberPosition;
import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.ImageBatch;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.scale.ScaleResolution;
import com.largomodo.platelayout.service.AwtTextMeasurer;
import com.largomodo.platelayout.service.ImageDecoder;
import com.largomodo.platelayout.service.ImageIoDecoder;
import com.largomodo.platelayout.service.ImageLoader;
import com.largomodo.platelayout.service.MetadataLoader;
import com.largomodo.platelayout.service.XlsxMetadataLoader;
import com.largomodo.platelayout.service.encode.DocumentEncoder;
import com.largomodo.platelayout.service.encode.EncoderFactory;
import com.largomodo.platelayout.service.encode.EncodingException;
import com.largomodo.platelayout.service.encode.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for laying out artefact photographs on printable plates.
 * <p>
 * Reads every image in the input folder, attaches spreadsheet metadata when given, lays the
 * images out and writes the plates in the format named by the output extension.
 * <p>
 * Option precedence: typed options override {@code --config}, which overrides the built-in
 * defaults. Without {@code -o} the plates go to {@code <input>/export/plates.pdf}.
 */
@Command(
        name = "platelayout",
        mixinStandardHelpOptions = true,
        resourceBundle = "platelayout.platelayout",
        version = "${bundle:application.version}",
        header = "Arranges artefact photographs into printable plates.",
        description = {
                "Lays out a folder of photographs on one or more pages using a grid, rectangle packing" +
                        " (puzzle), column flow (masonry) or caller supplied positions (manual).",
                "",
                "Captions, a scale bar, plate numbers and group dividers are drawn on top. Output is PDF," +
                        " SVG, JPEG or PNG, chosen by the output file extension."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion (some images may have been skipped)",
                "1:General execution error (I/O, encoding)",
                "2:Invalid command line arguments or layout configuration"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class PlateLayout implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlateLayout.class);

    static final String DEFAULT_OUTPUT = "export/plates.pdf";

    @Parameters(index = "0", paramLabel = "INPUT",
            description = "Folder containing the photographs (.png, .jpg, .jpeg, .bmp, .gif, .tif, .tiff).")
    File inputDir;

    @Option(names = {"-o", "--output"},
            description = {
                    "Output file. The extension selects the format: pdf, svg, jpg/jpeg or png.",
                    "Multi-page SVG and raster output is written as <name>_page_<n>.<ext>.",
                    "Default: <INPUT>/" + DEFAULT_OUTPUT
            })
    File outputFile;

    @Option(names = "--metadata", paramLabel = "XLSX",
            description = "Spreadsheet with file names in column A and one metadata field per column.")
    File metadataFile;

    @Option(names = "--config", paramLabel = "PROPERTIES",
            description = "Layout options file (key=value). Typed options below take precedence.")
    File configFile;

    @Option(names = "--mode", description = "Layout mode. Valid values: ${COMPLETION-CANDIDATES}")
    LayoutMode mode;

    @Option(names = "--page-size", description = "A4, A3, HD, 4K, LETTER or WIDTHxHEIGHT in pixels.")
    String pageSize;

    @Option(names = "--margin", description = "Page margin in pixels.")
    Integer margin;

    @Option(names = "--spacing", description = "Gap between images in pixels.")
    Integer spacing;

    @Option(names = "--rows", description = "Grid rows per page.")
    Integer rows;

    @Option(names = "--cols", description = "Grid columns per page.")
    Integer cols;

    @Option(names = "--columns", description = "Masonry column count.")
    Integer masonryColumns;

    @Option(names = "--scale", description = "Fixed scale factor applied to every image.")
    Double scale;

    @Option(names = "--images-per-page",
            description = "Target image count for the first page; enables automatic scaling.")
    Integer imagesPerPage;

    @Option(names = "--sort-by",
            description = "alphabetical, natural_name, random, none or a metadata field name.")
    String sortBy;

    @Option(names = "--sort-order", description = "asc or desc.")
    String sortOrder;

    @Option(names = "--then-by", description = "Secondary sort key, same values as --sort-by.")
    String sortBySecondary;

    @Option(names = "--then-order", description = "asc or desc for the secondary key.")
    String sortOrderSecondary;

    @Option(names = "--seed", description = "Seed for random ordering.")
    Long seed;

    @Option(names = "--break-on-change", negatable = true,
            description = "Separate groups when the primary sort field changes value.")
    Boolean breakOnChange;

    @Option(names = "--break-kind", description = "new_page or divider.")
    String breakKind;

    @Option(names = "--caption", negatable = true, description = "Draw captions under images.")
    Boolean caption;

    @Option(names = "--caption-fields", split = ",", description = "Metadata fields to print in captions.")
    List<String> captionFields;

    @Option(names = "--hide-field-names", description = "Print only field values in captions.")
    Boolean hideFieldNames;

    @Option(names = "--remove-extension", description = "Drop the file extension from caption names.")
    Boolean removeExtension;

    @Option(names = "--scale-bar", negatable = true, description = "Draw a scale bar on every page.")
    Boolean scaleBar;

    @Option(names = "--scale-bar-cm", description = "Physical length of the scale bar in centimetres.")
    Double scaleBarCm;

    @Option(names = "--pixels-per-cm", description = "Source image resolution in pixels per centimetre.")
    Double pixelsPerCm;

    @Option(names = "--numbers", negatable = true, description = "Draw plate numbers.")
    Boolean numbers;

    @Option(names = "--number-start", description = "First plate number.")
    Integer numberStart;

    @Option(names = "--number-position", description = "Valid values: ${COMPLETION-CANDIDATES}")
    NumberPosition numberPosition;

    @Option(names = "--number-prefix", description = "Text before each plate number.")
    String numberPrefix;

    @Option(names = "--number-scope", description = "image or page.")
    String numberScope;

    @Option(names = "--margin-border", description = "Outline the page edge and the content area.")
    Boolean marginBorder;

    @Option(names = "--dpi", description = "Output resolution for PDF page sizing.")
    Integer dpi;

    @Option(names = "--preview", description = "Lay out and write the first page only.")
    boolean preview;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new PlateLayout());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Input folder does not exist: " + inputDir.getAbsolutePath());
        }
        Path output = outputFile != null
                ? outputFile.toPath()
                : inputDir.toPath().resolve(DEFAULT_OUTPUT);
        OutputFormat format = OutputFormat.fromFileName(output.getFileName().toString())
                .orElseThrow(() -> new ParameterException(spec.commandLine(),
                        "Unsupported output format: " + output.getFileName() + ". Use .pdf, .svg, .jpg or .png"));

        LayoutConfig config = buildConfig();

        Map<String, Map<String, String>> metadata = Map.of();
        if (metadataFile != null) {
            if (!metadataFile.isFile()) {
                throw new ParameterException(spec.commandLine(),
                        "Metadata file does not exist: " + metadataFile.getAbsolutePath());
            }
            MetadataLoader metadataLoader = new XlsxMetadataLoader();
            metadata = metadataLoader.load(metadataFile.toPath());
        }

        ImageDecoder decoder = new ImageIoDecoder();
        ImageBatch batch = new ImageLoader(decoder).loadFolder(inputDir.toPath(), metadata);

        LayoutEngine engine = new LayoutEngine(new AwtTextMeasurer(), progressObserver());
        Document document = preview ? engine.previewDocument(batch, config) : engine.generate(batch, config);

        DocumentEncoder encoder = new EncoderFactory(decoder).get(format, config.dpi());
        List<Path> written;
        try {
            written = encoder.write(document, output);
        } catch (EncodingException e) {
            log.error("Cannot write {} output: {}", format, e.getMessage());
            return 1;
        }

        for (ImageFailure failure : document.failures()) {
            log.warn("Not placed: {} ({}): {}", failure.imageId(),
                    failure.kind().name().toLowerCase(Locale.ROOT), failure.message());
        }
        log.info("Placed {} images on {} pages, {} skipped; wrote {} file(s) to {}",
                document.totalImages(), document.totalPages(), document.failures().size(),
                written.size(), output.toAbsolutePath().getParent());
        return 0;
    }

    private LayoutConfig buildConfig() throws IOException {
        LayoutOptions options = configFile != null
                ? LayoutOptions.load(configFile.toPath())
                : new LayoutOptions(Map.of());
        try {
            return options.merge(typedOptions()).toConfig();
        } catch (InvalidLayoutConfigException e) {
            throw new ParameterException(spec.commandLine(), "Invalid layout configuration: " + e.getMessage(), e);
        }
    }

    Map<String, String> typedOptions() {
        Map<String, String> map = new LinkedHashMap<>();
        put(map, LayoutOptions.MODE, mode == null ? null : mode.name());
        put(map, LayoutOptions.PAGE_SIZE, pageSize);
        put(map, LayoutOptions.MARGIN, margin);
        put(map, LayoutOptions.SPACING, spacing);
        put(map, LayoutOptions.GRID_ROWS, rows);
        put(map, LayoutOptions.GRID_COLS, cols);
        put(map, LayoutOptions.MASONRY_COLUMNS, masonryColumns);
        put(map, LayoutOptions.SCALE_FACTOR, scale);
        put(map, LayoutOptions.IMAGES_PER_PAGE, imagesPerPage);
        put(map, LayoutOptions.SORT_BY, sortBy);
        put(map, LayoutOptions.SORT_ORDER, sortOrder);
        put(map, LayoutOptions.SORT_BY_SECONDARY, sortBySecondary);
        put(map, LayoutOptions.SORT_ORDER_SECONDARY, sortOrderSecondary);
        put(map, LayoutOptions.RANDOM_SEED, seed);
        put(map, LayoutOptions.PAGE_BREAK, breakOnChange);
        put(map, LayoutOptions.BREAK_KIND, breakKind);
        put(map, LayoutOptions.ADD_CAPTION, caption);
        put(map, LayoutOptions.CAPTION_FIELDS, captionFields == null ? null : String.join(",", captionFields));
        put(map, LayoutOptions.HIDE_FIELD_NAMES, hideFieldNames);
        put(map, LayoutOptions.REMOVE_EXTENSION, removeExtension);
        put(map, LayoutOptions.ADD_SCALE_BAR, scaleBar);
        put(map, LayoutOptions.SCALE_BAR_CM, scaleBarCm);
        put(map, LayoutOptions.PIXELS_PER_CM, pixelsPerCm);
        put(map, LayoutOptions.ADD_TABLE_NUMBER, numbers);
        put(map, LayoutOptions.TABLE_START, numberStart);
        put(map, LayoutOptions.TABLE_POSITION, numberPosition == null ? null : numberPosition.name());
        put(map, LayoutOptions.TABLE_PREFIX, numberPrefix);
        put(map, LayoutOptions.TABLE_SCOPE, numberScope);
        put(map, LayoutOptions.MARGIN_BORDER, marginBorder);
        put(map, LayoutOptions.OUTPUT_DPI, dpi);
        return map;
    }

    private static void put(Map<String, String> map, String key, Object value) {
        if (value != null) {
            map.put(key, value.toString());
        }
    }

    private static GenerationObserver progressObserver() {
        return new GenerationObserver() {
            @Override
            public void onScaleResolved(ScaleResolution resolution) {
                if (resolution.auto() && !resolution.feasible()) {
                    log.warn("Requested {} images per page, first page holds {}",
                            resolution.target(), resolution.achieved());
                }
            }

            @Override
            public void onPageCompleted(Page page) {
                log.info("Page {}: {} images", page.index() + 1, page.imageCount());
            }
        };
    }
}
