package com.largomodo.platelayout.core;

import com.largomodo.platelayout.core.annotation.AnnotationCompositor;
import com.largomodo.platelayout.core.annotation.CaptionLayout;
import com.largomodo.platelayout.core.annotation.SequenceCounter;
import com.largomodo.platelayout.core.annotation.TextMeasurer;
import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.config.LayoutMode;
import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.FailureKind;
import com.largomodo.platelayout.core.domain.ImageBatch;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.domain.PlacedImage;
import com.largomodo.platelayout.core.pagination.Pagination;
import com.largomodo.platelayout.core.pagination.Paginator;
import com.largomodo.platelayout.core.placement.PlacementStrategy;
import com.largomodo.platelayout.core.placement.PlacementStrategyFactory;
import com.largomodo.platelayout.core.scale.FirstPageProbe;
import com.largomodo.platelayout.core.scale.RenderSizer;
import com.largomodo.platelayout.core.scale.ScaleResolution;
import com.largomodo.platelayout.core.scale.ScaleResolver;
import com.largomodo.platelayout.core.sort.SortEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout generation pipeline: sort, resolve scale, place and paginate, annotate, assemble.
 * <p>
 * Partial success is the default. Images that failed to load, cannot fit the page even at the
 * minimum scale, or lack a manual position are left out and listed on the document. Only an
 * invalid configuration fails a request, and that already happens when the
 * {@link LayoutConfig} is built.
 * </p>
 * <p>
 * The engine keeps no state between requests; independent requests may run concurrently on
 * one instance. Within a request everything runs sequentially on the calling thread.
 * </p>
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    // Upper bound for auto scale when every image is tiny
    static final double MAX_AUTO_SCALE = 10.0;

    private final SortEngine sortEngine;
    private final ScaleResolver scaleResolver;
    private final PlacementStrategyFactory strategies;
    private final Paginator paginator;
    private final AnnotationCompositor compositor;
    private final DocumentAssembler assembler;
    private final TextMeasurer measurer;
    private final GenerationObserver observer;

    public LayoutEngine(TextMeasurer measurer) {
        this(measurer, new GenerationObserver() {});
    }

    public LayoutEngine(TextMeasurer measurer, GenerationObserver observer) {
        this(new SortEngine(), new ScaleResolver(), new PlacementStrategyFactory(), new Paginator(),
                new AnnotationCompositor(measurer), new DocumentAssembler(), measurer, observer);
    }

    public LayoutEngine(SortEngine sortEngine, ScaleResolver scaleResolver, PlacementStrategyFactory strategies,
                        Paginator paginator, AnnotationCompositor compositor, DocumentAssembler assembler,
                        TextMeasurer measurer, GenerationObserver observer) {
        this.sortEngine = sortEngine;
        this.scaleResolver = scaleResolver;
        this.strategies = strategies;
        this.paginator = paginator;
        this.compositor = compositor;
        this.assembler = assembler;
        this.measurer = measurer;
        this.observer = observer;
    }

    public Document generate(List<ImageItem> images, LayoutConfig config) {
        return generate(ImageBatch.of(images), config);
    }

    /**
     * Lays out every image of the batch. Load failures already on the batch are carried over to
     * the document.
     */
    public Document generate(ImageBatch batch, LayoutConfig config) {
        log.info("Generating {} layout for {} images", config.mode().name().toLowerCase(), batch.images().size());
        Prepared prepared = prepare(batch, config);

        Pagination pagination = paginator.paginate(prepared.eligible(), config, prepared.scale().factor(),
                prepared.captions(), prepared.strategy());
        reject(pagination.rejected(), prepared.failures());

        SequenceCounter counter = new SequenceCounter(config.numbering().startNumber());
        List<Page> pages = new ArrayList<>(pagination.pages().size());
        for (Page page : pagination.pages()) {
            Page composed = compositor.compose(page, config, prepared.scale().factor(), counter);
            pages.add(composed);
            observer.onPageCompleted(composed);
        }

        Document document = assembler.assemble(pages, config, prepared.scale(), prepared.failures());
        log.info("Placed {} images on {} pages ({})", document.totalImages(), document.totalPages(),
                document.status());
        return document;
    }

    public Page previewFirstPage(List<ImageItem> images, LayoutConfig config) {
        return previewFirstPage(ImageBatch.of(images), config);
    }

    /**
     * Runs the pipeline up to page 0 only. The result equals page 0 of {@link #generate} for the
     * same input.
     */
    public Page previewFirstPage(ImageBatch batch, LayoutConfig config) {
        return previewDocument(batch, config).pages().get(0);
    }

    /**
     * One-page document holding the preview page, ready for an encoder. Failures cover load
     * failures, oversized images and what the strategy rejected while filling page 0.
     */
    public Document previewDocument(ImageBatch batch, LayoutConfig config) {
        log.debug("Previewing first page of {} images", batch.images().size());
        Prepared prepared = prepare(batch, config);
        Pagination pagination = paginator.paginateFirstPage(prepared.eligible(), config,
                prepared.scale().factor(), prepared.captions(), prepared.strategy());
        reject(pagination.rejected(), prepared.failures());
        SequenceCounter counter = new SequenceCounter(config.numbering().startNumber());
        Page page = compositor.compose(pagination.firstPage(), config, prepared.scale().factor(), counter);
        return assembler.assemble(List.of(page), config, prepared.scale(), prepared.failures());
    }

    private Prepared prepare(ImageBatch batch, LayoutConfig config) {
        List<ImageFailure> failures = new ArrayList<>(batch.failures());
        for (ImageFailure failure : batch.failures()) {
            observer.onImageRejected(failure);
        }

        CaptionLayout captions = new CaptionLayout(config.caption(), measurer);
        PlacementStrategy strategy = strategies.get(config.mode());
        List<ImageItem> sorted = sortEngine.sort(batch.images(), config.sort());

        List<ImageItem> eligible = new ArrayList<>(sorted.size());
        double upperBound = MAX_AUTO_SCALE;
        double minScale = config.scale().minScale();
        for (ImageItem item : sorted) {
            if (config.mode() == LayoutMode.MANUAL) {
                eligible.add(item);
                continue;
            }
            double fit = RenderSizer.fitScale(item, config.contentWidth(),
                    config.contentHeight() - captions.reserve(item).height());
            if (fit < minScale) {
                ImageFailure failure = new ImageFailure(item.id(), FailureKind.OVERSIZED_IMAGE,
                        item.name() + " (" + item.width() + "x" + item.height()
                                + ") does not fit the page content area at the minimum scale " + minScale);
                reject(List.of(failure), failures);
                continue;
            }
            upperBound = Math.min(upperBound, fit);
            eligible.add(item);
        }

        ScaleResolution scale = scaleResolver.resolve(config.scale(), upperBound,
                probe(eligible, config, captions, strategy));
        observer.onScaleResolved(scale);
        return new Prepared(eligible, failures, scale, captions, strategy);
    }

    private FirstPageProbe probe(List<ImageItem> eligible, LayoutConfig config, CaptionLayout captions,
                                 PlacementStrategy strategy) {
        return scale -> {
            Page first = paginator.paginateFirstPage(eligible, config, scale, captions, strategy).firstPage();
            boolean uniform = first.images().stream().noneMatch(PlacedImage::fitted);
            return new FirstPageProbe.Result(first.imageCount(), uniform);
        };
    }

    private void reject(List<ImageFailure> rejected, List<ImageFailure> failures) {
        for (ImageFailure failure : rejected) {
            log.warn("Skipping {}: {}", failure.imageId(), failure.message());
            failures.add(failure);
            observer.onImageRejected(failure);
        }
    }

    private record Prepared(List<ImageItem> eligible, List<ImageFailure> failures, ScaleResolution scale,
                            CaptionLayout captions, PlacementStrategy strategy) {
    }
}
