package com.largomodo.platelayout.core.domain;

import com.largomodo.platelayout.core.scale.ScaleResolution;

import java.util.List;

/**
 * Finished layout: ordered pages plus everything needed to encode them.
 * <p>
 * Page indices are contiguous from zero. Image and overlay coordinates are relative to the
 * content box; encoders offset them by {@link #margin()}.
 * </p>
 *
 * @param pages      pages in output order
 * @param pageWidth  full page width in pixels, margins included
 * @param pageHeight full page height in pixels, margins included
 * @param margin     margin on every side in pixels
 * @param scale      the scale the document was laid out at
 * @param failures   images that were not placed, with the reason
 */
public record Document(List<Page> pages, int pageWidth, int pageHeight, int margin,
                       ScaleResolution scale, List<ImageFailure> failures) {

    public Document {
        pages = List.copyOf(pages);
        failures = List.copyOf(failures);
        for (int i = 0; i < pages.size(); i++) {
            if (pages.get(i).index() != i) {
                throw new IllegalArgumentException(
                        "Page indices must be contiguous from 0, found " + pages.get(i).index() + " at " + i);
            }
        }
    }

    public int totalPages() {
        return pages.size();
    }

    public int totalImages() {
        return pages.stream().mapToInt(Page::imageCount).sum();
    }

    public PlacementStatus status() {
        return failures.isEmpty() ? PlacementStatus.FULLY_PLACED : PlacementStatus.PARTIALLY_PLACED;
    }
}
