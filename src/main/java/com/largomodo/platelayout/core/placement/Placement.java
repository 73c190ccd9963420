package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.PlacedImage;

import java.util.List;

/**
 * Output of a placement strategy.
 *
 * @param pages    placed images per page, page index {@code i} holds images with {@code pageIndex == i}
 * @param rejected images the strategy could not place
 */
public record Placement(List<List<PlacedImage>> pages, List<ImageFailure> rejected) {

    public Placement {
        pages = pages.stream().map(List::copyOf).toList();
        rejected = List.copyOf(rejected);
    }

    public int firstPageCount() {
        return pages.isEmpty() ? 0 : pages.get(0).size();
    }

    public List<PlacedImage> firstPage() {
        return pages.isEmpty() ? List.of() : pages.get(0);
    }
}
