package com.largomodo.platelayout.core.domain;

import com.largomodo.platelayout.core.domain.overlay.Overlay;

import java.util.ArrayList;
import java.util.List;

/**
 * One output page. Images are listed in paint order, overlays are painted after them.
 */
public record Page(int index, List<PlacedImage> images, List<Overlay> overlays) {

    public Page {
        images = List.copyOf(images);
        overlays = List.copyOf(overlays);
    }

    public static Page empty(int index) {
        return new Page(index, List.of(), List.of());
    }

    public int imageCount() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    public Page withOverlays(List<Overlay> newOverlays) {
        return new Page(index, images, newOverlays);
    }

    /**
     * Moves the page and all of its images to another index.
     */
    public Page withIndex(int newIndex) {
        List<PlacedImage> moved = new ArrayList<>(images.size());
        for (PlacedImage image : images) {
            moved.add(image.withPageIndex(newIndex));
        }
        return new Page(newIndex, moved, overlays);
    }
}
