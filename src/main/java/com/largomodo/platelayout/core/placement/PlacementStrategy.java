package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.domain.ImageItem;

import java.util.List;

/**
 * Strategy interface for distributing images over pages.
 * <p>
 * Implementations are stateless between calls and deterministic: the same images, config,
 * scale and caption metrics always produce the same placement. Coordinates are relative to the
 * page content box. Except in manual mode, every placed rectangle together with its caption
 * block lies inside the content box and keeps at least {@code spacing} pixels from every other
 * one on the same page.
 */
public interface PlacementStrategy {

    /**
     * @param images   images in display order
     * @param config   validated layout configuration
     * @param scale    requested render scale
     * @param captions caption block size per image, {@link CaptionMetrics#NONE} without captions
     * @return pages of placed images plus the images that could not be placed
     */
    Placement place(List<ImageItem> images, LayoutConfig config, double scale, CaptionMetrics captions);
}
