package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.service.ImageDecoder;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Decodes source pixels for one encoding run, each file at most once.
 * <p>
 * Items without a source file are drawn as a flat grey placeholder. Not thread-safe.
 */
class ImagePixels {

    private static final Color PLACEHOLDER = new Color(0xCC, 0xCC, 0xCC);

    private final ImageDecoder decoder;
    private final Map<Path, BufferedImage> cache = new HashMap<>();

    ImagePixels(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    BufferedImage get(ImageItem item) throws EncodingException {
        Path source = item.source();
        if (source == null) {
            return placeholder();
        }
        BufferedImage cached = cache.get(source);
        if (cached != null) {
            return cached;
        }
        try {
            BufferedImage image = decoder.decode(source);
            cache.put(source, image);
            return image;
        } catch (IOException e) {
            throw new EncodingException("Cannot read pixels of " + item.name() + ": " + e.getMessage(), e);
        }
    }

    private static BufferedImage placeholder() {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, PLACEHOLDER.getRGB());
        return image;
    }
}
