package com.largomodo.platelayout.core.domain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One photograph to be laid out.
 * <p>
 * Dimensions are the intrinsic pixel size of the decoded image. Metadata keeps the column
 * order of the spreadsheet it came from, which is also the order caption lines follow when
 * no explicit field selection is configured.
 * </p>
 *
 * @param id       stable key, used by manual positions
 * @param name     file name shown in captions and used by name sorts
 * @param source   file the pixels are read from at encoding time, may be {@code null} for synthetic items
 * @param width    intrinsic width in pixels
 * @param height   intrinsic height in pixels
 * @param metadata field name to value, insertion ordered and unmodifiable
 */
public record ImageItem(String id, String name, Path source, int width, int height, Map<String, String> metadata) {

    public ImageItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Image id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Image name cannot be blank");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Image " + name + " has non-positive dimensions " + width + "x" + height);
        }
        Map<String, String> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> copy.put(k, v == null ? "" : v));
        }
        metadata = Collections.unmodifiableMap(copy);
    }

    /**
     * Item without a backing file, keyed by its name.
     */
    public static ImageItem of(String name, int width, int height) {
        return new ImageItem(name, name, null, width, height, Map.of());
    }

    public static ImageItem of(String name, int width, int height, Map<String, String> metadata) {
        return new ImageItem(name, name, null, width, height, metadata);
    }

    /**
     * @return the trimmed field value, or {@code null} when the field is absent or blank
     */
    public String field(String fieldName) {
        String value = metadata.get(fieldName);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public ImageItem withMetadata(Map<String, String> newMetadata) {
        return new ImageItem(id, name, source, width, height, newMetadata);
    }
}
