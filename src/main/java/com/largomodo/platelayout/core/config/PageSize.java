package com.largomodo.platelayout.core.config;

import com.largomodo.platelayout.core.domain.Size;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named page presets in pixels. Paper sizes are given at 300 dpi.
 */
public enum PageSize {
    A4("A4", 2480, 3508),
    A3("A3", 3508, 4961),
    HD("HD", 1920, 1080),
    UHD_4K("4K", 3840, 2160),
    LETTER("LETTER", 2550, 3300);

    private static final Pattern CUSTOM = Pattern.compile("^\\s*(\\d+)\\s*[xX]\\s*(\\d+)\\s*$");

    private final String label;
    private final int width;
    private final int height;

    PageSize(String label, int width, int height) {
        this.label = label;
        this.width = width;
        this.height = height;
    }

    public String getLabel() {
        return label;
    }

    public Size toSize() {
        return new Size(width, height);
    }

    public static Optional<PageSize> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = label.trim().toUpperCase(Locale.ROOT);
        for (PageSize size : values()) {
            if (size.label.equals(wanted) || size.name().equals(wanted)) {
                return Optional.of(size);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a preset label or a custom {@code WIDTHxHEIGHT} value.
     *
     * @throws InvalidLayoutConfigException if the value is neither
     */
    public static Size resolve(String value) {
        Optional<PageSize> preset = fromLabel(value);
        if (preset.isPresent()) {
            return preset.get().toSize();
        }
        if (value != null) {
            Matcher m = CUSTOM.matcher(value);
            if (m.matches()) {
                try {
                    int w = Integer.parseInt(m.group(1));
                    int h = Integer.parseInt(m.group(2));
                    if (w > 0 && h > 0) {
                        return new Size(w, h);
                    }
                } catch (NumberFormatException e) {
                    throw new InvalidLayoutConfigException("Page size out of range: " + value, e);
                }
            }
        }
        throw new InvalidLayoutConfigException(
                "Invalid page size: " + value + ". Supported: A4, A3, HD, 4K, LETTER or WIDTHxHEIGHT");
    }
}
