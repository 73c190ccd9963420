package com.largomodo.platelayout.service.encode;

import java.util.Locale;
import java.util.Optional;

/**
 * Document output formats, selected by output file extension.
 */
public enum OutputFormat {
    PDF("pdf"),     // one file, one PDF page per plate
    SVG("svg"),     // one file per plate
    JPEG("jpg"),    // one file per plate
    PNG("png");     // one file per plate

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * ImageIO writer name for raster formats.
     */
    public String getImageIoName() {
        return switch (this) {
            case JPEG -> "jpg";
            case PNG -> "png";
            case PDF, SVG -> throw new IllegalStateException(this + " is not a raster format");
        };
    }

    public static Optional<OutputFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return switch (fileName.substring(dot + 1).toLowerCase(Locale.ROOT)) {
            case "pdf" -> Optional.of(PDF);
            case "svg" -> Optional.of(SVG);
            case "jpg", "jpeg" -> Optional.of(JPEG);
            case "png" -> Optional.of(PNG);
            default -> Optional.empty();
        };
    }
}
