package com.largomodo.platelayout.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Recognizes photograph files by extension.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use.
 */
public final class ImageFileMatcher {

    private static final Set<String> EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".bmp", ".gif", ".tif", ".tiff"
    );

    private ImageFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file to check, may be {@code null}
     * @return true if path is a regular file with a supported image extension
     */
    public static boolean isImage(Path path) {
        if (path == null) {
            return false;  // safe as a stream filter
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        return hasImageExtension(path.getFileName().toString());
    }

    public static boolean hasImageExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
