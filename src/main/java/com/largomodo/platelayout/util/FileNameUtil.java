package com.largomodo.platelayout.util;

import java.nio.file.Path;

/**
 * File name helpers for captions and output naming.
 */
public final class FileNameUtil {

    private FileNameUtil() {
        // Static utility class - prevent instantiation
    }

    /**
     * Drops the last extension. Names starting with a dot and names without one come back
     * unchanged.
     */
    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return (dot > 0 && dot < fileName.length() - 1) ? fileName.substring(dot + 1) : "";
    }

    /**
     * Output file for one page. A single-page document is written to {@code target} with the
     * given extension, multi-page documents to {@code <stem>_page_<n>.<ext>}, numbered from 1.
     */
    public static Path pagePath(Path target, int pageIndex, int pageCount, String extension) {
        String stem = stripExtension(target.getFileName().toString());
        String name = pageCount <= 1
                ? stem + "." + extension
                : stem + "_page_" + (pageIndex + 1) + "." + extension;
        Path parent = target.toAbsolutePath().getParent();
        return parent == null ? Path.of(name) : parent.resolve(name);
    }
}
