package com.largomodo.platelayout.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads per-image metadata from a table keyed by file name.
 */
public interface MetadataLoader {

    /**
     * @return file name to (field name to value), rows and columns in table order
     * @throws IOException if the file cannot be read or is not a supported table
     */
    Map<String, Map<String, String>> load(Path file) throws IOException;

    /**
     * @return field names in column order, without the file name column
     * @throws IOException if the file cannot be read or is not a supported table
     */
    List<String> headers(Path file) throws IOException;
}
