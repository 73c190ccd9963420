package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.core.domain.Document;

import java.nio.file.Path;
import java.util.List;

/**
 * Serializes a finished document.
 */
public interface DocumentEncoder {

    OutputFormat format();

    /**
     * Writes the document next to {@code target}. Single-file formats write {@code target}
     * itself; per-page formats derive one name per page from it.
     *
     * @return the files written, in page order
     * @throws EncodingException if any page cannot be written
     */
    List<Path> write(Document document, Path target) throws EncodingException;
}
