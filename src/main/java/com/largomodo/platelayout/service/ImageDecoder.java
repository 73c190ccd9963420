package com.largomodo.platelayout.service;

import com.largomodo.platelayout.core.domain.Size;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Image decoding capability.
 */
public interface ImageDecoder {

    /**
     * Reads only as much of the file as needed to report its pixel dimensions.
     *
     * @throws ImageLoadException if the file is not a readable image
     * @throws IOException        on I/O errors
     */
    Size probe(Path source) throws IOException;

    /**
     * Decodes the full pixel buffer.
     *
     * @throws ImageLoadException if the file is not a readable image
     * @throws IOException        on I/O errors
     */
    BufferedImage decode(Path source) throws IOException;
}
