package com.largomodo.platelayout.service;

import com.largomodo.platelayout.core.domain.Size;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link ImageDecoder} backed by {@code javax.imageio}. Stateless, safe for concurrent use.
 */
public class ImageIoDecoder implements ImageDecoder {

    @Override
    public Size probe(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new ImageLoadException("Image file does not exist: " + source);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                throw new ImageLoadException("Cannot open image stream: " + source);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageLoadException("Unsupported image format: " + source.getFileName());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width < 1 || height < 1) {
                    throw new ImageLoadException("Image has no pixels: " + source.getFileName());
                }
                return new Size(width, height);
            } catch (IllegalStateException | IndexOutOfBoundsException e) {
                throw new ImageLoadException("Corrupt image header: " + source.getFileName(), e);
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public BufferedImage decode(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new ImageLoadException("Image file does not exist: " + source);
        }
        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) {
            throw new ImageLoadException("Unsupported image format: " + source.getFileName());
        }
        return image;
    }
}
