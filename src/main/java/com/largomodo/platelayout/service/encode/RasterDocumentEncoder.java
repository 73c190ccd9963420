package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.service.AwtTextMeasurer;
import com.largomodo.platelayout.service.ImageDecoder;
import com.largomodo.platelayout.util.FileNameUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every page as a JPEG or PNG image at full page resolution.
 */
public class RasterDocumentEncoder implements DocumentEncoder {

    private static final Logger log = LoggerFactory.getLogger(RasterDocumentEncoder.class);

    private final OutputFormat format;
    private final ImageDecoder decoder;
    private final Java2dPageRenderer renderer = new Java2dPageRenderer(AwtTextMeasurer.DEFAULT_FAMILY);

    public RasterDocumentEncoder(OutputFormat format, ImageDecoder decoder) {
        if (format != OutputFormat.JPEG && format != OutputFormat.PNG) {
            throw new IllegalArgumentException("Not a raster format: " + format);
        }
        this.format = format;
        this.decoder = decoder;
    }

    @Override
    public OutputFormat format() {
        return format;
    }

    @Override
    public List<Path> write(Document document, Path target) throws EncodingException {
        ImagePixels pixels = new ImagePixels(decoder);
        List<Path> written = new ArrayList<>(document.totalPages());
        for (Page page : document.pages()) {
            Path file = FileNameUtil.pagePath(target, page.index(), document.totalPages(), format.getExtension());
            BufferedImage image = renderer.render(document, page, pixels);
            boolean supported;
            try {
                Files.createDirectories(file.getParent());
                supported = ImageIO.write(image, format.getImageIoName(), file.toFile());
            } catch (IOException e) {
                throw new EncodingException("Cannot write " + file + ": " + e.getMessage(), e);
            }
            if (!supported) {
                throw new EncodingException("No ImageIO writer for " + format);
            }
            log.debug("Wrote page {} to {}", page.index() + 1, file);
            written.add(file);
        }
        return written;
    }
}
