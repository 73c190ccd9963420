package com.largomodo.platelayout.service.encode;

import com.largomodo.platelayout.service.ImageDecoder;

/**
 * Creates the encoder for an output format.
 */
public class EncoderFactory {

    private final ImageDecoder decoder;

    public EncoderFactory(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    /**
     * @param dpi output resolution, only used by formats measured in physical units
     */
    public DocumentEncoder get(OutputFormat format, int dpi) {
        if (format == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }
        return switch (format) {
            case PDF -> new PdfDocumentEncoder(decoder, dpi);
            case SVG -> new SvgDocumentEncoder(decoder);
            case JPEG, PNG -> new RasterDocumentEncoder(format, decoder);
        };
    }
}
