package com.largomodo.platelayout.service.encode;

import java.io.IOException;

/**
 * Thrown when a document cannot be written in the requested format. The document itself is
 * unaffected and may be encoded again in another format.
 */
public class EncodingException extends IOException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
