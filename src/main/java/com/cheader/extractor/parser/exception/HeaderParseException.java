package com.cheader.extractor.parser.exception;

/**
 * Base class for every failure of the header extraction pipeline.
 */
public class HeaderParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public HeaderParseException(String message) {
        super(message);
    }

    public HeaderParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
