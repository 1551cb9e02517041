package com.cheader.extractor.parser.exception;

/**
 * The AST dump could not be decoded into a node tree.
 */
public class TreeDecodeException extends HeaderParseException {

    private static final long serialVersionUID = 1L;

    public TreeDecodeException(String message) {
        super(message);
    }

    public TreeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
