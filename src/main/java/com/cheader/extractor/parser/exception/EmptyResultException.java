package com.cheader.extractor.parser.exception;

/**
 * A well-formed run that produced no usable declarations.
 */
public class EmptyResultException extends HeaderParseException {

    private static final long serialVersionUID = 1L;

    public EmptyResultException(String headerName) {
        super("Parse succeeded but no declarations found in " + headerName + ".");
    }
}
