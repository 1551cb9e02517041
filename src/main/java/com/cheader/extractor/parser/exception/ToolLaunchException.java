package com.cheader.extractor.parser.exception;

/**
 * The compiler frontend binary could not be started at all.
 */
public class ToolLaunchException extends ToolInvocationException {

    private static final long serialVersionUID = 1L;

    public ToolLaunchException(String tool, Throwable cause) {
        super("Failed to run " + tool + ": " + cause.getMessage(), cause);
    }
}
