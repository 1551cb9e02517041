package com.cheader.extractor.parser.exception;

/**
 * The compiler frontend exited with a nonzero status.
 */
public class ToolInvocationException extends HeaderParseException {

    private static final long serialVersionUID = 1L;

    private final int exitCode;
    private final String diagnostics;

    public ToolInvocationException(String tool, int exitCode, String diagnostics) {
        super(tool + " failed: " + describe(tool, exitCode, diagnostics));
        this.exitCode = exitCode;
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    protected ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.diagnostics = "";
    }

    private static String describe(String tool, int exitCode, String diagnostics) {
        if (diagnostics == null || diagnostics.isBlank()) {
            return tool + " exited with code " + exitCode;
        }
        return diagnostics.trim();
    }

    public int getExitCode() {
        return exitCode;
    }

    /** Captured standard-error text, possibly empty. */
    public String getDiagnostics() {
        return diagnostics;
    }
}
