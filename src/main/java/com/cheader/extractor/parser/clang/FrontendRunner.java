package com.cheader.extractor.parser.clang;

import com.cheader.extractor.parser.HeaderParserOptions;

/**
 * Runs the compiler frontend in one mode and returns its standard output.
 */
@FunctionalInterface
public interface FrontendRunner {

    /**
     * @throws com.cheader.extractor.parser.exception.ToolInvocationException on nonzero exit
     * @throws com.cheader.extractor.parser.exception.ToolLaunchException if the binary cannot be started
     */
    String run(HeaderParserOptions options, ClangMode mode);
}
