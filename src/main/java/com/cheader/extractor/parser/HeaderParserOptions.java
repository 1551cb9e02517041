package com.cheader.extractor.parser;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Inputs for a single header extraction run.
 */
@Value
@Builder(toBuilder = true)
public class HeaderParserOptions {

    public static final String DEFAULT_CLANG = "clang";

    /** Header file to parse. */
    @NonNull
    Path headerFile;

    /** Extra include directories, passed as {@code -I<path>}. */
    @Singular
    List<String> includePaths;

    /** Preprocessor definitions, passed as {@code -D<define>}, e.g. {@code STM32L552xx}. */
    @Singular
    List<String> defines;

    boolean verbose;

    /** Run the macro pass. It can be slow on large vendor headers. */
    @Builder.Default
    boolean includeMacros = true;

    /** Keep only macros starting with one of these prefixes; empty keeps all. */
    @Singular
    List<String> macroPrefixes;

    @NonNull
    @Builder.Default
    String clangBinary = DEFAULT_CLANG;

    /** Raw frontend arguments placed after the include/define flags, e.g. {@code -x c++}. */
    @Singular
    List<String> extraArgs;

    /** Reassemble namespace members into {@code NamespaceDecl}s instead of a flat list. */
    boolean groupNamespaces;

    /**
     * Default options for a header: no includes, no defines, macros on.
     */
    public static HeaderParserOptions defaultOptions(Path headerFile) {
        return HeaderParserOptions.builder()
                .headerFile(headerFile)
                .build();
    }
}
