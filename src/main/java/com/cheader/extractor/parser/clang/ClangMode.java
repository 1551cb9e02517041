package com.cheader.extractor.parser.clang;

import java.util.List;

/**
 * The two ways the frontend is invoked.
 */
public enum ClangMode {

    /** Syntax-only check, AST written to stdout as JSON. */
    AST_DUMP(List.of("-Xclang", "-ast-dump=json", "-fsyntax-only")),

    /** Preprocess only, dumping every macro definition. */
    MACRO_DUMP(List.of("-E", "-dM"));

    private final List<String> flags;

    ClangMode(List<String> flags) {
        this.flags = flags;
    }

    public List<String> getFlags() {
        return flags;
    }
}
