package com.cheader.extractor.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "parse" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ParseOptions {

    @Parameters(index = "0", paramLabel = "HEADER", description = "C/C++ header file to parse")
    private Path headerFile;

    @Option(names = { "--include", "-I" }, paramLabel = "DIR", description = "Additional include directory (repeatable)")
    private List<String> includePaths = new ArrayList<>();

    @Option(names = { "--define", "-D" }, paramLabel = "NAME[=VALUE]", description = "Preprocessor definition (repeatable), e.g. -D STM32L552xx")
    private List<String> defines = new ArrayList<>();

    @Option(names = { "--verbose", "-v" }, description = "Log frontend commands and per-declaration progress")
    private boolean verbose;

    @Option(names = { "--macros" }, negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Extract #define macros (default: ${DEFAULT-VALUE}); --no-macros skips the preprocessor pass")
    private boolean includeMacros;

    @Option(names = { "--macro-prefix" }, split = ",", paramLabel = "PREFIX",
            description = "Keep only macros starting with one of these prefixes (comma-separated or repeatable)")
    private List<String> macroPrefixes = new ArrayList<>();

    @Option(names = { "--clang" }, defaultValue = "${env:CLANG:-clang}",
            description = "clang binary to run (default: $CLANG or 'clang')")
    private String clangBinary;

    @Option(names = { "--extra-arg", "-X" }, paramLabel = "ARG",
            description = "Raw argument passed to clang before the mode flags, e.g. -X=-xc++ (repeatable)")
    private List<String> extraArgs = new ArrayList<>();

    @Option(names = { "--group-namespaces" }, description = "Nest C++ namespace members under namespace declarations")
    private boolean groupNamespaces;

    @Option(names = { "--output", "-o" }, paramLabel = "FILE", description = "Write the declarations as JSON to this file")
    private Path output;

    @Option(names = { "--json" }, description = "Print the declarations as JSON to standard output")
    private boolean json;
}
