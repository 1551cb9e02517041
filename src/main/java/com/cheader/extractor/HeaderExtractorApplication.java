package com.cheader.extractor;

import com.cheader.extractor.cli.ParseCommand;

import picocli.CommandLine;

/**
 * Main entry point for the C/C++ header declaration extractor.
 * Runs clang over one header and reports the declarations physically defined in it.
 */
public class HeaderExtractorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParseCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
