package com.cheader.extractor.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.cheader.extractor.cli.exception.OptionsValidationException;
import com.cheader.extractor.cli.model.ParseOptions;
import com.cheader.extractor.cli.model.ValidatedParseOptions;

public class ParseOptionsValidator {

    public ValidatedParseOptions validate(ParseOptions o) {
        List<String> errors = new ArrayList<>();

        Path header = o.getHeaderFile();
        if (header == null) {
            errors.add("Header file is required.");
        } else if (!Files.isRegularFile(header)) {
            errors.add("Header file does not exist or is not a regular file: " + header);
        }

        List<String> includePaths = cleanList(o.getIncludePaths());
        for (String include : includePaths) {
            if (!existsDirectory(Path.of(include))) {
                errors.add("Include directory does not exist or is not a directory: " + include);
            }
        }

        for (String define : o.getDefines()) {
            if (isBlank(define) || define.startsWith("=")) {
                errors.add("Invalid define: '" + define + "'. Expected NAME or NAME=VALUE.");
            }
        }

        if (isBlank(o.getClangBinary())) {
            errors.add("clang binary must not be blank (--clang).");
        }

        if (!o.isIncludeMacros() && !o.getMacroPrefixes().isEmpty()) {
            errors.add("--macro-prefix has no effect together with --no-macros.");
        }

        Path output = o.getOutput();
        if (output != null && Files.isDirectory(output)) {
            errors.add("Output path is a directory: " + output);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        Path normalizedHeader = header.toAbsolutePath().normalize();
        Path normalizedOutput = output == null ? null : output.toAbsolutePath().normalize();
        return new ValidatedParseOptions(normalizedHeader, includePaths, normalizedOutput);
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static List<String> cleanList(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}
