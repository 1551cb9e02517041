package com.cheader.extractor.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal diagnostics accumulated during one extraction run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
