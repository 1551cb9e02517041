package com.cheader.extractor.parser.macro;

import java.util.List;

/**
 * Decides which macro names reach the result.
 *
 * Compiler built-ins ({@code __NAME__}) and reserved identifiers
 * ({@code _Upper...}) are always dropped; the prefix allowlist is applied on top.
 */
public class MacroFilter {

    private final List<String> prefixes;

    public MacroFilter(List<String> prefixes) {
        this.prefixes = prefixes != null ? List.copyOf(prefixes) : List.of();
    }

    public boolean accepts(String name) {
        if (isReserved(name)) {
            return false;
        }
        if (prefixes.isEmpty()) {
            return true;
        }
        return prefixes.stream().anyMatch(name::startsWith);
    }

    public static boolean isReserved(String name) {
        if (name.startsWith("__") && name.endsWith("__")) {
            return true;
        }
        return name.length() > 1 && name.charAt(0) == '_' && Character.isUpperCase(name.charAt(1));
    }
}
