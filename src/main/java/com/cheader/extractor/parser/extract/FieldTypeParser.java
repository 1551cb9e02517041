package com.cheader.extractor.parser.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.cheader.extractor.model.FieldDecl;

/**
 * Turns a field's type spelling into a {@link FieldDecl} (without a name).
 *
 * Recognizes the standard qualifiers and the CMSIS register access qualifiers
 * ({@code __I}, {@code __O}, {@code __IO} and their {@code __IM}/{@code __OM}/
 * {@code __IOM} struct-member variants), which all imply {@code volatile};
 * the input-only ones additionally imply {@code const}.
 */
public final class FieldTypeParser {

    private static final Pattern QUALIFIER = Pattern.compile(
            "(?<![\\w])(volatile|const|__IOM|__IO|__IM|__I|__OM|__O)(?![\\w])");

    private static final Pattern ARRAY_SUFFIX = Pattern.compile("\\[(\\d+)\\]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FieldTypeParser() {
        // Utility class
    }

    public static FieldDecl parse(String typeStr) {
        boolean isVolatile = false;
        boolean isConst = false;

        Matcher qualifiers = QUALIFIER.matcher(typeStr);
        while (qualifiers.find()) {
            switch (qualifiers.group(1)) {
                case "volatile", "__IO", "__IOM", "__O", "__OM" -> isVolatile = true;
                case "const" -> isConst = true;
                case "__I", "__IM" -> {
                    isVolatile = true;
                    isConst = true;
                }
                default -> throw new IllegalStateException("Unhandled qualifier: " + qualifiers.group(1));
            }
        }

        boolean isArray = false;
        Long arraySize = null;
        String baseType = typeStr;

        Matcher array = ARRAY_SUFFIX.matcher(typeStr);
        if (array.find()) {
            isArray = true;
            arraySize = parseDimension(array.group(1));
            baseType = ARRAY_SUFFIX.matcher(baseType).replaceAll("");
        }

        baseType = QUALIFIER.matcher(baseType).replaceAll("");
        baseType = WHITESPACE.matcher(baseType).replaceAll(" ").trim();

        return FieldDecl.builder()
                .type(baseType)
                .isVolatile(isVolatile)
                .isConst(isConst)
                .isArray(isArray)
                .arraySize(arraySize)
                .build();
    }

    /**
     * @return the dimension, or null when it does not fit a signed 64-bit value
     */
    private static Long parseDimension(String digits) {
        try {
            return Long.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
