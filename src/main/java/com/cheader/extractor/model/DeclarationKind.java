package com.cheader.extractor.model;

/**
 * The closed set of declaration variants.
 */
public enum DeclarationKind {
    FUNCTION,
    STRUCT,
    ENUM,
    TYPEDEF,
    MACRO,
    NAMESPACE,
    CLASS
}
