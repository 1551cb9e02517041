package com.cheader.extractor.parser.ast;

import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Generic, navigable view of one node from the clang JSON AST.
 *
 * The common fields are decoded eagerly; anything kind-specific
 * ({@code storageClass}, {@code tagUsed}, {@code pure}, ...) is read on demand
 * from the raw attributes.
 */
@Value
@Builder
public class AstNode {

    @NonNull
    String kind;

    String name;

    /** {@code type.qualType}, when present. */
    String qualType;

    SourceLocation loc;

    SourceLocation rangeBegin;

    SourceLocation rangeEnd;

    @Singular("child")
    List<AstNode> inner;

    @NonNull
    JsonNode attributes;

    public AstNodeKind getNodeKind() {
        return AstNodeKind.fromClang(kind);
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    /** Compiler-synthesized, not user-written. */
    public boolean isImplicit() {
        return getFlag("isImplicit");
    }

    public boolean getFlag(String attribute) {
        JsonNode value = attributes.get(attribute);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    public String getString(String attribute) {
        JsonNode value = attributes.get(attribute);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    public String getString(String attribute, String defaultValue) {
        String value = getString(attribute);
        return value != null ? value : defaultValue;
    }

    /**
     * Reads {@code attribute.property} from a nested object attribute,
     * e.g. {@code fixedUnderlyingType.qualType}.
     */
    public String getNestedString(String attribute, String property) {
        JsonNode object = attributes.get(attribute);
        if (object == null || !object.isObject()) {
            return null;
        }
        JsonNode value = object.get(property);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    /**
     * Reads an integer attribute. Clang writes literal values as decimal strings;
     * plain JSON numbers are accepted as well. Values beyond the signed 64-bit
     * range keep their low 64 bits.
     */
    public Long getLong(String attribute) {
        JsonNode value = attributes.get(attribute);
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue().longValue();
        }
        if (value.isTextual()) {
            return parseInteger(value.textValue().trim());
        }
        return null;
    }

    private static Long parseInteger(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return new BigInteger(text).longValue();
            } catch (NumberFormatException notInteger) {
                return null;
            }
        }
    }

    public String displayName() {
        return hasName() ? name : "<anonymous>";
    }
}
