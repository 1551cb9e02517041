package com.cheader.extractor.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import lombok.NonNull;
import lombok.Value;

/**
 * Syntactic shape of a macro body.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "shape")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MacroKind.SimpleValue.class, name = "simpleValue"),
        @JsonSubTypes.Type(value = MacroKind.Expression.class, name = "expression"),
        @JsonSubTypes.Type(value = MacroKind.FunctionLike.class, name = "functionLike"),
        @JsonSubTypes.Type(value = MacroKind.TypeCast.class, name = "typeCast")
})
public interface MacroKind {

    /** Short label used in listings. */
    String label();

    /** {@code #define FOO 42}, or a bare {@code #define FOO} with an empty value. */
    @Value
    class SimpleValue implements MacroKind {
        @NonNull
        String value;

        @Override
        public String label() {
            return "value";
        }
    }

    /** {@code #define FOO (BAR + 1)} */
    @Value
    class Expression implements MacroKind {
        @NonNull
        String expression;

        @Override
        public String label() {
            return "expression";
        }
    }

    /** {@code #define FOO(x, y) ((x) + (y))} */
    @Value
    class FunctionLike implements MacroKind {
        @NonNull
        List<String> arguments;
        @NonNull
        String body;

        @Override
        public String label() {
            return "function-like";
        }
    }

    /** {@code #define GPIOA ((GPIO_TypeDef *) GPIOA_BASE)} */
    @Value
    class TypeCast implements MacroKind {
        @NonNull
        String targetType;
        @NonNull
        String addressExpression;

        @Override
        public String label() {
            return "pointer-cast";
        }
    }
}
