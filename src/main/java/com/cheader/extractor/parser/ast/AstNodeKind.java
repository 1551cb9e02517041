package com.cheader.extractor.parser.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Clang AST node kinds the extractor cares about. Every other kind maps to {@link #OTHER}.
 */
public enum AstNodeKind {
    TRANSLATION_UNIT("TranslationUnitDecl"),
    FUNCTION("FunctionDecl"),
    RECORD("RecordDecl"),
    CXX_RECORD("CXXRecordDecl"),
    CXX_METHOD("CXXMethodDecl"),
    ENUM("EnumDecl"),
    ENUM_CONSTANT("EnumConstantDecl"),
    TYPEDEF("TypedefDecl"),
    FIELD("FieldDecl"),
    PARAMETER("ParmVarDecl"),
    NAMESPACE("NamespaceDecl"),
    FULL_COMMENT("FullComment"),
    TEXT_COMMENT("TextComment"),
    UNARY_OPERATOR("UnaryOperator"),
    OTHER("");

    private static final Map<String, AstNodeKind> BY_CLANG_NAME = Arrays.stream(values())
            .filter(k -> k != OTHER)
            .collect(Collectors.toUnmodifiableMap(AstNodeKind::getClangName, Function.identity()));

    private final String clangName;

    AstNodeKind(String clangName) {
        this.clangName = clangName;
    }

    public String getClangName() {
        return clangName;
    }

    public static AstNodeKind fromClang(String kind) {
        if (kind == null) {
            return OTHER;
        }
        return BY_CLANG_NAME.getOrDefault(kind, OTHER);
    }
}
