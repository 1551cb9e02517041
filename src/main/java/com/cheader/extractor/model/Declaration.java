package com.cheader.extractor.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single declaration recovered from a C/C++ header.
 *
 * Declarations are immutable and keep the order in which they were encountered
 * in the header; consumers rely on that order to reconstruct the source layout.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "declKind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FunctionDecl.class, name = "function"),
        @JsonSubTypes.Type(value = StructDecl.class, name = "struct"),
        @JsonSubTypes.Type(value = EnumDecl.class, name = "enum"),
        @JsonSubTypes.Type(value = TypedefInfo.class, name = "typedef"),
        @JsonSubTypes.Type(value = MacroDecl.class, name = "macro"),
        @JsonSubTypes.Type(value = NamespaceDecl.class, name = "namespace"),
        @JsonSubTypes.Type(value = ClassDecl.class, name = "class")
})
public interface Declaration {

    String getName();

    DeclarationKind declarationKind();

    void accept(DeclarationVisitor visitor);
}
