package com.cheader.extractor.model;

/**
 * Visitor pattern interface for traversing extracted declarations.
 */
public interface DeclarationVisitor {
    void visit(FunctionDecl function);
    void visit(StructDecl struct);
    void visit(EnumDecl enumDecl);
    void visit(TypedefInfo typedef);
    void visit(MacroDecl macro);
    void visit(NamespaceDecl namespace);
    void visit(ClassDecl classDecl);
}
