package com.cheader.extractor.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named C++ class (or struct parsed in C++ mode).
 */
@Value
@Builder
public class ClassDecl implements Declaration {

    @NonNull
    String name;

    @Singular
    List<FunctionDecl> methods;

    @Singular
    List<FieldDecl> fields;

    String documentation;

    /** True when at least one method is pure virtual. */
    boolean isAbstract;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.CLASS;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
