package com.cheader.extractor.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A C++ namespace and the declarations found inside it, in source order.
 * Only produced when namespace grouping is enabled.
 */
@Value
@Builder
public class NamespaceDecl implements Declaration {

    @NonNull
    String name;

    @Singular
    List<Declaration> declarations;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.NAMESPACE;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
