package com.cheader.extractor.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A C struct or union. An empty name marks an anonymous aggregate, which is
 * only ever produced with at least one field.
 */
@Value
@Builder
public class StructDecl implements Declaration {

    @NonNull
    String name;

    @Singular
    List<FieldDecl> fields;

    String documentation;

    boolean isUnion;

    @JsonIgnore
    public boolean isAnonymous() {
        return name.isEmpty();
    }

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.STRUCT;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
