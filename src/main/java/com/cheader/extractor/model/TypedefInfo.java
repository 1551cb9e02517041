package com.cheader.extractor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class TypedefInfo implements Declaration {

    @NonNull
    String name;

    /** Underlying type exactly as the frontend spelled it. */
    @NonNull
    String underlyingType;

    String documentation;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.TYPEDEF;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
