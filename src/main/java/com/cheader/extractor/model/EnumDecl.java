package com.cheader.extractor.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A C/C++ enumeration. Follows the same anonymous-name rule as {@link StructDecl}.
 */
@Value
@Builder
public class EnumDecl implements Declaration {

    @NonNull
    String name;

    @Singular
    List<EnumValue> values;

    String documentation;

    /** Fixed underlying type, e.g. {@code uint8_t} for {@code enum E : uint8_t}. */
    String underlyingType;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.ENUM;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
