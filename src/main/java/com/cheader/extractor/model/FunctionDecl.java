package com.cheader.extractor.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A free function or a class method.
 */
@Value
@Builder
public class FunctionDecl implements Declaration {

    @NonNull
    String name;

    @NonNull
    String returnType;

    @Singular
    List<Parameter> parameters;

    String documentation;

    boolean isVirtual;

    boolean isStatic;

    boolean isInline;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.FUNCTION;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }

    @Value
    public static class Parameter {
        @NonNull
        String name;
        @NonNull
        String type;
    }
}
