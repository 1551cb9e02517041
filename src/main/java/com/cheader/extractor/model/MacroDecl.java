package com.cheader.extractor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A preprocessor {@code #define} with its syntactic classification.
 */
@Value
@Builder
public class MacroDecl implements Declaration {

    @NonNull
    String name;

    @NonNull
    MacroKind kind;

    /** Right-hand side of the definition; the body for function-like macros. */
    @NonNull
    String rawValue;

    @Override
    public DeclarationKind declarationKind() {
        return DeclarationKind.MACRO;
    }

    @Override
    public void accept(DeclarationVisitor visitor) {
        visitor.visit(this);
    }
}
