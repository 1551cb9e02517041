package com.cheader.extractor.parser;

import java.util.ArrayList;
import java.util.List;

import com.cheader.extractor.model.Declaration;
import com.cheader.extractor.model.MacroDecl;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Output of both frontend passes, kept apart.
 */
@Value
@Builder
public class ParseResult {

    /** Declarations from the AST pass, in traversal order. */
    @Singular
    List<Declaration> declarations;

    /** Macros from the macro pass, in dump order. Empty when the pass was skipped or failed. */
    @Singular
    List<MacroDecl> macros;

    @NonNull
    @Builder.Default
    ParseDiagnostics diagnostics = new ParseDiagnostics();

    /**
     * AST declarations followed by macros.
     */
    public List<Declaration> getAllDeclarations() {
        List<Declaration> all = new ArrayList<>(declarations.size() + macros.size());
        all.addAll(declarations);
        all.addAll(macros);
        return List.copyOf(all);
    }
}
