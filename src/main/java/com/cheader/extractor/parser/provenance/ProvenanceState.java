package com.cheader.extractor.parser.provenance;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The "current file" carried forward across the AST in document order.
 *
 * Immutable: each step of the traversal receives a state and hands back the
 * possibly-updated successor.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProvenanceState {

    private static final ProvenanceState INITIAL = new ProvenanceState(null);

    /** Last file stamp seen, or null before the first one. */
    String currentFile;

    public static ProvenanceState initial() {
        return INITIAL;
    }

    public ProvenanceState withFile(String file) {
        if (file == null || file.equals(currentFile)) {
            return this;
        }
        return new ProvenanceState(file);
    }
}
