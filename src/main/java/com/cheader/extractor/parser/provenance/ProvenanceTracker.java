package com.cheader.extractor.parser.provenance;

import com.cheader.extractor.parser.ast.AstNode;
import com.cheader.extractor.parser.ast.SourceLocation;

/**
 * Recovers per-node file provenance from the clang JSON AST.
 *
 * Clang stamps {@code file} on a location only when it differs from the last
 * location it printed ({@code loc}, then {@code range.begin}, then
 * {@code range.end}, node after node in document order). Every node must
 * therefore pass through {@link #step} in that order, local or not, for the
 * carried state to stay correct.
 *
 * A node is local iff its location carries no {@code includedFrom} marker and
 * the file in effect at its location is the target header.
 */
public class ProvenanceTracker {

    private final TargetFileMatcher matcher;

    public ProvenanceTracker(TargetFileMatcher matcher) {
        this.matcher = matcher;
    }

    public ProvenanceStep step(ProvenanceState state, AstNode node) {
        SourceLocation loc = node.getLoc();

        ProvenanceState atNode = apply(state, loc);
        boolean local = loc != null
                && loc.isValid()
                && !loc.isFromInclude()
                && matcher.matches(atNode.getCurrentFile());

        ProvenanceState next = apply(apply(atNode, node.getRangeBegin()), node.getRangeEnd());
        return new ProvenanceStep(local, next);
    }

    private static ProvenanceState apply(ProvenanceState state, SourceLocation location) {
        if (location == null) {
            return state;
        }
        ProvenanceState result = state;
        for (String file : location.fileStamps()) {
            result = result.withFile(file);
        }
        return result;
    }
}
