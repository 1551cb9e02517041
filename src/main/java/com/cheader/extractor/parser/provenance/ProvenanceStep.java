package com.cheader.extractor.parser.provenance;

import lombok.Value;

/**
 * Outcome of visiting one node: whether it is local to the target header, and
 * the state to hand to the next node in document order.
 */
@Value
public class ProvenanceStep {
    boolean local;
    ProvenanceState next;
}
