package com.cheader.extractor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A struct, union or class member.
 *
 * The name is empty only for the unnamed member that holds an anonymous
 * nested struct or union.
 */
@Value
@Builder(toBuilder = true)
public class FieldDecl {

    @NonNull
    @Builder.Default
    String name = "";

    /** Base type with qualifiers and the fixed array suffix removed. */
    @NonNull
    String type;

    /** {@code volatile}, or one of the CMSIS register access qualifiers. */
    boolean isVolatile;

    /** {@code const}, or a read-only register access qualifier. */
    boolean isConst;

    boolean isArray;

    /** First fixed dimension, when {@link #isArray} is set. */
    Long arraySize;

    /** Width in bits for bit-field members. */
    Integer bitWidth;
}
