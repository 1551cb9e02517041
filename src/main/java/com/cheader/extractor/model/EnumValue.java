package com.cheader.extractor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One enumerator. Values are signed so negative IRQ numbers survive intact.
 */
@Value
@Builder
public class EnumValue {
    @NonNull
    String name;
    long value;
    String documentation;
}
