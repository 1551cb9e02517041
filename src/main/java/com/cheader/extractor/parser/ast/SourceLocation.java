package com.cheader.extractor.parser.ast;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * A decoded {@code loc} (or {@code range.begin}/{@code range.end}) object.
 *
 * Clang writes {@code file} only when it differs from the previously printed
 * location, so most locations carry just an offset. Locations produced by macro
 * expansion nest a {@code spellingLoc} and an {@code expansionLoc} instead of
 * carrying their own fields.
 */
@Value
@Builder
public class SourceLocation {

    /** File stamp, present only at a file transition. */
    String file;

    Long offset;

    /** Set when the frontend marked this location as reached through an {@code #include}. */
    boolean includedFrom;

    /** The including file named by the {@code includedFrom} marker. */
    String includedFromFile;

    SourceLocation begin;

    SourceLocation spelling;

    SourceLocation expansion;

    /**
     * Clang prints invalid locations (builtins, some implicit nodes) as an empty object.
     */
    public boolean isValid() {
        return file != null || offset != null || begin != null || spelling != null || expansion != null;
    }

    /**
     * File stamps in the order clang printed them; the last one wins.
     */
    public List<String> fileStamps() {
        List<String> stamps = new ArrayList<>();
        collectStamps(stamps);
        return stamps;
    }

    private void collectStamps(List<String> stamps) {
        if (spelling != null) {
            spelling.collectStamps(stamps);
        }
        if (begin != null) {
            begin.collectStamps(stamps);
        }
        if (file != null) {
            stamps.add(file);
        }
        if (expansion != null) {
            expansion.collectStamps(stamps);
        }
    }

    /**
     * Whether the location where this node actually appears (its expansion
     * point, for macro-produced nodes) was brought in by an include.
     */
    public boolean isFromInclude() {
        if (includedFrom) {
            return true;
        }
        if (expansion != null && expansion.isFromInclude()) {
            return true;
        }
        return begin != null && begin.isFromInclude();
    }
}
