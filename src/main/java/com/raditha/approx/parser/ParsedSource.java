package com.raditha.approx.parser;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of scanning one kernel source file for approximation annotations.
 *
 * @param lines             the physical source lines, immutable for the run
 * @param modifiableLines   sorted physical indices (0-based) eligible for operator substitution
 * @param physicalToLogical physical index to logical line number, blank and annotation lines excluded
 */
public record ParsedSource(
        List<String> lines,
        List<Integer> modifiableLines,
        SortedMap<Integer, Integer> physicalToLogical) {

    public ParsedSource {
        if (lines == null) {
            throw new IllegalArgumentException("lines cannot be null");
        }
        lines = List.copyOf(lines);
        modifiableLines = modifiableLines == null ? List.of() : List.copyOf(modifiableLines);
        physicalToLogical = physicalToLogical == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(physicalToLogical));
    }

    /**
     * @return true when there is nothing to explore
     */
    public boolean isEmpty() {
        return modifiableLines.isEmpty();
    }

    public int modifiableCount() {
        return modifiableLines.size();
    }
}
