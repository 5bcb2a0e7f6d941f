package com.ifblock.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps character offsets of a text to 1-based line numbers.
 */
public final class LineIndex {

    private final List<Integer> newlines;

    public LineIndex(String text) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                positions.add(i);
            }
        }
        this.newlines = positions;
    }

    /**
     * Line containing the given offset: one plus the number of newlines before it.
     */
    public int lineAt(int offset) {
        int idx = Collections.binarySearch(newlines, offset);
        // A newline at exactly this offset belongs to the line it terminates
        return (idx >= 0 ? idx : -idx - 1) + 1;
    }
}
