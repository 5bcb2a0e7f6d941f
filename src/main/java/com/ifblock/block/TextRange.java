package com.ifblock.block;

/**
 * Half-open character range {@code [start, end)} of template text.
 */
public record TextRange(int start, int end) {

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
