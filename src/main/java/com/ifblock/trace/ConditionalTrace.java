package com.ifblock.trace;

import java.util.List;

/**
 * Machine-readable record of which branch of each resolved block was taken,
 * in document order. Blocks inside branches that were dropped do not appear.
 */
public record ConditionalTrace(List<BlockTrace> blocks) {

    private static final ConditionalTrace EMPTY = new ConditionalTrace(List.of());

    public ConditionalTrace {
        blocks = List.copyOf(blocks);
    }

    public static ConditionalTrace empty() {
        return EMPTY;
    }
}
