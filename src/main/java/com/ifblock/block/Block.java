package com.ifblock.block;

import java.util.List;

/**
 * A complete {@code {{#if}} ... {{/if}}} structure.
 * Invariant: the first branch is {@code if}; at most one {@code else}, and only last.
 *
 * @param startLine Line of the opening marker
 * @param endLine   Line of the closing marker
 * @param branches  Branches in written order
 */
public record Block(int startLine, int endLine, List<Branch> branches) implements Segment {

    public Block {
        branches = List.copyOf(branches);
    }
}
