package com.ifblock.block;

/**
 * Piece of template content: literal text or a nested conditional block.
 */
public interface Segment {
}
