package com.ifblock.block;

/**
 * Literal template text between markers, as a range of the source.
 */
public record TextSegment(int start, int end) implements Segment {
}
