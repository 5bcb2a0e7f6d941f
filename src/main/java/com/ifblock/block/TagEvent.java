package com.ifblock.block;

/**
 * A marker found by the scanner.
 *
 * @param kind            Marker kind
 * @param expression      Expression text for IF / ELSE_IF, null otherwise
 * @param line            1-based line of the marker's first character
 * @param start           Start of the text the marker removes: its first character,
 *                        or the start of its line when the marker stands alone
 * @param end             End of the removed text: just past the marker, or past
 *                        the line break when the marker stands alone
 * @param expressionStart Offset of the expression's first character, or -1
 */
public record TagEvent(TagKind kind, String expression, int line, int start, int end, int expressionStart) {
}
