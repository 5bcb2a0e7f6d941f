package com.ifblock.block;

/**
 * Block delimiter markers recognized in template text.
 */
public enum TagKind {
    /** {@code {{#if EXPR}}} */
    IF,
    /** {@code {{else if EXPR}}} */
    ELSE_IF,
    /** {@code {{else}}} */
    ELSE,
    /** {@code {{/if}}} */
    END_IF
}
