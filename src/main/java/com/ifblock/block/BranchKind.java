package com.ifblock.block;

/**
 * Branch clauses of a conditional block.
 */
public enum BranchKind {
    IF("if"),
    ELSE_IF("else-if"),
    ELSE("else");

    private final String label;

    BranchKind(String label) {
        this.label = label;
    }

    /**
     * Name used in traces.
     */
    public String getLabel() {
        return label;
    }
}
