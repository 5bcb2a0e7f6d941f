package com.ifblock.block;

import com.ifblock.expression.node.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code if}, {@code else-if} or {@code else} clause of a block.
 * Content is appended by the {@link BlockBuilder} while the block is open.
 */
public final class Branch {

    private final BranchKind kind;
    private final String expressionText;
    private final Expression expression;
    private final int line;
    private final List<Segment> content = new ArrayList<>();

    Branch(BranchKind kind, String expressionText, Expression expression, int line) {
        this.kind = kind;
        this.expressionText = expressionText;
        this.expression = expression;
        this.line = line;
    }

    static Branch otherwise(int line) {
        return new Branch(BranchKind.ELSE, null, null, line);
    }

    void append(Segment segment) {
        content.add(segment);
    }

    public BranchKind getKind() {
        return kind;
    }

    /**
     * Expression as written, null for {@code else}.
     */
    public String getExpressionText() {
        return expressionText;
    }

    /**
     * Parsed expression, null for {@code else}.
     */
    public Expression getExpression() {
        return expression;
    }

    /**
     * Line of the marker that opens this branch.
     */
    public int getLine() {
        return line;
    }

    public List<Segment> getContent() {
        return Collections.unmodifiableList(content);
    }

    @Override
    public String toString() {
        return kind.getLabel() + (expressionText != null ? " " + expressionText : "")
                + " @" + line + " " + content;
    }
}
