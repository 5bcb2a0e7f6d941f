package com.ifblock.block;

import com.ifblock.exception.ConditionalError;
import com.ifblock.exception.ErrorKind;
import com.ifblock.exception.ExpressionException;
import com.ifblock.exception.StructureException;
import com.ifblock.expression.ConditionExpressionParser;
import com.ifblock.expression.node.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts the flat marker stream into a tree of nested blocks.
 * <p>
 * A stack of open frames drives the build:
 * <ul>
 *   <li>{@code #if}: push a frame, failing with RecursionDepthExceeded when the
 *       stack already holds {@code maxNesting} frames</li>
 *   <li>{@code else if} / {@code else}: add a branch to the top frame; a branch
 *       after {@code else} is a structural error</li>
 *   <li>{@code /if}: pop and seal the frame into a Block, attached to the parent's
 *       current branch or to the document root</li>
 * </ul>
 * Branch markers or closers with no open frame, and frames still open at end of
 * input, are structural errors. Every branch expression is parsed as its marker
 * is reached.
 */
public class BlockBuilder {

    private static final Logger log = LoggerFactory.getLogger(BlockBuilder.class);

    private final String content;
    private final LineIndex lines;
    private final int maxNesting;

    public BlockBuilder(String content, LineIndex lines, int maxNesting) {
        this.content = content;
        this.lines = lines;
        this.maxNesting = maxNesting;
    }

    /**
     * Build the document tree.
     *
     * @param events Markers in document order
     * @return Top-level segments: text between blocks and the blocks themselves
     * @throws StructureException  on structural violations or excessive nesting
     * @throws ExpressionException on a malformed branch expression
     */
    public List<Segment> build(List<TagEvent> events) {
        List<Segment> root = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        int cursor = 0;

        for (TagEvent event : events) {
            appendText(root, stack, cursor, event.start());
            cursor = event.end();

            switch (event.kind()) {
                case IF -> {
                    if (stack.size() >= maxNesting) {
                        throw StructureException.depthExceeded(maxNesting, event.line());
                    }
                    stack.push(new Frame(event.line(), branch(BranchKind.IF, event)));
                }
                case ELSE_IF -> {
                    Frame frame = openFrame(stack, event, "{{else if}}");
                    frame.requireNoElse("{{else if}}", event);
                    frame.add(branch(BranchKind.ELSE_IF, event));
                }
                case ELSE -> {
                    Frame frame = openFrame(stack, event, "{{else}}");
                    frame.requireNoElse("{{else}}", event);
                    frame.add(Branch.otherwise(event.line()));
                }
                case END_IF -> {
                    Frame frame = openFrame(stack, event, "{{/if}}");
                    stack.pop();
                    Block block = new Block(frame.startLine, event.line(), frame.branches);
                    if (stack.isEmpty()) {
                        root.add(block);
                    } else {
                        stack.peek().current().append(block);
                    }
                    log.debug("Sealed block lines {}-{} with {} branches",
                            block.startLine(), block.endLine(), block.branches().size());
                }
            }
        }

        if (!stack.isEmpty()) {
            throw StructureException.structural(
                    "Unclosed {{#if}} starting at line " + stack.peek().startLine, stack.peek().startLine);
        }

        appendText(root, stack, cursor, content.length());
        return root;
    }

    private Frame openFrame(Deque<Frame> stack, TagEvent event, String tag) {
        if (stack.isEmpty()) {
            throw StructureException.structural(tag + " without matching {{#if}}", event.line());
        }
        return stack.peek();
    }

    private void appendText(List<Segment> root, Deque<Frame> stack, int start, int end) {
        if (start >= end) {
            return;
        }
        TextSegment text = new TextSegment(start, end);
        if (stack.isEmpty()) {
            root.add(text);
        } else {
            stack.peek().current().append(text);
        }
    }

    private Branch branch(BranchKind kind, TagEvent event) {
        String text = event.expression().strip();
        if (text.isEmpty()) {
            throw new ExpressionException(new ConditionalError(ErrorKind.PARSE_ERROR,
                    "Missing expression in {{" + (kind == BranchKind.IF ? "#if" : "else if") + "}}",
                    event.line(), "", null), 0);
        }
        int leading = event.expression().indexOf(text);
        Expression expression;
        try {
            expression = ConditionExpressionParser.parse(text);
        } catch (ExpressionException e) {
            int offset = event.expressionStart() + leading + e.getPosition();
            throw e.atLine(lines.lineAt(offset));
        }
        return new Branch(kind, text, expression, event.line());
    }

    /**
     * An open block being filled.
     */
    private static final class Frame {
        private final int startLine;
        private final List<Branch> branches = new ArrayList<>();
        private boolean hasElse;

        private Frame(int startLine, Branch first) {
            this.startLine = startLine;
            this.branches.add(first);
        }

        private Branch current() {
            return branches.get(branches.size() - 1);
        }

        private void requireNoElse(String tag, TagEvent event) {
            if (hasElse) {
                throw StructureException.structural(tag + " after {{else}} in block starting at line "
                        + startLine, event.line());
            }
        }

        private void add(Branch branch) {
            hasElse = branch.getKind() == BranchKind.ELSE;
            branches.add(branch);
        }
    }
}
