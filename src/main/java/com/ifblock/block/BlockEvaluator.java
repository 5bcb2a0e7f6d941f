package com.ifblock.block;

import com.ifblock.evaluation.ExpressionEvaluator;
import com.ifblock.trace.BlockTrace;
import com.ifblock.trace.BranchTrace;
import com.ifblock.trace.ConditionalTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves each block to its single taken branch and concatenates the surviving text.
 * <p>
 * Branches are tested in written order; the first whose expression is true, or a
 * reached {@code else}, is taken and the rest are dropped unevaluated. Nested blocks
 * are resolved only inside the taken branch. Each resolved block is recorded in the
 * trace before its nested blocks.
 */
public class BlockEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BlockEvaluator.class);

    private final String content;
    private final ExpressionEvaluator evaluator;
    private final List<BlockTrace> trace = new ArrayList<>();

    public BlockEvaluator(String content, ExpressionEvaluator evaluator) {
        this.content = content;
        this.evaluator = evaluator;
    }

    /**
     * Render the effective content of a document tree.
     *
     * @param segments Top-level segments from the {@link BlockBuilder}
     * @return Text with every block replaced by its taken branch
     */
    public String render(List<Segment> segments) {
        StringBuilder out = new StringBuilder(content.length());
        render(segments, out);
        return out.toString();
    }

    /**
     * Decisions recorded by {@link #render(List)} so far.
     */
    public ConditionalTrace getTrace() {
        return new ConditionalTrace(trace);
    }

    private void render(List<Segment> segments, StringBuilder out) {
        for (Segment segment : segments) {
            if (segment instanceof TextSegment text) {
                out.append(content, text.start(), text.end());
            } else if (segment instanceof Block block) {
                resolve(block, out);
            }
        }
    }

    private void resolve(Block block, StringBuilder out) {
        Branch taken = null;
        List<BranchTrace> records = new ArrayList<>();

        for (Branch branch : block.branches()) {
            boolean isTaken = false;
            if (taken == null) {
                isTaken = branch.getKind() == BranchKind.ELSE
                        || evaluator.test(branch.getExpression(), branch.getExpressionText(), branch.getLine());
                if (isTaken) {
                    taken = branch;
                }
            }
            records.add(new BranchTrace(branch.getKind().getLabel(), branch.getExpressionText(), isTaken));
        }

        trace.add(new BlockTrace(block.startLine(), block.endLine(), records));

        if (taken == null) {
            log.debug("Block lines {}-{}: no branch taken", block.startLine(), block.endLine());
            return;
        }
        log.debug("Block lines {}-{}: took {} branch at line {}",
                block.startLine(), block.endLine(), taken.getKind().getLabel(), taken.getLine());
        render(taken.getContent(), out);
    }
}
