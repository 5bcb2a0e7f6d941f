package com.ifblock.engine;

import com.ifblock.block.BlockBuilder;
import com.ifblock.block.BlockEvaluator;
import com.ifblock.block.LineIndex;
import com.ifblock.block.ScanExclusion;
import com.ifblock.block.Segment;
import com.ifblock.block.TagEvent;
import com.ifblock.block.TagScanner;
import com.ifblock.evaluation.DefaultExpressionEvaluator;
import com.ifblock.evaluation.EvaluationOptions;
import com.ifblock.exception.TemplateException;
import com.ifblock.trace.ConditionalTrace;
import com.ifblock.variable.VariableAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default ConditionalEngine: scan markers, build the block tree, resolve blocks.
 * The first failure of any stage aborts the call and is returned as the result.
 */
public class DefaultConditionalEngine implements ConditionalEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultConditionalEngine.class);

    private final TagScanner scanner;

    public DefaultConditionalEngine() {
        this(ScanExclusion.NONE);
    }

    /**
     * @param exclusion Regions in which markers are left as text
     */
    public DefaultConditionalEngine(ScanExclusion exclusion) {
        this.scanner = new TagScanner(Objects.requireNonNull(exclusion, "exclusion"));
    }

    @Override
    public ConditionalResult<String> evaluate(String content, VariableAccessor accessor,
                                              EvaluationOptions options) {
        return evaluateDetailed(content, accessor, options).map(EvaluatedContent::content);
    }

    @Override
    public ConditionalResult<EvaluatedContent> evaluateDetailed(String content, VariableAccessor accessor,
                                                                EvaluationOptions options) {
        Objects.requireNonNull(accessor, "accessor");
        Objects.requireNonNull(options, "options");
        String text = content == null ? "" : content;

        try {
            LineIndex lines = new LineIndex(text);
            List<TagEvent> events = scanner.scan(text, lines);
            if (events.isEmpty()) {
                return ConditionalResult.success(new EvaluatedContent(text, ConditionalTrace.empty()));
            }

            List<Segment> tree = new BlockBuilder(text, lines, options.maxNesting()).build(events);

            BlockEvaluator blockEvaluator = new BlockEvaluator(text,
                    new DefaultExpressionEvaluator(accessor, options));
            String rendered = blockEvaluator.render(tree);
            ConditionalTrace trace = blockEvaluator.getTrace();

            log.debug("Resolved {} blocks ({} -> {} chars)", trace.blocks().size(), text.length(), rendered.length());
            return ConditionalResult.success(new EvaluatedContent(rendered, trace));
        } catch (TemplateException e) {
            log.debug("Conditional evaluation failed: {}", e.getError());
            return ConditionalResult.failure(e.getError());
        }
    }
}
