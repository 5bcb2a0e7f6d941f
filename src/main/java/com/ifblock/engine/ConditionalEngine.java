package com.ifblock.engine;

import com.ifblock.evaluation.EvaluationOptions;
import com.ifblock.variable.VariableAccessor;

/**
 * Evaluates {{#if}} / {{else if}} / {{else}} / {{/if}} blocks in a template
 * against a variable store. Evaluation is a pure function of its arguments:
 * implementations hold no per-call state and may be shared across threads.
 */
public interface ConditionalEngine {

    /**
     * Evaluate conditional blocks and return the pruned content.
     *
     * @param content  Template text
     * @param accessor Variable store
     * @param options  Evaluation options
     * @return Effective content, or the first error encountered
     */
    ConditionalResult<String> evaluate(String content, VariableAccessor accessor, EvaluationOptions options);

    /**
     * Evaluate conditional blocks and return the pruned content with its decision trace.
     *
     * @param content  Template text
     * @param accessor Variable store
     * @param options  Evaluation options
     * @return Effective content and trace, or the first error encountered
     */
    ConditionalResult<EvaluatedContent> evaluateDetailed(String content, VariableAccessor accessor,
                                                         EvaluationOptions options);

    /**
     * Evaluate with {@link EvaluationOptions#defaults()}.
     */
    default ConditionalResult<String> evaluate(String content, VariableAccessor accessor) {
        return evaluate(content, accessor, EvaluationOptions.defaults());
    }

    /**
     * Evaluate with {@link EvaluationOptions#defaults()}, including the trace.
     */
    default ConditionalResult<EvaluatedContent> evaluateDetailed(String content, VariableAccessor accessor) {
        return evaluateDetailed(content, accessor, EvaluationOptions.defaults());
    }
}
