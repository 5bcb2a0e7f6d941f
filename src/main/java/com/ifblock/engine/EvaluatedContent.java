package com.ifblock.engine;

import com.ifblock.trace.ConditionalTrace;

/**
 * Effective content together with the decision trace that produced it.
 *
 * @param content Pruned template text
 * @param trace   Per-block branch decisions
 */
public record EvaluatedContent(String content, ConditionalTrace trace) {
}
