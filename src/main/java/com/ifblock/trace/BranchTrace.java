package com.ifblock.trace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one branch.
 *
 * @param kind  "if", "else-if" or "else"
 * @param expr  Expression text, null for else
 * @param taken Whether this branch supplied the block's output
 */
@JsonPropertyOrder({"kind", "expr", "taken"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BranchTrace(String kind, String expr, boolean taken) {
}
