package com.ifblock.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ifblock.engine.ConditionalResult;
import com.ifblock.engine.EvaluatedContent;
import com.ifblock.exception.ConditionalError;
import com.ifblock.exception.IfBlockException;

/**
 * JSON rendering of traces and engine results for external tooling.
 */
public final class TraceJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TraceJson() {
    }

    /**
     * Serialize a trace as {@code {"blocks": [...]}}.
     */
    public static String toJson(ConditionalTrace trace) {
        return write(MAPPER.valueToTree(trace));
    }

    /**
     * Serialize an engine result.
     * <p>
     * Success: {@code {"success": true, "result": ...}} where the result is the
     * content string, or {@code {"content": ..., "trace": ...}} for detailed results.
     * Failure: {@code {"success": false, "errors": [{type, description, line, expression, variable}]}}.
     */
    public static String toJson(ConditionalResult<?> result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("success", result.isSuccess());
        if (result.isSuccess()) {
            Object value = result.getValue();
            if (value instanceof EvaluatedContent detailed) {
                ObjectNode body = root.putObject("result");
                body.put("content", detailed.content());
                body.set("trace", MAPPER.valueToTree(detailed.trace()));
            } else {
                root.set("result", MAPPER.valueToTree(value));
            }
        } else {
            ArrayNode errors = root.putArray("errors");
            for (ConditionalError error : result.getErrors()) {
                ObjectNode node = errors.addObject();
                node.put("type", error.kind().getLabel());
                node.put("description", error.message());
                node.put("line", error.line());
                node.put("expression", error.expression());
                node.put("variable", error.variable());
            }
        }
        return write(root);
    }

    private static String write(Object tree) {
        try {
            return MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IfBlockException("Failed to serialize trace: " + e.getMessage(), e);
        }
    }
}
