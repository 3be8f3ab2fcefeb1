package com.openforge.taskmate.llm.model;

/**
 * A tool invocation requested by the model.
 *
 * function.arguments is the raw JSON string exactly as the model produced
 * it; it may be malformed and must be parsed defensively.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCall function
) {

    public record FunctionCall(String name, String arguments) {}

    public String name() {
        return function == null ? null : function.name();
    }

    public String rawArguments() {
        return function == null ? null : function.arguments();
    }
}
