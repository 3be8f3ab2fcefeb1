package com.openforge.taskmate.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.tool.TaskTool;

/**
 * A tool call the assistant wants to make.  Nothing has been validated
 * yet; arguments are the model's JSON object verbatim.
 *
 * @param callId    the model's own id for the call, may be null
 * @param toolName  name of a registered tool
 * @param arguments JSON object, never null
 */
public record ProposedInvocation(String callId, String toolName, ObjectNode arguments) {

    public boolean has(String field) {
        JsonNode node = arguments.get(field);
        return node != null && !node.isNull() && !(node.isTextual() && node.asText().isBlank());
    }

    public String taskRef() {
        return has(TaskTool.ARG_TASK_REF) ? arguments.get(TaskTool.ARG_TASK_REF).asText().trim() : null;
    }

    /** Model-reported confidence, or null when absent or not a number. */
    public Double confidence() {
        JsonNode node = arguments.get(TaskTool.ARG_CONFIDENCE);
        return node != null && node.isNumber() ? node.asDouble() : null;
    }
}
