package com.openforge.taskmate.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.task.TaskStore;

/**
 * Shared plumbing for the task tools: schema parsing and argument access.
 */
public abstract class AbstractTaskTool implements TaskTool {

    protected final TaskStore    taskStore;
    protected final ObjectMapper objectMapper;

    private final JsonNode inputSchema;
    private final JsonNode outputSchema;

    protected AbstractTaskTool(TaskStore taskStore, ObjectMapper objectMapper,
                               String inputSchemaJson, String outputSchemaJson) {
        this.taskStore    = taskStore;
        this.objectMapper = objectMapper;
        this.inputSchema  = parseSchema(objectMapper, inputSchemaJson);
        this.outputSchema = parseSchema(objectMapper, outputSchemaJson);
    }

    @Override
    public int schemaVersion() {
        return 1;
    }

    @Override
    public JsonNode inputSchema() {
        return inputSchema;
    }

    @Override
    public JsonNode outputSchema() {
        return outputSchema;
    }

    // ── Argument helpers ─────────────────────────────────────────────────────

    /** Accepts a JSON number or a numeric string. */
    protected static Long requireTaskId(JsonNode arguments) {
        JsonNode node = arguments == null ? null : arguments.get(ARG_TASK_ID);
        if (node == null || node.isNull()) {
            throw new InvalidToolArgumentsException("task_id is required");
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidToolArgumentsException("task_id must be a number (got '%s')".formatted(node.asText()));
            }
        }
        throw new InvalidToolArgumentsException("task_id must be a number");
    }

    /** Null when absent or JSON null; text otherwise. */
    protected static String optionalText(JsonNode arguments, String field) {
        JsonNode node = arguments == null ? null : arguments.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isValueNode()) {
            throw new InvalidToolArgumentsException(field + " must be a string");
        }
        return node.asText();
    }

    protected ObjectNode taskSummary(Task task) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", task.getId());
        node.put("title", task.getTitle());
        return node;
    }

    private static JsonNode parseSchema(ObjectMapper objectMapper, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid tool schema: " + e.getOriginalMessage(), e);
        }
    }
}
