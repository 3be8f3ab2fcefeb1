package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One of the fixed operations the assistant may propose.
 *
 * Arguments and results are JSON objects described by {@link #inputSchema()}
 * and {@link #outputSchema()}.  A schema only ever gains optional fields
 * under the same name; {@link #schemaVersion()} is stored on every
 * tool-call record so old records stay readable.
 */
public interface TaskTool {

    /** Argument naming the exact task id. */
    String ARG_TASK_ID = "task_id";

    /** Argument carrying a free-text task reference to be disambiguated. */
    String ARG_TASK_REF = "task_ref";

    /** Optional intent confidence in [0,1] reported by the model. */
    String ARG_CONFIDENCE = "confidence";

    String name();

    String description();

    int schemaVersion();

    ToolSensitivity sensitivity();

    /** True when the tool acts on an existing task (task_id / task_ref). */
    default boolean takesTarget() {
        return false;
    }

    /** Destructive tools always require an explicit confirmation. */
    default boolean destructive() {
        return false;
    }

    JsonNode inputSchema();

    JsonNode outputSchema();

    /**
     * Runs the operation for {@code ownerId}.  Target-taking tools expect
     * {@code task_id} to be resolved already.
     */
    JsonNode execute(Long ownerId, JsonNode arguments);
}
