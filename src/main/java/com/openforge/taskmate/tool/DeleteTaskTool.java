package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.task.TaskStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Destructive: never runs without an explicit confirmation. */
@Component
@Order(4)
public class DeleteTaskTool extends AbstractTaskTool {

    public static final String NAME = "delete_task";

    private static final String INPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "task_id":{"type":"integer","description":"Exact id, only if it appears in the conversation"},
                "task_ref":{"type":"string","description":"Words from the task title when the id is unknown"},
                "confidence":{"type":"number","minimum":0,"maximum":1}
              }
            }
            """;

    private static final String OUTPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "id":{"type":"integer"},
                "title":{"type":"string"},
                "status":{"type":"string","const":"deleted"}
              },
              "required":["id","status"]
            }
            """;

    public DeleteTaskTool(TaskStore taskStore, ObjectMapper objectMapper) {
        super(taskStore, objectMapper, INPUT_SCHEMA, OUTPUT_SCHEMA);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Permanently delete a task. Identify it by task_id or task_ref. The user is always asked to confirm.";
    }

    @Override
    public ToolSensitivity sensitivity() {
        return ToolSensitivity.SENSITIVE;
    }

    @Override
    public boolean takesTarget() {
        return true;
    }

    @Override
    public boolean destructive() {
        return true;
    }

    @Override
    public JsonNode execute(Long ownerId, JsonNode arguments) {
        Task deleted = taskStore.delete(ownerId, requireTaskId(arguments));
        ObjectNode result = taskSummary(deleted);
        result.put("status", "deleted");
        return result;
    }
}
