package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.task.TaskStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(3)
public class UpdateTaskTool extends AbstractTaskTool {

    public static final String NAME = "update_task";

    private static final String INPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "task_id":{"type":"integer","description":"Exact id, only if it appears in the conversation"},
                "task_ref":{"type":"string","description":"Words from the task title when the id is unknown"},
                "title":{"type":"string","minLength":1,"maxLength":200},
                "description":{"type":"string","maxLength":1000},
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
                "status":{"type":"string","const":"updated"}
              },
              "required":["id","title","status"]
            }
            """;

    public UpdateTaskTool(TaskStore taskStore, ObjectMapper objectMapper) {
        super(taskStore, objectMapper, INPUT_SCHEMA, OUTPUT_SCHEMA);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Change the title and/or description of an existing task. Identify it by task_id or task_ref.";
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
    public JsonNode execute(Long ownerId, JsonNode arguments) {
        Task task = taskStore.update(ownerId, requireTaskId(arguments), new TaskStore.TaskChanges(
                optionalText(arguments, "title"),
                optionalText(arguments, "description")));
        ObjectNode result = taskSummary(task);
        result.put("status", "updated");
        return result;
    }
}
