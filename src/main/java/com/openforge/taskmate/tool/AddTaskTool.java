package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.task.TaskStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class AddTaskTool extends AbstractTaskTool {

    public static final String NAME = "add_task";

    private static final String INPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "title":{"type":"string","minLength":1,"maxLength":200,
                         "description":"Short title of the task, without filler words such as 'add a task to'"},
                "description":{"type":"string","maxLength":1000},
                "confidence":{"type":"number","minimum":0,"maximum":1,
                              "description":"How sure you are the user wants this task created"}
              },
              "required":["title"]
            }
            """;

    private static final String OUTPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "id":{"type":"integer"},
                "title":{"type":"string"},
                "status":{"type":"string","const":"created"}
              },
              "required":["id","title","status"]
            }
            """;

    public AddTaskTool(TaskStore taskStore, ObjectMapper objectMapper) {
        super(taskStore, objectMapper, INPUT_SCHEMA, OUTPUT_SCHEMA);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Create a new task in the user's task list.";
    }

    @Override
    public ToolSensitivity sensitivity() {
        return ToolSensitivity.SENSITIVE;
    }

    @Override
    public JsonNode execute(Long ownerId, JsonNode arguments) {
        Task task = taskStore.create(ownerId,
                optionalText(arguments, "title"),
                optionalText(arguments, "description"));
        ObjectNode result = taskSummary(task);
        result.put("status", "created");
        return result;
    }
}
