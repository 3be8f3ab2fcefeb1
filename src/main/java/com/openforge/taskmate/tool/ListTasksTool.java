package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.task.TaskStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Read-only; the only SAFE tool. */
@Component
@Order(2)
public class ListTasksTool extends AbstractTaskTool {

    public static final String NAME = "list_tasks";

    private static final String INPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "status":{"type":"string","enum":["all","pending","completed"],"default":"all"}
              }
            }
            """;

    private static final String OUTPUT_SCHEMA = """
            {
              "type":"object",
              "properties":{
                "tasks":{
                  "type":"array",
                  "items":{
                    "type":"object",
                    "properties":{
                      "id":{"type":"integer"},
                      "title":{"type":"string"},
                      "description":{"type":["string","null"]},
                      "completed":{"type":"boolean"}
                    }
                  }
                }
              },
              "required":["tasks"]
            }
            """;

    public ListTasksTool(TaskStore taskStore, ObjectMapper objectMapper) {
        super(taskStore, objectMapper, INPUT_SCHEMA, OUTPUT_SCHEMA);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "List the user's tasks, newest first. Use status to show only pending or completed ones.";
    }

    @Override
    public ToolSensitivity sensitivity() {
        return ToolSensitivity.SAFE;
    }

    @Override
    public JsonNode execute(Long ownerId, JsonNode arguments) {
        TaskStore.StatusFilter filter = TaskStore.StatusFilter.parse(optionalText(arguments, "status"));
        ArrayNode tasks = objectMapper.createArrayNode();
        for (Task task : taskStore.list(ownerId, filter)) {
            ObjectNode item = taskSummary(task);
            item.put("description", task.getDescription());
            item.put("completed", task.isCompleted());
            tasks.add(item);
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.set("tasks", tasks);
        return result;
    }
}
