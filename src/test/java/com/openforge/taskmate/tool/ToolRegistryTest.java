package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.config.AppConfig;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.error.ResourceNotFoundException;
import com.openforge.taskmate.error.ToolExecutionException;
import com.openforge.taskmate.task.TaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ToolRegistryTest {

    private static final Long OWNER = 3L;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private TaskStore taskStore;
    private ToolRegistry registry;

    @BeforeEach
    public void setUp() {
        taskStore = mock(TaskStore.class);
        registry = new ToolRegistry(List.of(
                new AddTaskTool(taskStore, objectMapper),
                new ListTasksTool(taskStore, objectMapper),
                new UpdateTaskTool(taskStore, objectMapper),
                new DeleteTaskTool(taskStore, objectMapper),
                new CompleteTaskTool(taskStore, objectMapper)));
    }

    @Test
    public void shouldPublishFiveVersionedDescriptorsInOrder() {
        List<ToolDescriptor> descriptors = registry.descriptors();

        Assertions.assertEquals(List.of("add_task", "list_tasks", "update_task", "delete_task", "complete_task"),
                descriptors.stream().map(ToolDescriptor::name).toList());
        for (ToolDescriptor descriptor : descriptors) {
            Assertions.assertEquals(1, descriptor.version());
            Assertions.assertEquals("object", descriptor.inputSchema().path("type").asText());
            Assertions.assertTrue(descriptor.outputSchema().path("properties").isObject());
        }
        Assertions.assertEquals(5, registry.llmTools().size());
        Assertions.assertEquals("function", registry.llmTools().get(0).type());
    }

    @Test
    public void onlyListTasksIsSafe() {
        Assertions.assertEquals(ToolSensitivity.SAFE, registry.require("list_tasks").sensitivity());
        Assertions.assertEquals(ToolSensitivity.SENSITIVE, registry.require("add_task").sensitivity());
        Assertions.assertTrue(registry.require("delete_task").destructive());
        Assertions.assertFalse(registry.require("complete_task").destructive());
        Assertions.assertTrue(registry.require("update_task").takesTarget());
        Assertions.assertFalse(registry.require("add_task").takesTarget());
    }

    @Test
    public void shouldRejectDuplicateToolNames() {
        Assertions.assertThrows(IllegalStateException.class, () -> new ToolRegistry(List.of(
                new AddTaskTool(taskStore, objectMapper),
                new AddTaskTool(taskStore, objectMapper))));
    }

    @Test
    public void unknownToolIsValidationError() {
        Assertions.assertThrows(InvalidToolArgumentsException.class,
                () -> registry.execute(OWNER, "drop_table", objectMapper.createObjectNode()));
    }

    @Test
    public void addTaskReturnsCreatedSummary() throws Exception {
        when(taskStore.create(OWNER, "buy groceries", null)).thenReturn(task(11L, "buy groceries", false));

        JsonNode result = registry.execute(OWNER, "add_task", objectMapper.readTree("{\"title\":\"buy groceries\"}"));

        Assertions.assertEquals(11L, result.get("id").asLong());
        Assertions.assertEquals("buy groceries", result.get("title").asText());
        Assertions.assertEquals("created", result.get("status").asText());
    }

    @Test
    public void listTasksHonoursStatusFilter() throws Exception {
        when(taskStore.list(OWNER, TaskStore.StatusFilter.PENDING))
                .thenReturn(List.of(task(2L, "pay rent", false), task(1L, "call mom", false)));

        JsonNode result = registry.execute(OWNER, "list_tasks", objectMapper.readTree("{\"status\":\"pending\"}"));

        Assertions.assertEquals(2, result.get("tasks").size());
        Assertions.assertEquals("pay rent", result.get("tasks").get(0).get("title").asText());
        Assertions.assertFalse(result.get("tasks").get(0).get("completed").asBoolean());
    }

    @Test
    public void listTasksRejectsUnknownStatus() throws Exception {
        Assertions.assertThrows(InvalidToolArgumentsException.class,
                () -> registry.execute(OWNER, "list_tasks", objectMapper.readTree("{\"status\":\"someday\"}")));
    }

    @Test
    public void completeTaskAcceptsNumericStringId() throws Exception {
        when(taskStore.setCompleted(OWNER, 5L, true)).thenReturn(task(5L, "call mom", true));

        JsonNode result = registry.execute(OWNER, "complete_task", objectMapper.readTree("{\"task_id\":\"5\"}"));

        Assertions.assertEquals("completed", result.get("status").asText());
        Assertions.assertEquals(5L, result.get("id").asLong());
    }

    @Test
    public void targetToolWithoutIdIsValidationError() throws Exception {
        Assertions.assertThrows(InvalidToolArgumentsException.class,
                () -> registry.execute(OWNER, "delete_task", objectMapper.readTree("{\"task_ref\":\"call\"}")));
    }

    @Test
    public void notFoundPassesThroughUnwrapped() throws Exception {
        when(taskStore.delete(OWNER, 9L)).thenThrow(new ResourceNotFoundException("task", 9L));

        Assertions.assertThrows(ResourceNotFoundException.class,
                () -> registry.execute(OWNER, "delete_task", objectMapper.readTree("{\"task_id\":9}")));
    }

    @Test
    public void storeFailureIsWrappedAsToolExecutionError() throws Exception {
        when(taskStore.update(eq(OWNER), eq(4L), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        ToolExecutionException e = Assertions.assertThrows(ToolExecutionException.class,
                () -> registry.execute(OWNER, "update_task", objectMapper.readTree("{\"task_id\":4,\"title\":\"x\"}")));
        Assertions.assertEquals("tool_execution_failed", e.getCode());
    }

    private static Task task(Long id, String title, boolean completed) {
        Task task = Task.builder().ownerId(OWNER).title(title).completed(completed).build();
        task.setId(id);
        return task;
    }
}
