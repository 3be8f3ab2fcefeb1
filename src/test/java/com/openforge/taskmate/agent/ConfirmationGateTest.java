package com.openforge.taskmate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.config.AppConfig;
import com.openforge.taskmate.config.OrchestratorProperties;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.task.TaskStore;
import com.openforge.taskmate.tool.AddTaskTool;
import com.openforge.taskmate.tool.CompleteTaskTool;
import com.openforge.taskmate.tool.DeleteTaskTool;
import com.openforge.taskmate.tool.ListTasksTool;
import com.openforge.taskmate.tool.UpdateTaskTool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static com.openforge.taskmate.agent.ConfirmationGate.Decision.AWAIT_CONFIRMATION;
import static com.openforge.taskmate.agent.ConfirmationGate.Decision.EXECUTE;
import static org.mockito.Mockito.mock;

public class ConfirmationGateTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private AddTaskTool addTask;
    private ListTasksTool listTasks;
    private UpdateTaskTool updateTask;
    private DeleteTaskTool deleteTask;
    private CompleteTaskTool completeTask;

    @BeforeEach
    public void setUp() {
        TaskStore taskStore = mock(TaskStore.class);
        addTask      = new AddTaskTool(taskStore, objectMapper);
        listTasks    = new ListTasksTool(taskStore, objectMapper);
        updateTask   = new UpdateTaskTool(taskStore, objectMapper);
        deleteTask   = new DeleteTaskTool(taskStore, objectMapper);
        completeTask = new CompleteTaskTool(taskStore, objectMapper);
    }

    @Test
    public void safeToolAlwaysExecutes() {
        ConfirmationGate gate = gate(false);
        Assertions.assertEquals(EXECUTE, gate.decide(listTasks, TargetPrecision.NONE, 0.1));
    }

    @Test
    public void deleteAlwaysAwaitsEvenWithExactIdAndAutoConfirm() {
        ConfirmationGate gate = gate(true);
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate.decide(deleteTask, TargetPrecision.EXACT_ID, 1.0));
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate.decide(deleteTask, TargetPrecision.RESOLVED_EXACT, null));
    }

    @Test
    public void nonDestructiveMutationFollowsAutoConfirmFlag() {
        Assertions.assertEquals(EXECUTE, gate(true).decide(completeTask, TargetPrecision.RESOLVED_EXACT, null));
        Assertions.assertEquals(EXECUTE, gate(true).decide(updateTask, TargetPrecision.EXACT_ID, 0.9));
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate(false).decide(completeTask, TargetPrecision.EXACT_ID, null));
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate(false).decide(updateTask, TargetPrecision.RESOLVED_EXACT, 1.0));
    }

    @Test
    public void fuzzyTargetAlwaysAwaits() {
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate(true).decide(completeTask, TargetPrecision.RESOLVED_FUZZY, 1.0));
    }

    @Test
    public void addTaskExecutesUnlessModelIsUnsure() {
        ConfirmationGate gate = gate(false);
        Assertions.assertEquals(EXECUTE, gate.decide(addTask, TargetPrecision.NONE, null));
        Assertions.assertEquals(EXECUTE, gate.decide(addTask, TargetPrecision.NONE, 0.7));
        Assertions.assertEquals(AWAIT_CONFIRMATION, gate.decide(addTask, TargetPrecision.NONE, 0.4));
    }

    @Test
    public void proposalOlderThanWindowIsAbandonedAndCancelled() {
        ConfirmationGate gate = gate(true);
        ToolCallRecord record = ToolCallRecord.builder()
                .toolName(DeleteTaskTool.NAME).arguments("{\"task_id\":3}").requiresConfirmation(true).build();
        record.setCreateTime(LocalDateTime.now().minusMinutes(16));

        Assertions.assertTrue(gate.isAbandoned(record, LocalDateTime.now()));
        gate.abandon(record);

        Assertions.assertEquals(ToolCallRecord.Status.CANCELLED, record.getStatus());
        Assertions.assertTrue(ConfirmationGate.wasAbandoned(record));
        Assertions.assertFalse(gate.isAbandoned(record, LocalDateTime.now()));
    }

    @Test
    public void freshProposalIsNotAbandonedAndCancelRecordsReason() {
        ConfirmationGate gate = gate(true);
        ToolCallRecord record = ToolCallRecord.builder()
                .toolName(DeleteTaskTool.NAME).arguments("{}").requiresConfirmation(true).build();
        record.setCreateTime(LocalDateTime.now().minusMinutes(2));

        Assertions.assertFalse(gate.isAbandoned(record, LocalDateTime.now()));
        gate.cancel(record);

        Assertions.assertEquals(ToolCallRecord.Status.CANCELLED, record.getStatus());
        Assertions.assertFalse(ConfirmationGate.wasAbandoned(record));
        Assertions.assertEquals("{\"reason\":\"cancelled\"}", record.getResult());
    }

    private ConfirmationGate gate(boolean autoConfirm) {
        OrchestratorProperties properties = new OrchestratorProperties(
                autoConfirm, Duration.ofMinutes(15), 0.7, 50, Duration.ofMillis(10), 60_000L);
        return new ConfirmationGate(properties, objectMapper);
    }
}
