package com.openforge.taskmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.task.TaskStore;
import com.openforge.taskmate.tool.AddTaskTool;
import com.openforge.taskmate.tool.CompleteTaskTool;
import com.openforge.taskmate.tool.DeleteTaskTool;
import com.openforge.taskmate.tool.ListTasksTool;
import com.openforge.taskmate.tool.TaskTool;
import com.openforge.taskmate.tool.UpdateTaskTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the assistant reply from the outcome of a turn's tool calls.
 *
 * The model's own text comes first when it gave one.  Every tool call of
 * the turn then adds a line saying what actually happened to it, so a
 * confirmation prompt or a clarifying question is always in the reply even
 * when the model's text claims otherwise.  With neither text nor tool calls
 * the reply is {@link #FALLBACK_REPLY}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplyComposer {

    static final String FALLBACK_REPLY =
            "I'm not sure how to help with that. You can ask me to add, list, update, complete or delete tasks.";

    private final TaskStore    taskStore;
    private final ObjectMapper objectMapper;

    public String compose(String modelText, List<ToolCallRecord> records) {
        boolean hasText = modelText != null && !modelText.isBlank();
        if (records.isEmpty()) {
            return hasText ? modelText.trim() : FALLBACK_REPLY;
        }
        List<String> lines = new ArrayList<>(records.size() + 1);
        if (hasText) {
            lines.add(modelText.trim());
        }
        for (ToolCallRecord record : records) {
            lines.add(describe(record));
        }
        return String.join("\n\n", lines);
    }

    public String composeConfirmation(ToolCallExecutor.ConfirmationOutcome outcome) {
        ToolCallRecord record = outcome.record();
        if (outcome.changed()) {
            return describe(record);
        }
        return "That request was already %s, so nothing else was changed.".formatted(record.getStatus().value());
    }

    // ── Per-record text ──────────────────────────────────────────────────────

    private String describe(ToolCallRecord record) {
        JsonNode arguments = readJson(record.getArguments());
        JsonNode result    = readJson(record.getResult());

        return switch (record.getStatus()) {
            case EXECUTED  -> describeExecuted(record, arguments, result);
            case PROPOSED, CONFIRMED -> record.awaitingConfirmation()
                    ? "Do you want me to %s? Please confirm or cancel.".formatted(action(record, arguments, result))
                    : "I'm working on it: %s.".formatted(action(record, arguments, result));
            case CANCELLED -> ConfirmationGate.wasAbandoned(record)
                    ? "The request to %s expired, so nothing was changed. Ask me again if you still want it."
                            .formatted(action(record, arguments, result))
                    : "Okay, I won't %s.".formatted(action(record, arguments, result));
            case FAILED    -> describeFailure(record, arguments, result);
        };
    }

    private String describeExecuted(ToolCallRecord record, JsonNode arguments, JsonNode result) {
        String title = result.path("title").asText(titleOf(record, arguments, result));
        return switch (record.getToolName()) {
            case AddTaskTool.NAME      -> "I've added '%s' to your task list.".formatted(title);
            case UpdateTaskTool.NAME   -> "I've updated '%s'.".formatted(title);
            case CompleteTaskTool.NAME -> "I've marked '%s' as complete.".formatted(title);
            case DeleteTaskTool.NAME   -> "I've deleted '%s'.".formatted(title);
            case ListTasksTool.NAME    -> renderTaskList(arguments, result);
            default                    -> "Done.";
        };
    }

    private String renderTaskList(JsonNode arguments, JsonNode result) {
        JsonNode tasks  = result.path("tasks");
        String   filter = arguments.path("status").asText("all");
        String   kind   = "pending".equals(filter) || "completed".equals(filter) ? filter + " " : "";
        if (!tasks.isArray() || tasks.isEmpty()) {
            return "You don't have any %stasks.".formatted(kind);
        }
        StringBuilder text = new StringBuilder("Here are your %stasks:".formatted(kind));
        for (JsonNode task : tasks) {
            text.append('\n')
                .append(task.path("completed").asBoolean() ? "- [x] " : "- [ ] ")
                .append(task.path("title").asText())
                .append(" (#").append(task.path("id").asText()).append(')');
        }
        return text.toString();
    }

    private String describeFailure(ToolCallRecord record, JsonNode arguments, JsonNode result) {
        String error   = result.path("error").asText("");
        String message = result.path("message").asText("");
        String ref     = result.path("reference").asText(arguments.path(TaskTool.ARG_TASK_REF).asText(""));

        if ("ambiguous_reference".equals(error)) {
            JsonNode candidates = result.path("candidates");
            if (!candidates.isArray() || candidates.isEmpty()) {
                return "I couldn't find a task matching \"%s\". Could you tell me which task you mean?".formatted(ref);
            }
            List<String> names = new ArrayList<>();
            for (JsonNode candidate : candidates) {
                names.add("'%s' (#%s)".formatted(candidate.path("title").asText(), candidate.path("id").asText()));
            }
            return "I found more than one task matching \"%s\": %s. Which one do you mean?"
                    .formatted(ref, String.join(", ", names));
        }
        if ("not_found".equals(error)) {
            return "I couldn't find that task, so I couldn't %s.".formatted(verb(record.getToolName()));
        }
        if ("tool_execution_failed".equals(error)) {
            return "Something went wrong while trying to %s. Nothing was changed, please try again."
                    .formatted(verb(record.getToolName()));
        }
        return "I couldn't %s: %s".formatted(verb(record.getToolName()), message);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String action(ToolCallRecord record, JsonNode arguments, JsonNode result) {
        String title = titleOf(record, arguments, result);
        return switch (record.getToolName()) {
            case AddTaskTool.NAME      -> "add '%s' to your tasks".formatted(title);
            case UpdateTaskTool.NAME   -> "update '%s'".formatted(title);
            case CompleteTaskTool.NAME -> "mark '%s' as complete".formatted(title);
            case DeleteTaskTool.NAME   -> "delete '%s'".formatted(title);
            case ListTasksTool.NAME    -> "list your tasks";
            default                    -> "run " + record.getToolName();
        };
    }

    private static String verb(String toolName) {
        return switch (toolName) {
            case AddTaskTool.NAME      -> "add the task";
            case UpdateTaskTool.NAME   -> "update the task";
            case CompleteTaskTool.NAME -> "complete the task";
            case DeleteTaskTool.NAME   -> "delete the task";
            case ListTasksTool.NAME    -> "list your tasks";
            default                    -> "do that";
        };
    }

    /** Best-effort human name of the task a record refers to. */
    private String titleOf(ToolCallRecord record, JsonNode arguments, JsonNode result) {
        if (result.hasNonNull("title")) return result.get("title").asText();
        if (AddTaskTool.NAME.equals(record.getToolName()) && arguments.hasNonNull("title")) {
            return arguments.get("title").asText();
        }
        JsonNode id = arguments.path(TaskTool.ARG_TASK_ID);
        if (id.canConvertToLong()) {
            return taskStore.find(record.getOwnerId(), id.asLong())
                    .map(task -> task.getTitle())
                    .orElse("task #" + id.asText());
        }
        return arguments.path(TaskTool.ARG_TASK_REF).asText("the task");
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) return MissingNode.getInstance();
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[Reply] Unreadable stored JSON: {}", e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }
}
