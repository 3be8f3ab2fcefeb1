package com.openforge.taskmate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.config.OrchestratorProperties;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.domain.ToolCallRecord.Status;
import com.openforge.taskmate.tool.TaskTool;
import com.openforge.taskmate.tool.ToolSensitivity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Decides whether a proposed call may run in the current turn, and owns the
 * PROPOSED → CONFIRMED / CANCELLED transitions.
 *
 * Decision table:
 *   SAFE tool                                   → EXECUTE
 *   model confidence below min-intent-confidence → AWAIT
 *   destructive tool (delete_task)              → AWAIT
 *   target not resolved with full confidence    → AWAIT
 *   no target (add_task)                        → EXECUTE
 *   update / complete, full-confidence target   → EXECUTE if auto-confirm
 *                                                 is enabled, else AWAIT
 *
 * A PROPOSED record older than the confirmation window is abandoned: it is
 * cancelled with {@code {"reason":"abandoned"}} and never executed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfirmationGate {

    public enum Decision {
        EXECUTE,
        AWAIT_CONFIRMATION
    }

    static final String ABANDONED = "abandoned";

    private final OrchestratorProperties properties;
    private final ObjectMapper           objectMapper;

    public Decision decide(TaskTool tool, TargetPrecision target, Double modelConfidence) {
        if (tool.sensitivity() == ToolSensitivity.SAFE) {
            return Decision.EXECUTE;
        }
        if (modelConfidence != null && modelConfidence < properties.minIntentConfidence()) {
            return Decision.AWAIT_CONFIRMATION;
        }
        if (tool.destructive() || !target.fullConfidence()) {
            return Decision.AWAIT_CONFIRMATION;
        }
        if (target == TargetPrecision.NONE) {
            return Decision.EXECUTE;
        }
        return properties.autoConfirmNonDestructive() ? Decision.EXECUTE : Decision.AWAIT_CONFIRMATION;
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    public boolean isAbandoned(ToolCallRecord record, LocalDateTime now) {
        return record.getStatus() == Status.PROPOSED
                && record.getCreateTime() != null
                && record.getCreateTime().plus(properties.confirmationWindow()).isBefore(now);
    }

    public void confirm(ToolCallRecord record) {
        record.transitionTo(Status.CONFIRMED);
        log.info("[Gate] Tool call {} ({}) confirmed", record.getId(), record.getToolName());
    }

    public void cancel(ToolCallRecord record) {
        record.transitionTo(Status.CANCELLED);
        record.setResult(reason("cancelled"));
        log.info("[Gate] Tool call {} ({}) cancelled", record.getId(), record.getToolName());
    }

    public void abandon(ToolCallRecord record) {
        record.transitionTo(Status.CANCELLED);
        record.setResult(reason(ABANDONED));
        log.warn("[Gate] Tool call {} ({}) abandoned after {} without confirmation",
                record.getId(), record.getToolName(), properties.confirmationWindow());
    }

    public static boolean wasAbandoned(ToolCallRecord record) {
        return record.getStatus() == Status.CANCELLED
                && record.getResult() != null
                && record.getResult().contains("\"" + ABANDONED + "\"");
    }

    private String reason(String reason) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("reason", reason);
        return node.toString();
    }
}
