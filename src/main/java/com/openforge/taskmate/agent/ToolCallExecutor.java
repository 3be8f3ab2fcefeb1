package com.openforge.taskmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.domain.ToolCallRecord.Status;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.error.ResourceNotFoundException;
import com.openforge.taskmate.error.TaskmateException;
import com.openforge.taskmate.repository.ToolCallRecordRepository;
import com.openforge.taskmate.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;

/**
 * Runs cleared tool calls so that the task mutation and the record's
 * status change commit together.
 *
 * Every method works on a row-locked record inside its own transaction.
 * When the tool throws, that transaction rolls back (no mutation, no status
 * change) and the failure is written in a fresh transaction, so a record is
 * never EXECUTED without its effect nor left silently PROPOSED after a
 * failed run.  Nothing here is retried.
 */
@Slf4j
@Component
public class ToolCallExecutor {

    /** Result of a confirm / cancel request. */
    public record ConfirmationOutcome(ToolCallRecord record, boolean changed) {}

    private final ToolCallRecordRepository repository;
    private final ToolRegistry             toolRegistry;
    private final ConfirmationGate         gate;
    private final ObjectMapper             objectMapper;
    private final TransactionTemplate      transactionTemplate;

    public ToolCallExecutor(ToolCallRecordRepository repository,
                            ToolRegistry toolRegistry,
                            ConfirmationGate gate,
                            ObjectMapper objectMapper,
                            PlatformTransactionManager transactionManager) {
        this.repository          = repository;
        this.toolRegistry        = toolRegistry;
        this.gate                = gate;
        this.objectMapper        = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ── Same-turn execution ──────────────────────────────────────────────────

    /** PROPOSED → EXECUTED for a call the gate cleared in this turn. */
    public ToolCallRecord executeCleared(Long recordId) {
        try {
            return transactionTemplate.execute(tx -> {
                ToolCallRecord record = lock(recordId);
                if (record.getStatus() != Status.PROPOSED) {
                    return record;
                }
                return run(record);
            });
        } catch (RuntimeException e) {
            return markFailed(recordId, false, e);
        }
    }

    // ── Confirmation round-trip ──────────────────────────────────────────────

    /**
     * Applies the user's decision.  A record that is already terminal is
     * returned untouched; a PROPOSED record past the confirmation window is
     * abandoned whatever the decision.
     */
    public ConfirmationOutcome resolveConfirmation(Long recordId, boolean confirm) {
        try {
            return transactionTemplate.execute(tx -> {
                ToolCallRecord record = lock(recordId);
                if (record.getStatus().isTerminal()) {
                    log.info("[Executor] Tool call {} already {}, nothing to do", recordId, record.getStatus().value());
                    return new ConfirmationOutcome(record, false);
                }
                if (gate.isAbandoned(record, LocalDateTime.now())) {
                    gate.abandon(record);
                    return new ConfirmationOutcome(repository.save(record), true);
                }
                if (!confirm) {
                    gate.cancel(record);
                    return new ConfirmationOutcome(repository.save(record), true);
                }
                if (record.getStatus() == Status.PROPOSED) {
                    gate.confirm(record);
                }
                return new ConfirmationOutcome(run(record), true);
            });
        } catch (RuntimeException e) {
            return new ConfirmationOutcome(markFailed(recordId, true, e), true);
        }
    }

    /** Cancels a PROPOSED record past its window; false if it was resolved meanwhile. */
    public boolean abandon(Long recordId) {
        Boolean abandoned = transactionTemplate.execute(tx -> {
            ToolCallRecord record = lock(recordId);
            if (!gate.isAbandoned(record, LocalDateTime.now())) {
                return false;
            }
            gate.abandon(record);
            repository.save(record);
            return true;
        });
        return Boolean.TRUE.equals(abandoned);
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private ToolCallRecord lock(Long recordId) {
        return repository.findByIdForUpdate(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("tool call", recordId));
    }

    private ToolCallRecord run(ToolCallRecord record) {
        JsonNode result = toolRegistry.execute(record.getOwnerId(), record.getToolName(), readArguments(record));
        record.setResult(result.toString());
        record.transitionTo(Status.EXECUTED);
        log.info("[Executor] Tool call {} ({}) executed owner={}",
                record.getId(), record.getToolName(), record.getOwnerId());
        return repository.save(record);
    }

    private JsonNode readArguments(ToolCallRecord record) {
        try {
            return objectMapper.readTree(record.getArguments());
        } catch (JsonProcessingException e) {
            throw new InvalidToolArgumentsException("Stored arguments are not valid JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Writes FAILED in a new transaction.  A record whose run was confirmed
     * by the user goes through CONFIRMED first, since the rolled-back
     * transaction took that transition with it.
     */
    private ToolCallRecord markFailed(Long recordId, boolean confirmed, RuntimeException failure) {
        String code = failure instanceof TaskmateException taskmate ? taskmate.getCode() : "tool_execution_failed";
        ObjectNode error = objectMapper.createObjectNode();
        error.put("error", code);
        error.put("message", failure.getMessage());

        return transactionTemplate.execute(tx -> {
            ToolCallRecord record = lock(recordId);
            if (record.getStatus().isTerminal()) {
                return record;
            }
            if (confirmed && record.getStatus() == Status.PROPOSED) {
                record.transitionTo(Status.CONFIRMED);
            }
            record.transitionTo(Status.FAILED);
            record.setResult(error.toString());
            log.warn("[Executor] Tool call {} ({}) failed: {} {}",
                    recordId, record.getToolName(), code, failure.getMessage());
            return repository.save(record);
        });
    }
}
