package com.openforge.taskmate.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.agent.dto.ChatTurnRequest;
import com.openforge.taskmate.agent.dto.ConfirmationRequest;
import com.openforge.taskmate.agent.dto.ToolCallView;
import com.openforge.taskmate.agent.dto.TurnResponse;
import com.openforge.taskmate.conversation.ConversationStore;
import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.Conversation;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.error.AmbiguousReferenceException;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.error.ModelInvocationException;
import com.openforge.taskmate.error.OwnershipViolationException;
import com.openforge.taskmate.error.ResourceNotFoundException;
import com.openforge.taskmate.error.TaskmateException;
import com.openforge.taskmate.llm.model.Message;
import com.openforge.taskmate.task.TaskStore;
import com.openforge.taskmate.tool.TaskTool;
import com.openforge.taskmate.tool.ToolDescriptor;
import com.openforge.taskmate.tool.ToolRegistry;
import com.openforge.taskmate.tool.ToolSensitivity;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stateless coordinator of a chat turn and of the confirm / cancel
 * round-trip.  Everything it needs is read from the stores on each request,
 * so any instance can serve any request.
 *
 * A turn:
 *   1. resolve the conversation (created when absent; 403 if it is someone else's)
 *   2. rebuild history, then persist the user message
 *   3. ask the assistant (one retry with backoff, then 503)
 *   4. per proposed call: resolve the target, ask the gate
 *   5. persist the assistant message with every record (PROPOSED / FAILED)
 *   6. run cleared records, each atomically with its status change
 *   7. write the reply text and return it with the tool-call summaries
 *
 * A failed assistant call leaves only the user message behind.  A client
 * idempotency key makes a retried turn reuse that message, and returns the
 * stored answer when one exists.
 */
@Slf4j
@Service
public class ChatOrchestrator {

    private static final Pattern ROLE_MARKER = Pattern.compile("[Ss]ystem:");

    private final ConversationStore      conversationStore;
    private final TaskStore              taskStore;
    private final ToolRegistry           toolRegistry;
    private final ContextReconstructor   contextReconstructor;
    private final AssistantInvoker       assistantInvoker;
    private final DisambiguationResolver disambiguationResolver;
    private final ConfirmationGate       gate;
    private final ToolCallExecutor       executor;
    private final ReplyComposer          replyComposer;
    private final ObjectMapper           objectMapper;
    private final Retry                  assistantRetry;

    public ChatOrchestrator(ConversationStore conversationStore,
                            TaskStore taskStore,
                            ToolRegistry toolRegistry,
                            ContextReconstructor contextReconstructor,
                            AssistantInvoker assistantInvoker,
                            DisambiguationResolver disambiguationResolver,
                            ConfirmationGate gate,
                            ToolCallExecutor executor,
                            ReplyComposer replyComposer,
                            ObjectMapper objectMapper,
                            @Qualifier("assistantInvokerRetry") Retry assistantInvokerRetry) {
        this.conversationStore      = conversationStore;
        this.taskStore              = taskStore;
        this.toolRegistry           = toolRegistry;
        this.contextReconstructor   = contextReconstructor;
        this.assistantInvoker       = assistantInvoker;
        this.disambiguationResolver = disambiguationResolver;
        this.gate                   = gate;
        this.executor               = executor;
        this.replyComposer          = replyComposer;
        this.objectMapper           = objectMapper;
        this.assistantRetry         = assistantInvokerRetry;
        this.assistantRetry.getEventPublisher().onRetry(event ->
                log.warn("[Orchestrator] Assistant call failed (attempt {}), retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    // ── Chat turn ────────────────────────────────────────────────────────────

    public TurnResponse handleTurn(Long ownerId, ChatTurnRequest request) {
        String text = sanitize(request.message());
        Conversation conversation = resolveConversation(ownerId, request.conversationId());
        String idempotencyKey = request.idempotencyKey() == null || request.idempotencyKey().isBlank()
                ? null : request.idempotencyKey().trim();

        ChatMessage userMessage = null;
        if (idempotencyKey != null) {
            Optional<ChatMessage> previous =
                    conversationStore.findByIdempotencyKey(ownerId, conversation.getId(), idempotencyKey);
            if (previous.isPresent()) {
                Optional<ChatMessage> answer = conversationStore.findReplyTo(previous.get().getId());
                if (answer.isPresent()) {
                    log.info("[Orchestrator] Replaying stored turn conversation={} key={}",
                            conversation.getId(), idempotencyKey);
                    return response(conversation, answer.get(), conversationStore.toolCallsOf(answer.get().getId()));
                }
                userMessage = previous.get();
            }
        }

        List<Message> context;
        if (userMessage == null) {
            context = contextReconstructor.reconstruct(ownerId, conversation.getId());
            userMessage = persistUserMessage(conversation, text, idempotencyKey);
        } else {
            log.info("[Orchestrator] Reusing user message {} for retried turn", userMessage.getId());
            context = contextReconstructor.reconstructBefore(ownerId, conversation.getId(), userMessage.getId());
        }

        log.info("[Orchestrator] Turn started owner={} conversation={} message={}",
                ownerId, conversation.getId(), userMessage.getId());

        AssistantDecision decision = invokeAssistant(context, userMessage.getContent());
        checkTaskOwnership(ownerId, decision.invocations());

        List<ToolCallRecord> records = plan(ownerId, decision.invocations());
        // written again once the cleared calls have run; never blank in between
        ChatMessage assistantMessage = conversationStore.appendMessage(conversation, ChatMessage.Role.ASSISTANT,
                replyComposer.compose(decision.text(), records), records, null, userMessage.getId());

        List<ToolCallRecord> outcome = new ArrayList<>(records.size());
        for (ToolCallRecord record : records) {
            boolean cleared = record.getStatus() == ToolCallRecord.Status.PROPOSED && !record.awaitingConfirmation();
            outcome.add(cleared ? executor.executeCleared(record.getId()) : record);
        }

        String reply = replyComposer.compose(decision.text(), outcome);
        assistantMessage = conversationStore.updateContent(assistantMessage.getId(), reply);

        log.info("[Orchestrator] Turn finished conversation={} toolCalls={} awaiting={}",
                conversation.getId(), outcome.size(),
                outcome.stream().filter(ToolCallRecord::awaitingConfirmation).count());
        return response(conversation, assistantMessage, outcome);
    }

    // ── Confirmation round-trip ──────────────────────────────────────────────

    public TurnResponse resolveConfirmation(Long ownerId, ConfirmationRequest request) {
        ToolCallRecord record = conversationStore.findToolCall(request.toolCallId())
                .orElseThrow(() -> new ResourceNotFoundException("tool call", request.toolCallId()));
        if (!record.getOwnerId().equals(ownerId)) {
            throw new OwnershipViolationException("tool call", request.toolCallId());
        }
        if (!record.getConversationId().equals(request.conversationId())) {
            throw new ResourceNotFoundException("tool call", request.toolCallId());
        }
        Conversation conversation = conversationStore.getConversation(ownerId, record.getConversationId());

        boolean confirm = request.decision() == ConfirmationRequest.Decision.CONFIRM;
        ToolCallExecutor.ConfirmationOutcome outcome = executor.resolveConfirmation(record.getId(), confirm);
        String reply = replyComposer.composeConfirmation(outcome);

        Long messageId = null;
        if (outcome.changed()) {
            messageId = conversationStore.appendMessage(conversation, ChatMessage.Role.ASSISTANT, reply).getId();
        }
        log.info("[Orchestrator] Confirmation owner={} toolCall={} decision={} -> {}",
                ownerId, record.getId(), request.decision().value(), outcome.record().getStatus().value());
        return new TurnResponse(conversation.getId(), messageId, reply,
                List.of(ToolCallView.from(outcome.record(), objectMapper)));
    }

    public List<ToolDescriptor> tools() {
        return toolRegistry.descriptors();
    }

    // ── Steps ────────────────────────────────────────────────────────────────

    static String sanitize(String message) {
        String cleaned = message == null ? "" : ROLE_MARKER.matcher(message).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            throw new InvalidToolArgumentsException("Message cannot be empty");
        }
        return cleaned;
    }

    private Conversation resolveConversation(Long ownerId, Long conversationId) {
        if (conversationId == null) {
            return conversationStore.createConversation(ownerId);
        }
        Optional<Conversation> own = conversationStore.findConversation(ownerId, conversationId);
        if (own.isPresent()) {
            return own.get();
        }
        if (conversationStore.existsForAnyOwner(conversationId)) {
            log.warn("[Orchestrator] owner={} tried to use conversation {} of another owner", ownerId, conversationId);
            throw new OwnershipViolationException("conversation", conversationId);
        }
        log.info("[Orchestrator] Conversation {} does not exist, starting a new one", conversationId);
        return conversationStore.createConversation(ownerId);
    }

    private ChatMessage persistUserMessage(Conversation conversation, String text, String idempotencyKey) {
        try {
            return conversationStore.appendMessage(conversation, ChatMessage.Role.USER, text, List.of(), idempotencyKey, null);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) throw e;
            // a concurrent request with the same key won the insert
            return conversationStore.findByIdempotencyKey(conversation.getOwnerId(), conversation.getId(), idempotencyKey)
                    .orElseThrow(() -> e);
        }
    }

    private AssistantDecision invokeAssistant(List<Message> context, String userMessage) {
        try {
            return Retry.decorateSupplier(assistantRetry, () -> {
                try {
                    return assistantInvoker.invoke(context, userMessage, toolRegistry.llmTools());
                } catch (TaskmateException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new ModelInvocationException("Assistant call failed: " + e.getMessage(), e);
                }
            }).get();
        } catch (ModelInvocationException e) {
            log.error("[Orchestrator] Assistant unavailable after retry: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * A task id naming another owner's task fails the whole turn before any
     * record is written or any tool runs.
     */
    private void checkTaskOwnership(Long ownerId, List<ProposedInvocation> invocations) {
        for (ProposedInvocation invocation : invocations) {
            Long taskId = taskIdOf(invocation);
            if (taskId != null && taskStore.find(ownerId, taskId).isEmpty() && taskStore.existsForAnyOwner(taskId)) {
                log.warn("[Orchestrator] owner={} proposed {} on task {} of another owner",
                        ownerId, invocation.toolName(), taskId);
                throw new OwnershipViolationException("task", taskId);
            }
        }
    }

    /**
     * Builds one unsaved record per proposal.  Records the gate cleared stay
     * PROPOSED without requiring confirmation; unresolvable ones are FAILED.
     * When any reference in the turn was ambiguous, every other mutation of
     * the turn waits for a confirmation too.
     */
    private List<ToolCallRecord> plan(Long ownerId, List<ProposedInvocation> invocations) {
        List<ToolCallRecord> records = new ArrayList<>(invocations.size());
        boolean ambiguousTurn = false;

        for (ProposedInvocation invocation : invocations) {
            ObjectNode arguments = invocation.arguments().deepCopy();
            ToolCallRecord record = ToolCallRecord.builder()
                    .toolName(invocation.toolName())
                    .arguments(arguments.toString())
                    .build();
            records.add(record);

            Optional<TaskTool> found = toolRegistry.find(invocation.toolName());
            if (found.isEmpty()) {
                fail(record, new InvalidToolArgumentsException("Unknown tool: " + invocation.toolName()));
                continue;
            }
            TaskTool tool = found.get();
            record.setSchemaVersion(tool.schemaVersion());

            TargetPrecision precision = TargetPrecision.NONE;
            if (tool.takesTarget()) {
                try {
                    precision = resolveTarget(ownerId, invocation, arguments);
                    record.setArguments(arguments.toString());
                } catch (AmbiguousReferenceException e) {
                    ambiguousTurn = true;
                    log.warn("[Orchestrator] {} not executed: {}", tool.name(), e.getMessage());
                    record.transitionTo(ToolCallRecord.Status.FAILED);
                    record.setResult(ambiguityResult(e).toString());
                    continue;
                } catch (TaskmateException e) {
                    fail(record, e);
                    continue;
                }
            }

            ConfirmationGate.Decision decision = gate.decide(tool, precision, invocation.confidence());
            record.setRequiresConfirmation(decision == ConfirmationGate.Decision.AWAIT_CONFIRMATION);
        }

        if (ambiguousTurn) {
            for (ToolCallRecord record : records) {
                if (record.getStatus() == ToolCallRecord.Status.PROPOSED
                        && !record.awaitingConfirmation()
                        && toolRegistry.require(record.getToolName()).sensitivity() == ToolSensitivity.SENSITIVE) {
                    record.setRequiresConfirmation(true);
                }
            }
        }
        return records;
    }

    /** Pins {@code task_id} into the arguments and reports how it was found. */
    private TargetPrecision resolveTarget(Long ownerId, ProposedInvocation invocation, ObjectNode arguments) {
        if (invocation.has(TaskTool.ARG_TASK_ID)) {
            Long taskId = taskIdOf(invocation);
            if (taskId == null) {
                throw new InvalidToolArgumentsException("task_id must be a number");
            }
            taskStore.get(ownerId, taskId);
            arguments.put(TaskTool.ARG_TASK_ID, taskId);
            return TargetPrecision.EXACT_ID;
        }
        String reference = invocation.taskRef();
        if (reference == null) {
            throw new InvalidToolArgumentsException("task_id or task_ref is required");
        }
        DisambiguationResolver.Resolution resolution = disambiguationResolver.resolve(ownerId, reference);
        arguments.put(TaskTool.ARG_TASK_ID, resolution.taskId());
        return resolution.fullConfidence() ? TargetPrecision.RESOLVED_EXACT : TargetPrecision.RESOLVED_FUZZY;
    }

    private static Long taskIdOf(ProposedInvocation invocation) {
        if (!invocation.has(TaskTool.ARG_TASK_ID)) return null;
        JsonNode node = invocation.arguments().get(TaskTool.ARG_TASK_ID);
        if (node.isIntegralNumber()) return node.asLong();
        try {
            return Long.valueOf(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void fail(ToolCallRecord record, TaskmateException e) {
        log.warn("[Orchestrator] {} not executed: {}", record.getToolName(), e.getMessage());
        record.transitionTo(ToolCallRecord.Status.FAILED);
        ObjectNode result = objectMapper.createObjectNode();
        result.put("error", e.getCode());
        result.put("message", e.getMessage());
        record.setResult(result.toString());
    }

    private ObjectNode ambiguityResult(AmbiguousReferenceException e) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("error", e.getCode());
        result.put("message", e.getMessage());
        result.put("reason", e.getReason().label());
        result.put("reference", e.getReference());
        result.set("candidates", objectMapper.valueToTree(e.getCandidates()));
        return result;
    }

    private TurnResponse response(Conversation conversation, ChatMessage assistantMessage, List<ToolCallRecord> records) {
        List<ToolCallView> views = records.stream()
                .map(record -> ToolCallView.from(record, objectMapper))
                .toList();
        return new TurnResponse(conversation.getId(), assistantMessage.getId(), assistantMessage.getContent(), views);
    }
}
