package com.openforge.taskmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.agent.dto.ChatTurnRequest;
import com.openforge.taskmate.agent.dto.ConfirmationRequest;
import com.openforge.taskmate.agent.dto.ToolCallView;
import com.openforge.taskmate.agent.dto.TurnResponse;
import com.openforge.taskmate.conversation.ConversationStore;
import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.Conversation;
import com.openforge.taskmate.domain.Task;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.error.ModelInvocationException;
import com.openforge.taskmate.error.OwnershipViolationException;
import com.openforge.taskmate.repository.ChatMessageRepository;
import com.openforge.taskmate.repository.ConversationRepository;
import com.openforge.taskmate.repository.TaskRepository;
import com.openforge.taskmate.repository.ToolCallRecordRepository;
import com.openforge.taskmate.task.TaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end turns against the real stores (H2) with a scripted assistant.
 */
@SpringBootTest
public class ChatOrchestratorScenarioTest {

    private static final Long ALICE = 1L;
    private static final Long BOB   = 2L;

    @MockBean
    private AssistantInvoker assistantInvoker;

    @Autowired
    private ChatOrchestrator orchestrator;

    @Autowired
    private AbandonedProposalSweeper sweeper;

    @SpyBean
    private TaskStore taskStore;

    @Autowired
    private ConversationStore conversationStore;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private ChatMessageRepository messageRepository;

    @Autowired
    private ToolCallRecordRepository toolCallRepository;

    @AfterEach
    public void cleanUp() {
        toolCallRepository.deleteAll();
        messageRepository.deleteAll();
        conversationRepository.deleteAll();
        taskRepository.deleteAll();
    }

    // ── Scenario A: add on an empty list ─────────────────────────────────────

    @Test
    public void shouldAddTaskAndExecuteInTheSameTurn() {
        assistantReplies(call("add_task", "{\"title\":\"buy groceries\"}"));

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "Add a task to buy groceries"));

        Assertions.assertNotNull(response.conversationId());
        Assertions.assertEquals(1, response.toolCalls().size());
        ToolCallView view = response.toolCalls().get(0);
        Assertions.assertEquals("add_task", view.name());
        Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, view.status());
        Assertions.assertFalse(view.requiresConfirmation());
        Assertions.assertEquals("I've added 'buy groceries' to your task list.", response.reply());

        List<Task> tasks = taskStore.list(ALICE, TaskStore.StatusFilter.ALL);
        Assertions.assertEquals(1, tasks.size());
        Assertions.assertEquals("buy groceries", tasks.get(0).getTitle());

        List<ChatMessage> history = conversationStore.listMessages(ALICE, response.conversationId());
        Assertions.assertEquals(List.of(ChatMessage.Role.USER, ChatMessage.Role.ASSISTANT),
                history.stream().map(ChatMessage::getRole).toList());
        Assertions.assertEquals(response.messageId(), history.get(1).getId());
        Assertions.assertEquals(history.get(0).getId(), history.get(1).getReplyToMessageId());
    }

    @Test
    public void addedTaskShowsUpInALaterListTurn() {
        assistantReplies(call("add_task", "{\"title\":\"buy groceries\"}"));
        TurnResponse first = orchestrator.handleTurn(ALICE, turn(null, "Add a task to buy groceries"));

        assistantReplies(call("list_tasks", "{}"));
        TurnResponse second = orchestrator.handleTurn(ALICE, turn(first.conversationId(), "What's on my list?"));

        Assertions.assertEquals(first.conversationId(), second.conversationId());
        Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, second.toolCalls().get(0).status());
        Assertions.assertTrue(second.reply().contains("buy groceries"), second.reply());
        Assertions.assertEquals(4, conversationStore.listMessages(ALICE, first.conversationId()).size());
    }

    @Test
    public void plainTextAnswerIsReturnedAsIs() {
        when(assistantInvoker.invoke(anyList(), anyString(), anyList()))
                .thenReturn(AssistantDecision.reply("Hello! How can I help with your tasks?"));

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "hi"));

        Assertions.assertEquals("Hello! How can I help with your tasks?", response.reply());
        Assertions.assertTrue(response.toolCalls().isEmpty());
    }

    @Test
    public void modelTextIsKeptAlongsideToolOutcomes() {
        doReturn(new AssistantDecision("Sure thing! Want me to add milk too?",
                List.of(call("add_task", "{\"title\":\"buy groceries\"}"))))
                .when(assistantInvoker).invoke(anyList(), anyString(), anyList());

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "Add a task to buy groceries"));

        Assertions.assertEquals("Sure thing! Want me to add milk too?\n\n"
                + "I've added 'buy groceries' to your task list.", response.reply());
        List<ChatMessage> history = conversationStore.listMessages(ALICE, response.conversationId());
        Assertions.assertEquals(response.reply(), history.get(1).getContent());
    }

    // ── Failed runs ──────────────────────────────────────────────────────────

    @Test
    public void toolFailingAfterItsWriteRollsBackAndEndsFailed() {
        Task milk = taskStore.create(ALICE, "buy milk", null);
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new IllegalStateException("disk full");
        }).when(taskStore).setCompleted(anyLong(), anyLong(), anyBoolean());
        assistantReplies(call("complete_task", "{\"task_id\":" + milk.getId() + "}"));

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "I bought the milk"));

        ToolCallView view = response.toolCalls().get(0);
        Assertions.assertEquals(ToolCallRecord.Status.FAILED, view.status());
        Assertions.assertEquals("tool_execution_failed", view.result().path("error").asText());
        Assertions.assertEquals(ToolCallRecord.Status.FAILED,
                toolCallRepository.findById(view.id()).orElseThrow().getStatus());
        Assertions.assertFalse(taskRepository.findById(milk.getId()).orElseThrow().getCompleted());
    }

    @Test
    public void confirmedRunThatFailsLeavesTheTaskAndEndsFailed() {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("delete_task", "{\"task_id\":" + mom.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete call mom"));
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new IllegalStateException("connection reset");
        }).when(taskStore).delete(anyLong(), anyLong());

        TurnResponse confirmed = orchestrator.resolveConfirmation(ALICE, new ConfirmationRequest(
                turn.conversationId(), turn.toolCalls().get(0).id(), ConfirmationRequest.Decision.CONFIRM));

        Assertions.assertEquals(ToolCallRecord.Status.FAILED, confirmed.toolCalls().get(0).status());
        Assertions.assertTrue(taskRepository.findById(mom.getId()).isPresent());
        Assertions.assertNotNull(confirmed.messageId());
    }

    // ── Concurrency ──────────────────────────────────────────────────────────

    @Test
    public void racingConfirmsExecuteExactlyOnce() throws Exception {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("delete_task", "{\"task_id\":" + mom.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete call mom"));
        ConfirmationRequest request = new ConfirmationRequest(
                turn.conversationId(), turn.toolCalls().get(0).id(), ConfirmationRequest.Decision.CONFIRM);

        List<TurnResponse> responses = runConcurrently(4, () -> orchestrator.resolveConfirmation(ALICE, request));

        Assertions.assertEquals(1, responses.stream().filter(r -> r.messageId() != null).count());
        for (TurnResponse response : responses) {
            Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, response.toolCalls().get(0).status());
        }
        Assertions.assertTrue(taskRepository.findById(mom.getId()).isEmpty());
        verify(taskStore, times(1)).delete(ALICE, mom.getId());
    }

    @Test
    public void concurrentAppendsToOneConversationAllLand() throws Exception {
        Conversation conversation = conversationStore.createConversation(ALICE);

        List<ChatMessage> appended = runConcurrently(20,
                () -> conversationStore.appendMessage(conversation, ChatMessage.Role.USER, "ping"));

        Assertions.assertEquals(20, appended.size());
        Assertions.assertEquals(20, conversationStore.listMessages(ALICE, conversation.getId()).size());
        Assertions.assertNotNull(conversationStore.getConversation(ALICE, conversation.getId()).getLastMessageTime());
    }

    // ── Scenario B: ambiguous reference ──────────────────────────────────────

    @Test
    public void ambiguousDeleteTouchesNothingAndListsCandidates() {
        Task mom  = taskStore.create(ALICE, "Call mom", null);
        Task bank = taskStore.create(ALICE, "Call the bank", null);
        assistantReplies(call("delete_task", "{\"task_ref\":\"the call task\"}"));

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "delete the call task"));

        ToolCallView view = response.toolCalls().get(0);
        Assertions.assertEquals(ToolCallRecord.Status.FAILED, view.status());
        Assertions.assertEquals("ambiguous_reference", view.result().path("error").asText());
        Assertions.assertEquals(2, view.result().path("candidates").size());
        Assertions.assertTrue(response.reply().contains("Call mom"), response.reply());
        Assertions.assertTrue(response.reply().contains("Call the bank"), response.reply());
        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isPresent());
        Assertions.assertTrue(taskStore.find(ALICE, bank.getId()).isPresent());
    }

    @Test
    public void ambiguityHoldsTheTurnsOtherMutations() {
        taskStore.create(ALICE, "Call mom", null);
        taskStore.create(ALICE, "Call the bank", null);
        Task milk = taskStore.create(ALICE, "buy milk", null);
        assistantReplies(
                call("delete_task", "{\"task_ref\":\"call\"}"),
                call("complete_task", "{\"task_id\":" + milk.getId() + "}"));

        TurnResponse response = orchestrator.handleTurn(ALICE, turn(null, "delete the call one and finish milk"));

        Assertions.assertEquals(ToolCallRecord.Status.FAILED, response.toolCalls().get(0).status());
        ToolCallView complete = response.toolCalls().get(1);
        Assertions.assertEquals(ToolCallRecord.Status.PROPOSED, complete.status());
        Assertions.assertTrue(complete.requiresConfirmation());
        Assertions.assertFalse(taskStore.get(ALICE, milk.getId()).isCompleted());
    }

    // ── Scenario C: confirm round-trip ───────────────────────────────────────

    @Test
    public void destructiveCallWaitsForConfirmationAndSecondConfirmIsANoOp() {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        taskStore.create(ALICE, "Call the bank", null);
        assistantReplies(call("delete_task", "{\"task_ref\":\"the call mom task\"}"));

        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete the call mom task"));

        ToolCallView proposed = turn.toolCalls().get(0);
        Assertions.assertEquals(ToolCallRecord.Status.PROPOSED, proposed.status());
        Assertions.assertTrue(proposed.requiresConfirmation());
        Assertions.assertEquals(mom.getId().longValue(), proposed.arguments().path("task_id").asLong());
        Assertions.assertTrue(turn.reply().contains("Please confirm or cancel"), turn.reply());
        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isPresent());

        TurnResponse confirmed = orchestrator.resolveConfirmation(ALICE,
                new ConfirmationRequest(turn.conversationId(), proposed.id(), ConfirmationRequest.Decision.CONFIRM));

        Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, confirmed.toolCalls().get(0).status());
        Assertions.assertNotNull(confirmed.messageId());
        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isEmpty());
        int messagesAfterConfirm = conversationStore.listMessages(ALICE, turn.conversationId()).size();

        TurnResponse again = orchestrator.resolveConfirmation(ALICE,
                new ConfirmationRequest(turn.conversationId(), proposed.id(), ConfirmationRequest.Decision.CONFIRM));

        Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, again.toolCalls().get(0).status());
        Assertions.assertNull(again.messageId());
        Assertions.assertEquals(messagesAfterConfirm,
                conversationStore.listMessages(ALICE, turn.conversationId()).size());
        Assertions.assertEquals(1, taskStore.list(ALICE, TaskStore.StatusFilter.ALL).size());
    }

    @Test
    public void cancelLeavesTheTaskInPlace() {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("delete_task", "{\"task_id\":" + mom.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete call mom"));

        TurnResponse cancelled = orchestrator.resolveConfirmation(ALICE, new ConfirmationRequest(
                turn.conversationId(), turn.toolCalls().get(0).id(), ConfirmationRequest.Decision.CANCEL));

        Assertions.assertEquals(ToolCallRecord.Status.CANCELLED, cancelled.toolCalls().get(0).status());
        Assertions.assertEquals("Okay, I won't delete 'Call mom'.", cancelled.reply());
        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isPresent());
    }

    @Test
    public void confirmAfterTheWindowAbandonsInsteadOfExecuting() {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("delete_task", "{\"task_id\":" + mom.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete call mom"));
        Long toolCallId = turn.toolCalls().get(0).id();
        backdate(toolCallId, LocalDateTime.now().minusHours(1));

        TurnResponse late = orchestrator.resolveConfirmation(ALICE,
                new ConfirmationRequest(turn.conversationId(), toolCallId, ConfirmationRequest.Decision.CONFIRM));

        Assertions.assertEquals(ToolCallRecord.Status.CANCELLED, late.toolCalls().get(0).status());
        Assertions.assertEquals("abandoned", late.toolCalls().get(0).result().path("reason").asText());
        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isPresent());
    }

    @Test
    public void sweeperAbandonsStaleProposalsOnly() {
        Task mom  = taskStore.create(ALICE, "Call mom", null);
        Task bank = taskStore.create(ALICE, "Call the bank", null);
        assistantReplies(
                call("delete_task", "{\"task_id\":" + mom.getId() + "}"),
                call("delete_task", "{\"task_id\":" + bank.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete both"));
        Long stale = turn.toolCalls().get(0).id();
        Long fresh = turn.toolCalls().get(1).id();
        backdate(stale, LocalDateTime.now().minusHours(1));

        sweeper.sweep();

        Assertions.assertEquals(ToolCallRecord.Status.CANCELLED, toolCallRepository.findById(stale).orElseThrow().getStatus());
        Assertions.assertEquals(ToolCallRecord.Status.PROPOSED, toolCallRepository.findById(fresh).orElseThrow().getStatus());
    }

    // ── Scenario D: another owner's data ─────────────────────────────────────

    @Test
    public void anotherOwnersConversationIsRejected() {
        assistantReplies(call("list_tasks", "{}"));
        TurnResponse alices = orchestrator.handleTurn(ALICE, turn(null, "list my tasks"));
        long messagesBefore = messageRepository.count();

        Assertions.assertThrows(OwnershipViolationException.class,
                () -> orchestrator.handleTurn(BOB, turn(alices.conversationId(), "list my tasks")));

        Assertions.assertEquals(messagesBefore, messageRepository.count());
    }

    @Test
    public void anotherOwnersTaskIsRejectedBeforeAnythingRuns() {
        Task alices = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("complete_task", "{\"task_id\":" + alices.getId() + "}"));

        Assertions.assertThrows(OwnershipViolationException.class,
                () -> orchestrator.handleTurn(BOB, turn(null, "complete task " + alices.getId())));

        Assertions.assertFalse(taskStore.get(ALICE, alices.getId()).isCompleted());
        Assertions.assertEquals(0, toolCallRepository.count());
    }

    @Test
    public void anotherOwnerCannotConfirmAProposal() {
        Task mom = taskStore.create(ALICE, "Call mom", null);
        assistantReplies(call("delete_task", "{\"task_id\":" + mom.getId() + "}"));
        TurnResponse turn = orchestrator.handleTurn(ALICE, turn(null, "delete call mom"));

        Assertions.assertThrows(OwnershipViolationException.class, () -> orchestrator.resolveConfirmation(BOB,
                new ConfirmationRequest(turn.conversationId(), turn.toolCalls().get(0).id(),
                        ConfirmationRequest.Decision.CONFIRM)));

        Assertions.assertTrue(taskStore.find(ALICE, mom.getId()).isPresent());
        Assertions.assertEquals(ToolCallRecord.Status.PROPOSED,
                toolCallRepository.findById(turn.toolCalls().get(0).id()).orElseThrow().getStatus());
    }

    // ── Scenario E: assistant unavailable ────────────────────────────────────

    @Test
    public void failedAssistantCallLeavesOnlyTheUserMessage() {
        Conversation conversation = conversationStore.createConversation(ALICE);
        when(assistantInvoker.invoke(anyList(), anyString(), anyList()))
                .thenThrow(new ModelInvocationException("timed out"));

        Assertions.assertThrows(ModelInvocationException.class,
                () -> orchestrator.handleTurn(ALICE, turn(conversation.getId(), "Add a task to buy groceries")));

        verify(assistantInvoker, times(2)).invoke(anyList(), anyString(), anyList());
        List<ChatMessage> history = conversationStore.listMessages(ALICE, conversation.getId());
        Assertions.assertEquals(1, history.size());
        Assertions.assertEquals(ChatMessage.Role.USER, history.get(0).getRole());
        Assertions.assertEquals(0, toolCallRepository.count());
        Assertions.assertTrue(taskStore.list(ALICE, TaskStore.StatusFilter.ALL).isEmpty());

        assistantReplies(call("add_task", "{\"title\":\"buy groceries\"}"));
        TurnResponse retry = orchestrator.handleTurn(ALICE, turn(conversation.getId(), "Add a task to buy groceries"));

        Assertions.assertEquals(ToolCallRecord.Status.EXECUTED, retry.toolCalls().get(0).status());
        Assertions.assertEquals(1, taskStore.list(ALICE, TaskStore.StatusFilter.ALL).size());
    }

    // ── Idempotency ──────────────────────────────────────────────────────────

    @Test
    public void sameIdempotencyKeyReplaysTheStoredAnswer() {
        assistantReplies(call("add_task", "{\"title\":\"buy groceries\"}"));
        Conversation conversation = conversationStore.createConversation(ALICE);
        ChatTurnRequest request = new ChatTurnRequest(conversation.getId(), "Add a task to buy groceries", "key-1");

        TurnResponse first  = orchestrator.handleTurn(ALICE, request);
        TurnResponse second = orchestrator.handleTurn(ALICE, request);

        Assertions.assertEquals(first.messageId(), second.messageId());
        Assertions.assertEquals(first.reply(), second.reply());
        Assertions.assertEquals(first.toolCalls().get(0).id(), second.toolCalls().get(0).id());
        verify(assistantInvoker, times(1)).invoke(anyList(), anyString(), anyList());
        Assertions.assertEquals(1, taskStore.list(ALICE, TaskStore.StatusFilter.ALL).size());
        Assertions.assertEquals(2, conversationStore.listMessages(ALICE, conversation.getId()).size());
    }

    @Test
    public void retryAfterFailureReusesTheUserMessage() {
        Conversation conversation = conversationStore.createConversation(ALICE);
        ChatTurnRequest request = new ChatTurnRequest(conversation.getId(), "Add a task to buy groceries", "key-2");
        when(assistantInvoker.invoke(anyList(), anyString(), anyList()))
                .thenThrow(new ModelInvocationException("timed out"));
        Assertions.assertThrows(ModelInvocationException.class, () -> orchestrator.handleTurn(ALICE, request));

        assistantReplies(call("add_task", "{\"title\":\"buy groceries\"}"));
        orchestrator.handleTurn(ALICE, request);

        List<ChatMessage> history = conversationStore.listMessages(ALICE, conversation.getId());
        Assertions.assertEquals(List.of(ChatMessage.Role.USER, ChatMessage.Role.ASSISTANT),
                history.stream().map(ChatMessage::getRole).toList());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ChatTurnRequest turn(Long conversationId, String message) {
        return new ChatTurnRequest(conversationId, message, null);
    }

    private void assistantReplies(ProposedInvocation... invocations) {
        doReturn(new AssistantDecision(null, List.of(invocations)))
                .when(assistantInvoker).invoke(anyList(), anyString(), anyList());
    }

    private ProposedInvocation call(String tool, String argumentsJson) {
        try {
            return new ProposedInvocation("call_" + tool, tool, (ObjectNode) objectMapper.readTree(argumentsJson));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /** Starts all tasks together and returns their results; any failure fails the test. */
    private static <T> List<T> runConcurrently(int threads, Callable<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private void backdate(Long toolCallId, LocalDateTime createTime) {
        jdbcTemplate.update("update tool_call_records set create_time = ? where id = ?", createTime, toolCallId);
    }
}
