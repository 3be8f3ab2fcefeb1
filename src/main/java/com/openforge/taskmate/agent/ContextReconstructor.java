package com.openforge.taskmate.agent;

import com.openforge.taskmate.config.OrchestratorProperties;
import com.openforge.taskmate.conversation.ConversationStore;
import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.llm.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the model input for a conversation from persisted messages.
 *
 * Output layout:
 *   [0]    system prompt (always present)
 *   [1..n] the most recent {@code max-context-messages} user / assistant
 *          messages, oldest first
 *
 * Tool calls of an assistant message are appended to its content as one
 * line each, e.g. {@code [tool] delete_task {"task_id":4} -> executed {...}},
 * so the model can see ids it produced earlier.  Read-only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextReconstructor {

    static final String SYSTEM_PROMPT = """
            You are a task assistant. You manage the user's to-do list only through the provided tools.
            Rules:
            - Use add_task to create a task. Put only the task itself in the title.
            - Use list_tasks to show tasks.
            - For update_task, complete_task and delete_task identify the task with task_id only when \
            that exact id appears earlier in this conversation. Otherwise pass the words the user used \
            for the task in task_ref. Never invent an id.
            - Include "confidence" (0 to 1) for how sure you are about the user's intent.
            - Deletions are always confirmed by the user in the app; just propose them.
            - If the request is unclear, ask a short clarifying question instead of calling a tool.
            - Reply briefly and in the user's language.""";

    private final ConversationStore      conversationStore;
    private final OrchestratorProperties properties;

    /** Full (windowed) history of the conversation. */
    public List<Message> reconstruct(Long ownerId, Long conversationId) {
        return reconstructBefore(ownerId, conversationId, null);
    }

    /**
     * History made only of messages older than {@code beforeMessageId};
     * null means no bound.
     */
    public List<Message> reconstructBefore(Long ownerId, Long conversationId, Long beforeMessageId) {
        List<ChatMessage> history = conversationStore.listMessages(ownerId, conversationId);
        if (beforeMessageId != null) {
            history = history.stream()
                    .takeWhile(message -> !message.getId().equals(beforeMessageId))
                    .toList();
        }

        int window = Math.max(0, properties.maxContextMessages());
        if (history.size() > window) {
            log.debug("[Context] Conversation {} trimmed from {} to {} messages",
                    conversationId, history.size(), window);
            history = history.subList(history.size() - window, history.size());
        }

        Map<Long, List<ToolCallRecord>> toolCalls = conversationStore.toolCallsByMessage(history);

        List<Message> context = new ArrayList<>(history.size() + 1);
        context.add(Message.system(SYSTEM_PROMPT));
        for (ChatMessage message : history) {
            List<ToolCallRecord> calls = toolCalls.getOrDefault(message.getId(), List.of());
            if (message.getRole() == ChatMessage.Role.ASSISTANT && calls.isEmpty()
                    && (message.getContent() == null || message.getContent().isBlank())) {
                continue;
            }
            context.add(render(message, calls));
        }
        return context;
    }

    private static Message render(ChatMessage message, List<ToolCallRecord> toolCalls) {
        if (message.getRole() == ChatMessage.Role.USER) {
            return Message.user(message.getContent());
        }
        if (toolCalls.isEmpty()) {
            return Message.assistant(message.getContent());
        }
        StringBuilder content = new StringBuilder(message.getContent() == null ? "" : message.getContent());
        for (ToolCallRecord call : toolCalls) {
            if (!content.isEmpty()) content.append('\n');
            content.append("[tool] ").append(call.getToolName())
                    .append(' ').append(call.getArguments())
                    .append(" -> ").append(call.getStatus().value());
            if (call.getResult() != null) {
                content.append(' ').append(call.getResult());
            }
        }
        return Message.assistant(content.toString());
    }
}
