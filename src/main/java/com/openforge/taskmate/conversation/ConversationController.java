package com.openforge.taskmate.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.auth.CurrentOwner;
import com.openforge.taskmate.conversation.dto.ConversationResponse;
import com.openforge.taskmate.conversation.dto.MessageResponse;
import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.error.OwnershipViolationException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Conversation history for the chat UI.
 *
 * Endpoints:
 *   GET    /api/conversations                          - caller's conversations, most recent first
 *   POST   /api/conversations                          - start an empty conversation
 *   GET    /api/conversations/latest                   - most recent one, 204 when none
 *   GET    /api/conversations/{id}/messages?limit=N    - messages with their tool calls
 *   DELETE /api/conversations/{id}/messages            - clear the history
 *   DELETE /api/conversations/{id}/messages/{msgId}    - delete one message
 *   DELETE /api/conversations/{id}                     - delete the conversation
 *
 * A conversation that exists for another owner answers 403; one that does
 * not exist at all answers 404.
 */
@Slf4j
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationStore conversationStore;
    private final ObjectMapper      objectMapper;

    @GetMapping
    public ResponseEntity<List<ConversationResponse>> list() {
        Long ownerId = CurrentOwner.require();
        return ResponseEntity.ok(conversationStore.listConversations(ownerId).stream()
                .map(ConversationResponse::from)
                .toList());
    }

    @PostMapping
    public ResponseEntity<ConversationResponse> create() {
        Long ownerId = CurrentOwner.require();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ConversationResponse.from(conversationStore.createConversation(ownerId)));
    }

    @GetMapping("/latest")
    public ResponseEntity<ConversationResponse> latest() {
        Long ownerId = CurrentOwner.require();
        return conversationStore.latestConversation(ownerId)
                .map(conversation -> ResponseEntity.ok(ConversationResponse.from(conversation)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}/messages")
    public ResponseEntity<List<MessageResponse>> messages(
            @PathVariable Long id,
            @RequestParam(required = false) @Min(1) @Max(500) Integer limit) {
        Long ownerId = requireAccess(id);
        List<ChatMessage> messages = limit == null
                ? conversationStore.listMessages(ownerId, id)
                : conversationStore.listLatestMessages(ownerId, id, limit);
        Map<Long, List<ToolCallRecord>> toolCalls = conversationStore.toolCallsByMessage(messages);
        return ResponseEntity.ok(messages.stream()
                .map(message -> MessageResponse.from(message,
                        toolCalls.getOrDefault(message.getId(), List.of()), objectMapper))
                .toList());
    }

    @DeleteMapping("/{id}/messages")
    public ResponseEntity<Map<String, Long>> clear(@PathVariable Long id) {
        Long ownerId = requireAccess(id);
        return ResponseEntity.ok(Map.of("deleted", conversationStore.clearMessages(ownerId, id)));
    }

    @DeleteMapping("/{id}/messages/{messageId}")
    public ResponseEntity<Void> deleteMessage(@PathVariable Long id, @PathVariable Long messageId) {
        Long ownerId = requireAccess(id);
        conversationStore.deleteMessage(ownerId, id, messageId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        Long ownerId = requireAccess(id);
        conversationStore.deleteConversation(ownerId, id);
        return ResponseEntity.noContent().build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Owner id, after turning a cross-tenant id into 403 instead of 404. */
    private Long requireAccess(Long conversationId) {
        Long ownerId = CurrentOwner.require();
        if (conversationStore.findConversation(ownerId, conversationId).isEmpty()
                && conversationStore.existsForAnyOwner(conversationId)) {
            log.warn("[Conversations] owner={} denied access to conversation {}", ownerId, conversationId);
            throw new OwnershipViolationException("conversation", conversationId);
        }
        return ownerId;
    }
}
