package com.openforge.taskmate.conversation;

import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.Conversation;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.error.ResourceNotFoundException;
import com.openforge.taskmate.repository.ChatMessageRepository;
import com.openforge.taskmate.repository.ConversationRepository;
import com.openforge.taskmate.repository.ToolCallRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent home of conversations, their messages and the tool-call
 * records attached to assistant messages.
 *
 * Append-only apart from the owner's explicit clear / delete operations.
 * Every read and write is scoped by owner: a conversation belonging to
 * someone else fails closed with {@link ResourceNotFoundException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStore {

    private final ConversationRepository   conversationRepository;
    private final ChatMessageRepository    messageRepository;
    private final ToolCallRecordRepository toolCallRepository;

    // ── Conversations ────────────────────────────────────────────────────────

    @Transactional
    public Conversation createConversation(Long ownerId) {
        Conversation saved = conversationRepository.save(Conversation.builder().ownerId(ownerId).build());
        log.info("[Conversations] Created conversation id={} owner={}", saved.getId(), ownerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Conversation getConversation(Long ownerId, Long conversationId) {
        return findConversation(ownerId, conversationId)
                .orElseThrow(() -> new ResourceNotFoundException("conversation", conversationId));
    }

    @Transactional(readOnly = true)
    public Optional<Conversation> findConversation(Long ownerId, Long conversationId) {
        if (conversationId == null) return Optional.empty();
        return conversationRepository.findByIdAndOwnerId(conversationId, ownerId);
    }

    /** Out-of-band existence check; see {@link com.openforge.taskmate.task.TaskStore#existsForAnyOwner}. */
    @Transactional(readOnly = true)
    public boolean existsForAnyOwner(Long conversationId) {
        return conversationId != null && conversationRepository.existsById(conversationId);
    }

    /** Most recently updated first. */
    @Transactional(readOnly = true)
    public List<Conversation> listConversations(Long ownerId) {
        return conversationRepository.findByOwnerIdOrderByUpdateTimeDescIdDesc(ownerId);
    }

    @Transactional(readOnly = true)
    public Optional<Conversation> latestConversation(Long ownerId) {
        return conversationRepository.findFirstByOwnerIdOrderByUpdateTimeDescIdDesc(ownerId);
    }

    @Transactional
    public void deleteConversation(Long ownerId, Long conversationId) {
        Conversation conversation = getConversation(ownerId, conversationId);
        long records  = toolCallRepository.deleteByConversationId(conversation.getId());
        long messages = messageRepository.deleteByConversationId(conversation.getId());
        conversationRepository.delete(conversation);
        log.info("[Conversations] Deleted conversation id={} owner={} messages={} toolCalls={}",
                conversationId, ownerId, messages, records);
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    @Transactional
    public ChatMessage appendMessage(Conversation conversation, ChatMessage.Role role, String content) {
        return appendMessage(conversation, role, content, List.of(), null, null);
    }

    /**
     * Append a message and attach the given (unsaved) tool-call records to it.
     * The records inherit message, conversation and owner ids from here, so a
     * record can never point at another user's conversation.
     */
    @Transactional
    public ChatMessage appendMessage(Conversation conversation,
                                     ChatMessage.Role role,
                                     String content,
                                     List<ToolCallRecord> toolCalls,
                                     String idempotencyKey,
                                     Long replyToMessageId) {
        ChatMessage message = messageRepository.save(ChatMessage.builder()
                .conversationId(conversation.getId())
                .ownerId(conversation.getOwnerId())
                .role(role)
                .content(content == null ? "" : content)
                .idempotencyKey(idempotencyKey)
                .replyToMessageId(replyToMessageId)
                .build());

        for (ToolCallRecord record : toolCalls) {
            record.setMessageId(message.getId());
            record.setConversationId(conversation.getId());
            record.setOwnerId(conversation.getOwnerId());
        }
        if (!toolCalls.isEmpty()) {
            // new entities are persisted in place, so the caller's records get their ids
            toolCallRepository.saveAll(toolCalls);
        }

        touch(conversation.getId());
        log.debug("[Conversations] Appended {} message id={} conversation={} toolCalls={}",
                role, message.getId(), conversation.getId(), toolCalls.size());
        return message;
    }

    @Transactional
    public ChatMessage updateContent(Long messageId, String content) {
        ChatMessage message = messageRepository.findById(messageId)
                .orElseThrow(() -> new ResourceNotFoundException("message", messageId));
        message.setContent(content);
        return messageRepository.save(message);
    }

    /** Full history, chronological. */
    @Transactional(readOnly = true)
    public List<ChatMessage> listMessages(Long ownerId, Long conversationId) {
        Conversation conversation = getConversation(ownerId, conversationId);
        return messageRepository.findByConversationIdOrderByCreateTimeAscIdAsc(conversation.getId());
    }

    /** The latest {@code limit} messages, still returned in chronological order. */
    @Transactional(readOnly = true)
    public List<ChatMessage> listLatestMessages(Long ownerId, Long conversationId, int limit) {
        Conversation conversation = getConversation(ownerId, conversationId);
        List<ChatMessage> latest = new ArrayList<>(messageRepository
                .findByConversationIdOrderByCreateTimeDescIdDesc(conversation.getId(), PageRequest.of(0, limit)));
        Collections.reverse(latest);
        return latest;
    }

    @Transactional(readOnly = true)
    public Optional<ChatMessage> findByIdempotencyKey(Long ownerId, Long conversationId, String idempotencyKey) {
        Conversation conversation = getConversation(ownerId, conversationId);
        return messageRepository.findByConversationIdAndIdempotencyKey(conversation.getId(), idempotencyKey);
    }

    @Transactional(readOnly = true)
    public Optional<ChatMessage> findReplyTo(Long userMessageId) {
        return messageRepository.findFirstByReplyToMessageIdOrderByIdAsc(userMessageId);
    }

    @Transactional
    public long clearMessages(Long ownerId, Long conversationId) {
        Conversation conversation = getConversation(ownerId, conversationId);
        toolCallRepository.deleteByConversationId(conversation.getId());
        long deleted = messageRepository.deleteByConversationId(conversation.getId());
        touch(conversation.getId());
        log.info("[Conversations] Cleared conversation id={} owner={} messages={}", conversationId, ownerId, deleted);
        return deleted;
    }

    @Transactional
    public void deleteMessage(Long ownerId, Long conversationId, Long messageId) {
        Conversation conversation = getConversation(ownerId, conversationId);
        ChatMessage message = messageRepository.findByIdAndConversationId(messageId, conversation.getId())
                .orElseThrow(() -> new ResourceNotFoundException("message", messageId));
        toolCallRepository.deleteByMessageId(message.getId());
        messageRepository.delete(message);
        touch(conversation.getId());
        log.info("[Conversations] Deleted message id={} conversation={} owner={}", messageId, conversationId, ownerId);
    }

    // ── Tool-call records ────────────────────────────────────────────────────

    /** Records grouped by message id, each group in proposal order. */
    @Transactional(readOnly = true)
    public Map<Long, List<ToolCallRecord>> toolCallsByMessage(List<ChatMessage> messages) {
        Map<Long, List<ToolCallRecord>> grouped = new LinkedHashMap<>();
        if (messages.isEmpty()) return grouped;
        List<Long> ids = messages.stream().map(ChatMessage::getId).toList();
        for (ToolCallRecord record : toolCallRepository.findByMessageIdInOrderByIdAsc(ids)) {
            grouped.computeIfAbsent(record.getMessageId(), k -> new ArrayList<>()).add(record);
        }
        return grouped;
    }

    @Transactional(readOnly = true)
    public List<ToolCallRecord> toolCallsOf(Long messageId) {
        return toolCallRepository.findByMessageIdOrderByIdAsc(messageId);
    }

    /** Unscoped lookup; the caller checks ownership itself. */
    @Transactional(readOnly = true)
    public Optional<ToolCallRecord> findToolCall(Long toolCallId) {
        return toolCallId == null ? Optional.empty() : toolCallRepository.findById(toolCallId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void touch(Long conversationId) {
        conversationRepository.touch(conversationId, LocalDateTime.now());
    }
}
