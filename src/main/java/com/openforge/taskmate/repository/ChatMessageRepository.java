package com.openforge.taskmate.repository;

import com.openforge.taskmate.domain.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /** Chronological order: create_time, then insertion id. */
    List<ChatMessage> findByConversationIdOrderByCreateTimeAscIdAsc(Long conversationId);

    /** Reverse chronological; used to take the latest N messages. */
    List<ChatMessage> findByConversationIdOrderByCreateTimeDescIdDesc(Long conversationId, Pageable pageable);

    Optional<ChatMessage> findByIdAndConversationId(Long id, Long conversationId);

    Optional<ChatMessage> findByConversationIdAndIdempotencyKey(Long conversationId, String idempotencyKey);

    Optional<ChatMessage> findFirstByReplyToMessageIdOrderByIdAsc(Long replyToMessageId);

    long deleteByConversationId(Long conversationId);
}
