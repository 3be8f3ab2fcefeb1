package com.openforge.taskmate.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.*;

import java.util.Locale;

/**
 * One turn inside a {@link Conversation}.
 *
 * Ordering inside a conversation is (create_time, id) ascending.  Assistant
 * messages own the {@link ToolCallRecord}s they proposed (joined by
 * message_id); user messages never have any.
 *
 *  idempotencyKey   - optional client key on user messages; unique per
 *                     conversation so a retried request cannot insert twice.
 *  replyToMessageId - on assistant messages, the user message being answered.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_messages",
    indexes = @Index(name = "idx_messages_conversation", columnList = "conversation_id, create_time"),
    uniqueConstraints = @UniqueConstraint(
            name = "uq_message_idempotency",
            columnNames = {"conversation_id", "idempotency_key"})
)
public class ChatMessage extends BaseEntity {

    public enum Role {
        USER,
        ASSISTANT;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "idempotency_key", length = 128)
    private String idempotencyKey;

    @Column(name = "reply_to_message_id")
    private Long replyToMessageId;
}
