package com.openforge.taskmate.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Persisted lifecycle of one tool invocation proposed by the assistant.
 *
 * Status chain:
 *
 *   PROPOSED ──► CONFIRMED ──► EXECUTED
 *      │             └───────► FAILED
 *      ├──► CANCELLED
 *      ├──► EXECUTED   (safe tools, or auto-confirmed mutations)
 *      └──► FAILED     (disambiguation or validation failure)
 *
 * A record never moves backwards and never re-enters PROPOSED; every
 * change goes through {@link #transitionTo(Status)}.
 *
 * arguments / result hold JSON text.  schemaVersion is the version of the
 * tool schema the arguments were written against, so old rows stay
 * readable after an additive schema change.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "tool_call_records",
    indexes = {
        @Index(name = "idx_tool_calls_message", columnList = "message_id"),
        @Index(name = "idx_tool_calls_status", columnList = "status, create_time")
    }
)
public class ToolCallRecord extends BaseEntity {

    public enum Status {
        PROPOSED,
        CONFIRMED,
        CANCELLED,
        EXECUTED,
        FAILED;

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case PROPOSED  -> next == CONFIRMED || next == CANCELLED
                               || next == EXECUTED  || next == FAILED;
                case CONFIRMED -> next == EXECUTED || next == FAILED;
                case CANCELLED, EXECUTED, FAILED -> false;
            };
        }

        public boolean isTerminal() {
            return this == CANCELLED || this == EXECUTED || this == FAILED;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** The assistant message that proposed this call. */
    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "tool_name", nullable = false, length = 64)
    private String toolName;

    @Builder.Default
    @Column(name = "schema_version", nullable = false)
    private Integer schemaVersion = 1;

    @Column(name = "arguments", nullable = false, columnDefinition = "TEXT")
    private String arguments;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status = Status.PROPOSED;

    /** True when the gate held this call for an explicit confirm round-trip. */
    @Builder.Default
    @Column(name = "requires_confirmation", nullable = false)
    private Boolean requiresConfirmation = false;

    /** Outcome JSON; populated once the record reaches a terminal status. */
    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public void transitionTo(Status next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Tool call %s cannot move from %s to %s"
                    .formatted(getId(), status, next));
        }
        this.status = next;
        if (next != Status.PROPOSED) {
            this.resolvedAt = LocalDateTime.now();
        }
    }

    public boolean awaitingConfirmation() {
        return status == Status.PROPOSED && Boolean.TRUE.equals(requiresConfirmation);
    }
}
