package com.openforge.taskmate.agent.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.NotNull;

import java.util.Locale;

/** Request body for POST /api/chat/confirmations. */
public record ConfirmationRequest(

        @NotNull(message = "conversation_id is required")
        Long conversationId,

        @NotNull(message = "tool_call_id is required")
        Long toolCallId,

        @NotNull(message = "decision must be confirm or cancel")
        Decision decision
) {

    public enum Decision {
        CONFIRM,
        CANCEL;

        @JsonCreator
        public static Decision parse(String value) {
            if (value == null) return null;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("decision must be confirm or cancel (got '%s')".formatted(value));
            }
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
