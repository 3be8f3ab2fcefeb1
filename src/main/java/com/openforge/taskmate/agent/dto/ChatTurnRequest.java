package com.openforge.taskmate.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/chat.
 *
 * @param conversationId optional; a new conversation is started when absent
 * @param message        the user's natural-language message
 * @param idempotencyKey optional client key; a retried request with the
 *                       same key is answered from the stored turn
 */
public record ChatTurnRequest(

        Long conversationId,

        @NotBlank(message = "message must not be blank")
        @Size(max = 4000, message = "message must not exceed 4000 characters")
        String message,

        @Size(max = 128, message = "idempotency_key must not exceed 128 characters")
        String idempotencyKey
) {}
