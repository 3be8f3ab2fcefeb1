package com.openforge.taskmate.agent.dto;

import java.util.List;

/**
 * Response of a chat turn or of a confirmation.
 *
 * @param conversationId conversation the turn belongs to
 * @param messageId      the assistant message holding the reply; null
 *                       when a confirmation changed nothing
 * @param reply          natural-language reply
 * @param toolCalls      tool calls of this turn, with their current status
 */
public record TurnResponse(
        Long               conversationId,
        Long               messageId,
        String             reply,
        List<ToolCallView> toolCalls
) {}
