package com.openforge.taskmate.conversation.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.agent.dto.ToolCallView;
import com.openforge.taskmate.domain.ChatMessage;
import com.openforge.taskmate.domain.ToolCallRecord;

import java.time.LocalDateTime;
import java.util.List;

/** A stored message with the tool calls it proposed (empty for user messages). */
public record MessageResponse(
        Long               id,
        ChatMessage.Role   role,
        String             content,
        LocalDateTime      createdAt,
        List<ToolCallView> toolCalls
) {

    public static MessageResponse from(ChatMessage message, List<ToolCallRecord> toolCalls, ObjectMapper objectMapper) {
        return new MessageResponse(
                message.getId(),
                message.getRole(),
                message.getContent(),
                message.getCreateTime(),
                toolCalls.stream().map(record -> ToolCallView.from(record, objectMapper)).toList());
    }
}
