package com.openforge.taskmate.conversation.dto;

import com.openforge.taskmate.domain.Conversation;

import java.time.LocalDateTime;

public record ConversationResponse(
        Long          id,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime lastMessageAt
) {

    public static ConversationResponse from(Conversation conversation) {
        return new ConversationResponse(
                conversation.getId(),
                conversation.getCreateTime(),
                conversation.getUpdateTime(),
                conversation.getLastMessageTime());
    }
}
