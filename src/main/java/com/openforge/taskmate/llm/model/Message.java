package com.openforge.taskmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One entry of the message array sent to /chat/completions.
 *
 * role: "system" | "user" | "assistant" | "tool".
 * toolCalls is only set on assistant messages that request tools;
 * toolCallId only on "tool" result messages.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role("assistant").content(content).build();
    }
}
