package com.openforge.taskmate.llm.model;

import java.util.List;

/** Non-streaming /chat/completions response; only the fields we read. */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices
) {

    public record Choice(int index, Message message, String finishReason) {}

    public Message firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("LLM returned no choices in response " + id);
        }
        return choices.get(0).message();
    }

    public List<ToolCall> toolCalls() {
        Message message = firstMessage();
        return message.toolCalls() == null ? List.of() : message.toolCalls();
    }
}
