package com.openforge.taskmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of a /chat/completions call.  A blank model is replaced with the
 * provider's configured model before sending.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    /**
     * Tool-enabled request.  Low temperature: tool selection should be as
     * repeatable as the model allows.
     */
    public static ChatRequest withTools(List<Message> messages, List<Tool> tools) {
        return ChatRequest.builder()
                .messages(messages)
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .temperature(0.2)
                .maxTokens(1024)
                .build();
    }
}
