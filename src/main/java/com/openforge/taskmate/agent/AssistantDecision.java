package com.openforge.taskmate.agent;

import java.util.List;

/**
 * What the assistant answered for one user message: free text, proposed
 * tool calls, or both.
 */
public record AssistantDecision(String text, List<ProposedInvocation> invocations) {

    public AssistantDecision {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
    }

    public static AssistantDecision reply(String text) {
        return new AssistantDecision(text, List.of());
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
