package com.openforge.taskmate.agent;

import com.openforge.taskmate.llm.model.Message;
import com.openforge.taskmate.llm.model.Tool;

import java.util.List;

/**
 * Boundary to the language model.  Given the rendered history, the new user
 * message and the published tools, returns a reply and/or proposed tool
 * calls.
 *
 * Implementations never return a tool that is not in {@code tools} and
 * raise {@link com.openforge.taskmate.error.ModelInvocationException} on
 * any failure or timeout.
 */
public interface AssistantInvoker {

    AssistantDecision invoke(List<Message> context, String userMessage, List<Tool> tools);
}
