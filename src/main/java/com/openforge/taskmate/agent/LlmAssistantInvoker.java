package com.openforge.taskmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.taskmate.error.ModelInvocationException;
import com.openforge.taskmate.llm.LlmClient;
import com.openforge.taskmate.llm.LlmRouter;
import com.openforge.taskmate.llm.model.ChatRequest;
import com.openforge.taskmate.llm.model.ChatResponse;
import com.openforge.taskmate.llm.model.Message;
import com.openforge.taskmate.llm.model.Tool;
import com.openforge.taskmate.llm.model.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link AssistantInvoker} backed by an OpenAI-compatible chat completion
 * (through {@link LlmRouter}, so primary/fallback routing and circuit
 * breaking apply).
 *
 * Tool calls naming an unknown tool are dropped.  Arguments that are not a
 * JSON object are kept as {@code {"_unparsed": "<raw>"}} so the failure is
 * recorded instead of lost.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmAssistantInvoker implements AssistantInvoker {

    static final String UNPARSED_ARGUMENTS = "_unparsed";

    private final LlmRouter    llmRouter;
    private final ObjectMapper objectMapper;

    @Override
    public AssistantDecision invoke(List<Message> context, String userMessage, List<Tool> tools) {
        List<Message> messages = new ArrayList<>(context);
        messages.add(Message.user(userMessage));

        ChatResponse response;
        try {
            response = llmRouter.chat(ChatRequest.withTools(messages, tools));
        } catch (LlmClient.LlmException e) {
            throw new ModelInvocationException("Assistant call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ModelInvocationException("Assistant returned an empty response");
        }
        Message reply;
        try {
            reply = response.firstMessage();
        } catch (IllegalStateException e) {
            throw new ModelInvocationException(e.getMessage(), e);
        }

        Set<String> known = tools.stream()
                .map(tool -> tool.function().name())
                .collect(Collectors.toSet());

        List<ProposedInvocation> invocations = new ArrayList<>();
        for (ToolCall call : response.toolCalls()) {
            if (!known.contains(call.name())) {
                log.warn("[Assistant] Dropping call to unknown tool '{}'", call.name());
                continue;
            }
            invocations.add(new ProposedInvocation(call.id(), call.name(), parseArguments(call)));
        }

        log.debug("[Assistant] Reply textLength={} toolCalls={}",
                reply.content() == null ? 0 : reply.content().length(), invocations.size());
        return new AssistantDecision(reply.content(), invocations);
    }

    private ObjectNode parseArguments(ToolCall call) {
        String raw = call.rawArguments();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(raw);
            if (parsed instanceof ObjectNode object) {
                return object;
            }
        } catch (JsonProcessingException e) {
            log.warn("[Assistant] Unparsable arguments for {}: {}", call.name(), e.getOriginalMessage());
        }
        ObjectNode unparsed = objectMapper.createObjectNode();
        unparsed.put(UNPARSED_ARGUMENTS, raw);
        return unparsed;
    }
}
