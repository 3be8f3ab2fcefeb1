package com.openforge.taskmate.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.taskmate.domain.ToolCallRecord;

/**
 * Client view of a {@link ToolCallRecord}.  Arguments and result are
 * emitted as JSON, not as the stored text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallView(
        Long                  id,
        String                name,
        JsonNode              arguments,
        ToolCallRecord.Status status,
        JsonNode              result,
        boolean               requiresConfirmation
) {

    public static ToolCallView from(ToolCallRecord record, ObjectMapper objectMapper) {
        return new ToolCallView(
                record.getId(),
                record.getToolName(),
                readJson(objectMapper, record.getArguments()),
                record.getStatus(),
                readJson(objectMapper, record.getResult()),
                record.awaitingConfirmation());
    }

    private static JsonNode readJson(ObjectMapper objectMapper, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            // stored by this application, so only legacy rows end up here
            return objectMapper.getNodeFactory().textNode(json);
        }
    }
}
