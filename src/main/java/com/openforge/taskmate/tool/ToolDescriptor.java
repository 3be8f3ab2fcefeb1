package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;

/** Published shape of a tool, as returned by GET /api/chat/tools. */
public record ToolDescriptor(
        String   name,
        String   description,
        JsonNode inputSchema,
        JsonNode outputSchema,
        int      version
) {

    static ToolDescriptor of(TaskTool tool) {
        return new ToolDescriptor(tool.name(), tool.description(),
                tool.inputSchema(), tool.outputSchema(), tool.schemaVersion());
    }
}
