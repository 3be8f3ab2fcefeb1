package com.openforge.taskmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.taskmate.error.InvalidToolArgumentsException;
import com.openforge.taskmate.error.TaskmateException;
import com.openforge.taskmate.error.ToolExecutionException;
import com.openforge.taskmate.llm.model.Tool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of task tools, in declaration order.
 *
 * {@link #execute} is the single entry point that runs a tool.  Errors from
 * the taxonomy (validation, not-found) pass through unchanged; anything else
 * the store throws is wrapped in {@link ToolExecutionException} and is never
 * retried here.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, TaskTool> tools;

    public ToolRegistry(List<TaskTool> tools) {
        Map<String, TaskTool> byName = new LinkedHashMap<>();
        for (TaskTool tool : tools) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("[ToolRegistry] Registered {} tools: {}", byName.size(), byName.keySet());
    }

    public Optional<TaskTool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public TaskTool require(String name) {
        return find(name).orElseThrow(() -> new InvalidToolArgumentsException("Unknown tool: " + name));
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream().map(ToolDescriptor::of).toList();
    }

    /** Tool definitions in the OpenAI function-calling format. */
    public List<Tool> llmTools() {
        List<Tool> definitions = new ArrayList<>(tools.size());
        for (TaskTool tool : tools.values()) {
            definitions.add(Tool.function(tool.name(), tool.description(), tool.inputSchema()));
        }
        return definitions;
    }

    public JsonNode execute(Long ownerId, String toolName, JsonNode arguments) {
        TaskTool tool = require(toolName);
        long start = System.currentTimeMillis();
        try {
            JsonNode result = tool.execute(ownerId, arguments);
            log.info("[ToolRegistry] Executed {} owner={} in {}ms",
                    toolName, ownerId, System.currentTimeMillis() - start);
            return result;
        } catch (TaskmateException e) {
            log.warn("[ToolRegistry] {} rejected owner={}: {}", toolName, ownerId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[ToolRegistry] {} failed owner={}: {}", toolName, ownerId, e.getMessage(), e);
            throw new ToolExecutionException(toolName, e);
        }
    }
}
