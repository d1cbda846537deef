package com.document.resource.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Definition of an MCP (Model Context Protocol) tool exposed to agents.
 * The host server registers the definition and calls {@link #handler()} with the tool arguments.
 *
 * @param name        the tool name (e.g., "read_resource")
 * @param description what the tool does, shown to the agent
 * @param inputSchema the JSON Schema for the tool's input parameters
 * @param handler     executes the tool, receiving input parameters and returning a result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    /**
     * Runs the tool with the given arguments.
     */
    public Map<String, Object> invoke(Map<String, Object> params) {
        return handler.apply(params != null ? params : Map.of());
    }
}
