package com.nanik.finhub.tools;

import com.nanik.finhub.protocol.McpRequest;

/**
 * A tool served by the hub itself rather than by a worker.
 *
 * Each tool must provide:
 * - A definition (name, description, input schema)
 * - An execute method that processes requests
 */
public interface ToolHandler {

    /**
     * Get the tool definition for this handler.
     * This is used to populate the tools/list response.
     */
    ToolDefinition getDefinition();

    /**
     * Execute the tool.
     *
     * @param request request whose params are the tool arguments
     * @return the result of the tool execution
     * @throws com.nanik.finhub.error.ValidationException for malformed arguments
     */
    ToolResult execute(McpRequest request);
}
