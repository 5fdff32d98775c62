package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * No active, healthy instance offers the requested tool.
 */
public class ToolUnavailableException extends HubException {

    private final String toolName;

    public ToolUnavailableException(String toolName) {
        super("No healthy instance offers tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public int getCode() {
        return McpError.TOOL_UNAVAILABLE;
    }
}
