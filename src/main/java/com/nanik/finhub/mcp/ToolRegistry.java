package com.nanik.finhub.mcp;

import com.nanik.finhub.error.HubException;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry for the hub's built-in tools.
 *
 * Built-in tools run inside the gateway; every other tool name is routed to a
 * worker instance.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>(); // Preserve insertion order

    /**
     * Register a tool handler.
     */
    public void register(ToolHandler handler) {
        String name = handler.getDefinition().getName();
        if (handlers.containsKey(name)) {
            log.warn("Replacing existing built-in tool: {}", name);
        }
        handlers.put(name, handler);
        log.debug("Registered built-in tool: {}", name);
    }

    /**
     * Register multiple tool handlers.
     */
    public void registerAll(ToolHandler... toolHandlers) {
        for (ToolHandler handler : toolHandlers) {
            register(handler);
        }
    }

    /**
     * Check if a built-in tool exists.
     */
    public boolean hasTool(String name) {
        return handlers.containsKey(name);
    }

    /**
     * Execute a built-in tool by name.
     *
     * Hub errors (validation and the like) propagate so the gateway can report
     * them as structured errors; anything else becomes an error result.
     *
     * @return the tool result, or null if the tool is not built in
     */
    public ToolResult execute(String name, McpRequest request) {
        ToolHandler handler = handlers.get(name);
        if (handler == null) {
            return null;
        }

        try {
            return handler.execute(request);
        } catch (HubException e) {
            throw e;
        } catch (Exception e) {
            log.error("Built-in tool failed: {}", name, e);
            return ToolResult.error("Tool execution failed: " + e.getMessage());
        }
    }

    /**
     * Get all tool definitions.
     */
    public List<ToolDefinition> getAllDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolHandler handler : handlers.values()) {
            definitions.add(handler.getDefinition());
        }
        return definitions;
    }
}
