package com.nanik.finhub.tools.impl;

import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.SchemaBuilder;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

/**
 * Removes a worker instance from routing. Unknown ids are not an error.
 */
public class UnregisterSpokeTool implements ToolHandler {

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            "hub_unregister_spoke",
            "Deregister a worker instance (spoke). Idempotent.",
            new SchemaBuilder()
                    .addString("instance_id", "Instance to remove", true)
                    .build());

    private final Hub hub;

    public UnregisterSpokeTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        String instanceId = request.requireStringParam("instance_id");

        boolean removed = hub.deregister(instanceId);

        JsonObject result = new JsonObject();
        result.addProperty("status", removed ? "unregistered" : "not_registered");
        result.addProperty("instance_id", instanceId);
        return ToolResult.json(result);
    }
}
