package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.Registration;
import com.nanik.finhub.catalog.ToolDescriptor;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.SchemaBuilder;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

/**
 * Registers (or re-registers) a worker instance and the tools it offers.
 * The arguments are the registration payload itself.
 */
public class RegisterSpokeTool implements ToolHandler {

    private final Hub hub;
    private final ToolDefinition definition;

    public RegisterSpokeTool(Hub hub) {
        this.hub = hub;

        JsonObject toolItem = new SchemaBuilder()
                .addString("tool_id", "Tool identifier, unique per instance", true)
                .addString("name", "Display name", false)
                .addString("description", "What the tool does", false)
                .addInteger("timeout_seconds", "Per-call timeout", false, ToolDescriptor.DEFAULT_TIMEOUT_SECONDS)
                .addInteger("retry_attempts", "Additional attempts on other instances", false,
                        ToolDescriptor.DEFAULT_RETRY_ATTEMPTS)
                .build();
        toolItem.getAsJsonObject("properties").add("input_schema", objectType("JSON schema of the arguments"));
        toolItem.getAsJsonObject("properties").add("output_schema", objectType("JSON schema of the result"));

        this.definition = new ToolDefinition(
                "hub_register_spoke",
                "Register a worker instance (spoke) and the tools it serves. Re-registering an id replaces it.",
                new SchemaBuilder()
                        .addString("instance_id", "Unique instance identifier", true)
                        .addString("name", "Display name", false)
                        .addString("address", "Base http(s) URL of the worker", true)
                        .addInteger("weight", "Routing weight, higher is preferred", false,
                                WorkerInstance.DEFAULT_WEIGHT)
                        .addString("health_check_url", "Probe URL, defaults to <address>/health", false)
                        .addInteger("health_check_interval", "Advertised probe interval in seconds", false,
                                WorkerInstance.DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS)
                        .addInteger("ttl_seconds", "Seconds without activity before expiry", false,
                                WorkerInstance.DEFAULT_TTL_SECONDS)
                        .addArray("tools", "Tools offered by the instance", toolItem, false)
                        .build());
    }

    private static JsonObject objectType(String description) {
        JsonObject prop = new JsonObject();
        prop.addProperty("type", "object");
        prop.addProperty("description", description);
        return prop;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        Registration registration = hub.getCodec().parse(request.getParams());
        WorkerInstance registered = hub.getCatalog()
                .register(registration.getInstance(), registration.getTools());

        JsonObject result = new JsonObject();
        result.addProperty("status", "registered");
        result.addProperty("instance_id", registered.getId());
        result.addProperty("address", registered.getAddress());
        JsonArray tools = new JsonArray();
        for (ToolDescriptor tool : registration.getTools()) {
            tools.add(tool.getToolId());
        }
        result.add("tools", tools);
        return ToolResult.json(result);
    }
}
