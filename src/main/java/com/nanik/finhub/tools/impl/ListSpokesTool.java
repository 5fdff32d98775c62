package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.ToolDescriptor;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

import java.util.List;

/**
 * Lists every catalog instance with its routing state.
 */
public class ListSpokesTool implements ToolHandler {

    private static final ToolDefinition DEFINITION = ToolDefinition.noParams(
            "hub_list_spokes",
            "List registered worker instances with health, load, circuit state and tools."
    );

    private final Hub hub;

    public ListSpokesTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        List<WorkerInstance> instances = hub.getCatalog().listAll();

        JsonArray spokes = new JsonArray();
        int available = 0;
        for (WorkerInstance instance : instances) {
            if (instance.isAvailable()) {
                available++;
            }
            spokes.add(describe(instance));
        }

        JsonObject result = new JsonObject();
        result.addProperty("total_spokes", instances.size());
        result.addProperty("healthy_spokes", available);
        result.add("spokes", spokes);
        return ToolResult.json(result);
    }

    private JsonObject describe(WorkerInstance instance) {
        JsonObject obj = new JsonObject();
        obj.addProperty("instance_id", instance.getId());
        obj.addProperty("name", instance.getName());
        obj.addProperty("address", instance.getAddress());
        obj.addProperty("weight", instance.getWeight());
        obj.addProperty("active", instance.isActive());
        obj.addProperty("health_status", instance.getHealthStatus().name());
        obj.addProperty("consecutive_failures", instance.getConsecutiveFailures());
        obj.addProperty("current_load", instance.getCurrentLoad());
        obj.addProperty("circuit_state", hub.getBreakers().stateOf(instance.getId()).name());
        if (instance.getLastSeen() != null) {
            obj.addProperty("last_seen", instance.getLastSeen().toString());
        }

        JsonArray tools = new JsonArray();
        for (ToolDescriptor tool : hub.getCatalog().toolsOf(instance.getId())) {
            tools.add(tool.getToolId());
        }
        obj.add("tools", tools);
        return obj;
    }
}
