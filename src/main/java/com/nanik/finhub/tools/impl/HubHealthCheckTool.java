package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

import java.util.List;

/**
 * Health of every instance the catalog still tracks, as last observed by the
 * monitor. Unhealthy instances stay listed until they are purged.
 *
 * health_score = healthy / tracked * 100, rounded to one decimal; 0 with no
 * tracked instances.
 */
public class HubHealthCheckTool implements ToolHandler {

    private static final ToolDefinition DEFINITION = ToolDefinition.noParams(
            "hub_health_check",
            "Health score of the hub and the state of every tracked worker instance."
    );

    private final Hub hub;

    public HubHealthCheckTool(Hub hub) {
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
        int healthy = 0;
        for (WorkerInstance instance : instances) {
            if (instance.isAvailable()) {
                healthy++;
            }
            JsonObject obj = new JsonObject();
            obj.addProperty("instance_id", instance.getId());
            obj.addProperty("health_status", instance.getHealthStatus().name());
            obj.addProperty("consecutive_failures", instance.getConsecutiveFailures());
            obj.addProperty("circuit_state", hub.getBreakers().stateOf(instance.getId()).name());
            spokes.add(obj);
        }

        JsonObject result = new JsonObject();
        result.addProperty("hub_healthy", true);
        result.addProperty("all_spokes_healthy", healthy == instances.size());
        result.addProperty("total_spokes", instances.size());
        result.addProperty("healthy_spokes", healthy);
        result.addProperty("health_score", healthScore(healthy, instances.size()));
        result.addProperty("timestamp", hub.getClock().instant().toString());
        result.add("spokes", spokes);
        return ToolResult.json(result);
    }

    static double healthScore(int healthy, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(healthy * 1000.0 / total) / 10.0;
    }
}
