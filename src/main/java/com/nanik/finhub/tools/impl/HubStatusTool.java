package com.nanik.finhub.tools.impl;

import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.ledger.ExecutionStatus;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.router.ExecutionRouter;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Overview of the hub: identity, catalog counts, router capacity, ledger summary.
 */
public class HubStatusTool implements ToolHandler {

    private static final ToolDefinition DEFINITION = ToolDefinition.noParams(
            "hub_status",
            "Hub name and version, instance and tool counts, running executions and ledger summary."
    );

    private final Hub hub;

    public HubStatusTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        List<WorkerInstance> instances = hub.getCatalog().listAll();
        int active = 0;
        int available = 0;
        for (WorkerInstance instance : instances) {
            if (instance.isActive()) {
                active++;
            }
            if (instance.isAvailable()) {
                available++;
            }
        }

        JsonObject result = new JsonObject();
        result.addProperty("name", hub.getConfig().getServerName());
        result.addProperty("version", hub.getConfig().getServerVersion());
        result.addProperty("timestamp", hub.getClock().instant().toString());
        result.addProperty("health_monitor_running", hub.getMonitor().isRunning());

        JsonObject catalog = new JsonObject();
        catalog.addProperty("registered_instances", instances.size());
        catalog.addProperty("active_instances", active);
        catalog.addProperty("healthy_instances", available);
        catalog.addProperty("discoverable_tools", hub.getCatalog().discoverableTools().size());
        result.add("catalog", catalog);

        ExecutionRouter router = hub.getRouter();
        JsonObject routing = new JsonObject();
        routing.addProperty("load_policy", router.getPolicy().getName());
        routing.addProperty("running_executions", router.getRunningCount());
        routing.addProperty("max_concurrent_executions", router.getMaxConcurrent());
        result.add("router", routing);

        JsonObject ledger = new JsonObject();
        for (Map.Entry<ExecutionStatus, Integer> entry : hub.getLedger().summary().entrySet()) {
            ledger.addProperty(entry.getKey().name().toLowerCase(), entry.getValue());
        }
        result.add("executions", ledger);
        return ToolResult.json(result);
    }
}
