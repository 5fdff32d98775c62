package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.CatalogStore;
import com.nanik.finhub.catalog.ToolStats;
import com.nanik.finhub.error.ValidationException;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.SchemaBuilder;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;

/**
 * Invocation statistics per tool, merged across the instances that declare it.
 *
 * With {@code reset} the statistics of the named tool are returned and then
 * cleared on every instance.
 */
public class ToolStatsTool implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(ToolStatsTool.class);

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            "hub_tool_stats",
            "Success rate and average latency of worker tools; optionally reset the counters of one tool.",
            new SchemaBuilder()
                    .addString("tool_id", "Only this tool; every declared tool when omitted", false)
                    .addBoolean("reset", "Clear the statistics of tool_id after reading them", false)
                    .build());

    private final Hub hub;

    public ToolStatsTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        CatalogStore catalog = hub.getCatalog();
        String toolId = request.getStringParam("tool_id");
        boolean reset = request.getBooleanParam("reset");
        if (reset && toolId == null) {
            throw new ValidationException("tool_id", "is required with reset");
        }

        Set<String> toolIds = catalog.declaredToolIds();
        if (toolId != null) {
            if (!toolIds.contains(toolId)) {
                return ToolResult.error("No registered instance declares tool " + toolId);
            }
            toolIds = Collections.singleton(toolId);
        }

        JsonArray tools = new JsonArray();
        for (String id : toolIds) {
            tools.add(toJson(id, catalog.aggregateStats(id)));
        }

        JsonObject result = new JsonObject();
        result.addProperty("count", tools.size());
        result.add("tools", tools);
        if (reset) {
            int instances = catalog.resetStats(toolId);
            log.info("Statistics of {} reset on {} instance(s)", toolId, instances);
            result.addProperty("reset_instances", instances);
        }
        return ToolResult.json(result);
    }

    private static JsonObject toJson(String toolId, ToolStats stats) {
        JsonObject obj = new JsonObject();
        obj.addProperty("tool_id", toolId);
        obj.addProperty("total_invocations", stats.getTotalInvocations());
        obj.addProperty("successful_invocations", stats.getSuccessfulInvocations());
        obj.addProperty("failed_invocations", stats.getFailedInvocations());
        obj.addProperty("success_rate", Math.round(stats.getSuccessRate() * 1000.0) / 10.0);
        obj.addProperty("average_latency_ms", Math.round(stats.getAverageLatencyMillis() * 10.0) / 10.0);
        if (stats.getLastInvokedAt() != null) {
            obj.addProperty("last_invoked_at", stats.getLastInvokedAt().toString());
        }
        return obj;
    }
}
