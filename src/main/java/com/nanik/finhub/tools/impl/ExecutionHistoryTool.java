package com.nanik.finhub.tools.impl;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.error.ValidationException;
import com.nanik.finhub.ledger.ExecutionRecord;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.tools.SchemaBuilder;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolHandler;
import com.nanik.finhub.tools.ToolResult;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the execution ledger: one record by invocation id, all attempts of a
 * request by correlation id, the records started in a time window, or the most
 * recent records.
 */
public class ExecutionHistoryTool implements ToolHandler {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 500;

    private static final ToolDefinition DEFINITION = new ToolDefinition(
            "hub_execution_history",
            "Look up invocation records by invocation id, request id or start time window, or list the most recent ones.",
            new SchemaBuilder()
                    .addString("invocation_id", "Return this single record", false)
                    .addString("correlation_id", "Return every attempt of this request", false)
                    .addString("from", "ISO-8601 instant; records started at or after it", false)
                    .addString("to", "ISO-8601 instant; records started before it, default now", false)
                    .addInteger("limit", "Number of recent records when no id is given", false, DEFAULT_LIMIT)
                    .build());

    private final Hub hub;

    public ExecutionHistoryTool(Hub hub) {
        this.hub = hub;
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public ToolResult execute(McpRequest request) {
        String invocationId = request.getStringParam("invocation_id");
        if (invocationId != null) {
            Optional<ExecutionRecord> record = hub.getLedger().find(invocationId);
            if (!record.isPresent()) {
                return ToolResult.error("No invocation record with id " + invocationId);
            }
            return ToolResult.json(record.get().toJson());
        }

        String correlationId = request.getStringParam("correlation_id");
        if (correlationId != null) {
            return ToolResult.json(asJson(hub.getLedger().findByCorrelation(correlationId)));
        }

        String from = request.getStringParam("from");
        String to = request.getStringParam("to");
        if (from != null || to != null) {
            Instant start = from != null ? instant("from", from) : Instant.EPOCH;
            Instant end = to != null ? instant("to", to) : hub.getClock().instant().plusMillis(1);
            if (!start.isBefore(end)) {
                throw new ValidationException("from", "must be before to");
            }
            return ToolResult.json(asJson(hub.getLedger().findBetween(start, end)));
        }

        Integer limit = request.getIntParam("limit");
        int n = limit != null ? limit : DEFAULT_LIMIT;
        if (n <= 0 || n > MAX_LIMIT) {
            throw new ValidationException("limit", "must be between 1 and " + MAX_LIMIT);
        }
        return ToolResult.json(asJson(hub.getLedger().recent(n)));
    }

    private static Instant instant(String param, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(param, "must be an ISO-8601 instant such as 2024-01-01T00:00:00Z");
        }
    }

    private static JsonObject asJson(List<ExecutionRecord> records) {
        JsonArray array = new JsonArray();
        for (ExecutionRecord record : records) {
            array.add(record.toJson());
        }
        JsonObject result = new JsonObject();
        result.addProperty("count", records.size());
        result.add("records", array);
        return result;
    }
}
