package com.nanik.finhub.catalog;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.nanik.finhub.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts registration payloads between JSON and catalog types.
 *
 * Payload shape (snake_case):
 * {
 *   "instance_id": "market-1",
 *   "name": "Market Spoke",
 *   "address": "http://localhost:8001",
 *   "weight": 100,
 *   "health_check_url": "http://localhost:8001/health",
 *   "health_check_interval": 30,
 *   "ttl_seconds": 300,
 *   "tools": [
 *     {"tool_id": "stock_quote", "name": "Stock Quote", "description": "...",
 *      "input_schema": {...}, "output_schema": {...},
 *      "timeout_seconds": 300, "retry_attempts": 3}
 *   ]
 * }
 *
 * Missing optional fields take their defaults. Structural problems become
 * {@link ValidationException}s naming the field; semantic checks are left to
 * {@link CatalogStore#register}.
 */
public class RegistrationCodec {

    private final Gson gson;

    public RegistrationCodec() {
        this.gson = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .create();
    }

    /**
     * Parse a payload object.
     */
    public Registration parse(JsonObject payload) {
        if (payload == null) {
            throw new ValidationException("payload", "is required");
        }
        Payload p;
        try {
            p = gson.fromJson(payload, Payload.class);
        } catch (JsonParseException | NumberFormatException | IllegalStateException e) {
            throw new ValidationException("payload", "malformed: " + e.getMessage());
        }
        if (p.instanceId == null || p.instanceId.trim().isEmpty()) {
            throw new ValidationException("instance_id", "is required");
        }

        WorkerInstance instance = new WorkerInstance(
                p.instanceId,
                p.name != null ? p.name : p.instanceId,
                p.address,
                p.weight != null ? p.weight : WorkerInstance.DEFAULT_WEIGHT,
                p.healthCheckUrl,
                p.healthCheckInterval != null ? p.healthCheckInterval : WorkerInstance.DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS,
                p.ttlSeconds != null ? p.ttlSeconds : WorkerInstance.DEFAULT_TTL_SECONDS);

        List<ToolDescriptor> tools = new ArrayList<>();
        if (p.tools != null) {
            for (int i = 0; i < p.tools.size(); i++) {
                ToolPayload t = p.tools.get(i);
                if (t == null) {
                    throw new ValidationException("tools[" + i + "]", "is null");
                }
                if (t.toolId == null || t.toolId.trim().isEmpty()) {
                    throw new ValidationException("tools[" + i + "].tool_id", "is required");
                }
                tools.add(new ToolDescriptor(
                        t.toolId,
                        p.instanceId,
                        t.name != null ? t.name : t.toolId,
                        t.description != null ? t.description : "",
                        t.inputSchema != null ? t.inputSchema : emptyObjectSchema(),
                        t.outputSchema,
                        t.timeoutSeconds != null ? t.timeoutSeconds : ToolDescriptor.DEFAULT_TIMEOUT_SECONDS,
                        t.retryAttempts != null ? t.retryAttempts : ToolDescriptor.DEFAULT_RETRY_ATTEMPTS));
            }
        }
        return new Registration(instance, tools);
    }

    /**
     * Parse a payload string.
     */
    public Registration parse(String json) {
        JsonElement element;
        try {
            element = gson.fromJson(json, JsonElement.class);
        } catch (JsonParseException e) {
            throw new ValidationException("payload", "invalid JSON: " + e.getMessage());
        }
        if (element == null || !element.isJsonObject()) {
            throw new ValidationException("payload", "must be a JSON object");
        }
        return parse(element.getAsJsonObject());
    }

    /**
     * Serialize an instance and its tools into a payload.
     */
    public JsonObject toJson(WorkerInstance instance, List<ToolDescriptor> tools) {
        Payload p = new Payload();
        p.instanceId = instance.getId();
        p.name = instance.getName();
        p.address = instance.getAddress();
        p.weight = instance.getWeight();
        p.healthCheckUrl = instance.getDeclaredHealthCheckUrl();
        p.healthCheckInterval = instance.getHealthCheckIntervalSeconds();
        p.ttlSeconds = instance.getTtlSeconds();
        p.tools = new ArrayList<>();
        for (ToolDescriptor tool : tools) {
            ToolPayload t = new ToolPayload();
            t.toolId = tool.getToolId();
            t.name = tool.getName();
            t.description = tool.getDescription();
            t.inputSchema = tool.getInputSchema();
            t.outputSchema = tool.getOutputSchema();
            t.timeoutSeconds = tool.getTimeoutSeconds();
            t.retryAttempts = tool.getRetryAttempts();
            p.tools.add(t);
        }
        return gson.toJsonTree(p).getAsJsonObject();
    }

    public JsonObject toJson(Registration registration) {
        return toJson(registration.getInstance(), registration.getTools());
    }

    private static JsonObject emptyObjectSchema() {
        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        schema.add("properties", new JsonObject());
        return schema;
    }

    // Gson binding types
    private static class Payload {
        String instanceId;
        String name;
        String address;
        Integer weight;
        String healthCheckUrl;
        Integer healthCheckInterval;
        Integer ttlSeconds;
        List<ToolPayload> tools;
    }

    private static class ToolPayload {
        String toolId;
        String name;
        String description;
        JsonObject inputSchema;
        JsonObject outputSchema;
        Integer timeoutSeconds;
        Integer retryAttempts;
    }
}
