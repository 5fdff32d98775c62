package com.nanik.finhub.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.error.ValidationException;

/**
 * A JSON-RPC 2.0 request or notification as received from the agent.
 *
 * <pre>
 * {"jsonrpc": "2.0", "id": 7, "method": "tools/call",
 *  "params": {"name": "stock_quote", "arguments": {"symbol": "AAPL"}}}
 * </pre>
 *
 * A missing or null id makes the message a notification. Built-in hub tools
 * receive a derived request whose params are the tool arguments, see
 * {@link #forTool(String, JsonObject)}.
 */
public class McpRequest {

    private final String jsonrpc;
    private final JsonElement id;
    private final String method;
    private final JsonObject params;

    public McpRequest(String jsonrpc, JsonElement id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params;
    }

    /**
     * A request carrying the same id, addressed to a built-in tool, with the
     * tool arguments as params.
     */
    public McpRequest forTool(String toolName, JsonObject arguments) {
        return new McpRequest(jsonrpc, id, toolName, arguments);
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public JsonElement getId() {
        return id;
    }

    /**
     * The id as a string, used to correlate cancellations and ledger records.
     * Null for notifications.
     */
    public String getIdKey() {
        return isNotification() ? null : id.getAsJsonPrimitive().getAsString();
    }

    public String getMethod() {
        return method;
    }

    /**
     * Never null; an absent params member reads as an empty object.
     */
    public JsonObject getParams() {
        return params != null ? params : new JsonObject();
    }

    public boolean isNotification() {
        return id == null || id.isJsonNull();
    }

    /**
     * @return the first envelope rule this message breaks, or null
     */
    public String validate() {
        if (!"2.0".equals(jsonrpc)) {
            return "jsonrpc must be exactly \"2.0\"";
        }
        if (method == null || method.isEmpty()) {
            return "method is required";
        }
        if (!isNotification() && !(id.isJsonPrimitive() && !id.getAsJsonPrimitive().isBoolean())) {
            return "id must be a string, a number or null";
        }
        return null;
    }

    private JsonElement param(String name) {
        if (params == null) {
            return null;
        }
        JsonElement elem = params.get(name);
        return elem == null || elem.isJsonNull() ? null : elem;
    }

    /**
     * A scalar param as text, or null when absent or not a scalar.
     */
    public String getStringParam(String name) {
        JsonElement elem = param(name);
        return elem != null && elem.isJsonPrimitive() ? elem.getAsString() : null;
    }

    /**
     * Non-blank string param.
     *
     * @throws ValidationException naming the param when it is missing or blank
     */
    public String requireStringParam(String name) {
        String value = getStringParam(name);
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(name, "is required");
        }
        return value;
    }

    /**
     * A numeric param, or null when absent or not a number.
     */
    public Integer getIntParam(String name) {
        JsonElement elem = param(name);
        if (elem == null || !elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return elem.getAsInt();
    }

    /**
     * A boolean param; false when absent.
     *
     * @throws ValidationException when present but not a boolean
     */
    public boolean getBooleanParam(String name) {
        JsonElement elem = param(name);
        if (elem == null) {
            return false;
        }
        if (!elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isBoolean()) {
            throw new ValidationException(name, "must be true or false");
        }
        return elem.getAsBoolean();
    }

    public JsonObject getObjectParam(String name) {
        JsonElement elem = param(name);
        return elem != null && elem.isJsonObject() ? elem.getAsJsonObject() : null;
    }

    @Override
    public String toString() {
        return "McpRequest{id=" + id + ", method='" + method + "', params=" + params + "}";
    }
}
