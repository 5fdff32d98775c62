package com.nanik.finhub.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Represents a JSON-RPC 2.0 response message.
 *
 * Success response:
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,
 *   "result": {...}
 * }
 *
 * Error response:
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,
 *   "error": {
 *     "code": -32001,
 *     "message": "No healthy instance offers tool: stock_quote",
 *     "data": "optional details"
 *   }
 * }
 */
public class McpResponse {

    private final JsonElement id;
    private final JsonElement result;
    private final McpError error;

    private McpResponse(JsonElement id, JsonElement result, McpError error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    /**
     * Create a success response.
     */
    public static McpResponse success(JsonElement id, JsonElement result) {
        return new McpResponse(id, result, null);
    }

    /**
     * Create an error response.
     */
    public static McpResponse error(JsonElement id, McpError error) {
        return new McpResponse(id, null, error);
    }

    public JsonElement getId() {
        return id;
    }

    public JsonElement getResult() {
        return result;
    }

    public McpError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Build the wire form. The id is always present, null when the request had none.
     */
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("jsonrpc", "2.0");
        obj.add("id", id != null ? id : JsonNull.INSTANCE);
        if (error != null) {
            obj.add("error", error.toJson());
        } else {
            obj.add("result", result != null ? result : new JsonObject());
        }
        return obj;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "McpResponse{id=" + id + ", error=" + error + "}";
        }
        return "McpResponse{id=" + id + ", result=" + result + "}";
    }
}
