package com.nanik.finhub.mcp;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nanik.finhub.protocol.McpError;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.protocol.McpResponse;

/**
 * Handles JSON-RPC 2.0 message parsing and response serialization.
 */
public class JsonRpcHandler {

    private final Gson gson = new Gson();

    /**
     * Parse a JSON string into an McpRequest.
     *
     * @param json The raw JSON string
     * @return ParseResult containing either request or error response
     */
    public ParseResult parseRequest(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            return ParseResult.error(
                McpResponse.error(null, McpError.parseError(e.getMessage()))
            );
        }

        if (element == null || element.isJsonNull()) {
            return ParseResult.error(
                McpResponse.error(null, McpError.parseError("Empty JSON"))
            );
        }
        if (!element.isJsonObject()) {
            return ParseResult.error(
                McpResponse.error(null, McpError.invalidRequest("Request must be a JSON object"))
            );
        }
        JsonObject obj = element.getAsJsonObject();

        // Extract fields; wrongly typed members count as missing
        JsonElement id = obj.get("id");
        String jsonrpc = stringMember(obj, "jsonrpc");
        String method = stringMember(obj, "method");
        JsonElement params = obj.get("params");
        if (params != null && !params.isJsonNull() && !params.isJsonObject()) {
            return ParseResult.error(
                McpResponse.error(validId(id), McpError.invalidRequest("params must be an object"))
            );
        }

        McpRequest request = new McpRequest(jsonrpc, id, method,
                params != null && params.isJsonObject() ? params.getAsJsonObject() : null);

        // Validate
        String validationError = request.validate();
        if (validationError != null) {
            return ParseResult.error(
                McpResponse.error(validId(id), McpError.invalidRequest(validationError))
            );
        }

        return ParseResult.success(request);
    }

    private static String stringMember(JsonObject obj, String name) {
        JsonElement member = obj.get(name);
        if (member == null || !member.isJsonPrimitive() || !member.getAsJsonPrimitive().isString()) {
            return null;
        }
        return member.getAsString();
    }

    private static JsonElement validId(JsonElement id) {
        if (id != null && id.isJsonPrimitive() && !id.getAsJsonPrimitive().isBoolean()) {
            return id;
        }
        return null;
    }

    /**
     * Serialize a response to a single line of JSON.
     */
    public String serialize(McpResponse response) {
        return gson.toJson(response.toJson());
    }

    /**
     * Result of parsing a request.
     */
    public static class ParseResult {
        private final McpRequest request;
        private final McpResponse errorResponse;

        private ParseResult(McpRequest request, McpResponse errorResponse) {
            this.request = request;
            this.errorResponse = errorResponse;
        }

        public static ParseResult success(McpRequest request) {
            return new ParseResult(request, null);
        }

        public static ParseResult error(McpResponse errorResponse) {
            return new ParseResult(null, errorResponse);
        }

        public boolean isSuccess() {
            return request != null;
        }

        public McpRequest getRequest() {
            return request;
        }

        public McpResponse getErrorResponse() {
            return errorResponse;
        }
    }
}
