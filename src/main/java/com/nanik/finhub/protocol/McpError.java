package com.nanik.finhub.protocol;

import com.google.gson.JsonObject;

/**
 * The error member of a JSON-RPC 2.0 response.
 *
 * Standard codes cover envelope and dispatch problems. Routing failures use
 * the server error range, one code per failure kind, so agents can tell a
 * missing tool from an overloaded hub without parsing messages.
 */
public class McpError {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    /** No healthy instance offers the tool. */
    public static final int TOOL_UNAVAILABLE = -32001;
    /** Every candidate instance has an open breaker. */
    public static final int CIRCUIT_OPEN = -32002;
    public static final int INVOCATION_TIMEOUT = -32003;
    public static final int INVOCATION_FAILED = -32004;
    /** The hub is at its concurrent execution bound. */
    public static final int BACKPRESSURE = -32005;
    public static final int REQUEST_CANCELLED = -32006;

    private final int code;
    private final String message;
    private final String data;

    public McpError(int code, String message) {
        this(code, message, null);
    }

    public McpError(int code, String message, String data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public static McpError parseError(String details) {
        return new McpError(PARSE_ERROR, "Parse error", details);
    }

    public static McpError invalidRequest(String details) {
        return new McpError(INVALID_REQUEST, "Invalid Request", details);
    }

    public static McpError methodNotFound(String method) {
        return new McpError(METHOD_NOT_FOUND, "Method not found: " + method);
    }

    public static McpError invalidParams(String details) {
        return new McpError(INVALID_PARAMS, "Invalid params", details);
    }

    public static McpError internalError(Throwable t) {
        return new McpError(INTERNAL_ERROR, "Internal error", t.getMessage());
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Free-form detail, may be null.
     */
    public String getData() {
        return data;
    }

    /**
     * True for the hub's routing codes.
     */
    public boolean isRoutingError() {
        return code <= TOOL_UNAVAILABLE && code >= REQUEST_CANCELLED;
    }

    public JsonObject toJson() {
        JsonObject err = new JsonObject();
        err.addProperty("code", code);
        err.addProperty("message", message);
        if (data != null) {
            err.addProperty("data", data);
        }
        return err;
    }

    @Override
    public String toString() {
        return "McpError{" + code + " " + message + (data != null ? ": " + data : "") + "}";
    }
}
