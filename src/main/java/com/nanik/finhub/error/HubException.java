package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * Base class of every failure the hub surfaces to a client.
 *
 * Each subclass maps to one JSON-RPC error code so the gateway can turn it
 * into a structured error without inspecting the message.
 */
public abstract class HubException extends RuntimeException {

    protected HubException(String message) {
        super(message);
    }

    protected HubException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * JSON-RPC error code reported to the client.
     */
    public abstract int getCode();

    /**
     * Whether the router may retry the call against another instance.
     */
    public boolean isRetryable() {
        return false;
    }

    /**
     * Convert to the protocol error structure.
     */
    public McpError toMcpError() {
        return new McpError(getCode(), getMessage());
    }
}
