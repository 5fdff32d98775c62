package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * Every candidate instance has its circuit breaker open. The worker was not contacted.
 */
public class CircuitOpenException extends HubException {

    public CircuitOpenException(String message) {
        super(message);
    }

    @Override
    public int getCode() {
        return McpError.CIRCUIT_OPEN;
    }
}
