package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * The hub already runs its maximum number of concurrent executions.
 */
public class BackpressureException extends HubException {

    public BackpressureException(int limit) {
        super("Too many concurrent executions (limit " + limit + ")");
    }

    @Override
    public int getCode() {
        return McpError.BACKPRESSURE;
    }
}
