package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * The client cancelled the request while the call was in flight.
 */
public class InvocationCancelledException extends HubException {

    public InvocationCancelledException(String message) {
        super(message);
    }

    @Override
    public int getCode() {
        return McpError.REQUEST_CANCELLED;
    }
}
