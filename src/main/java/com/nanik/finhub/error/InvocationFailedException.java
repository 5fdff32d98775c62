package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

/**
 * The worker was reached but the call failed (error reply, bad status, transport error).
 */
public class InvocationFailedException extends HubException {

    public InvocationFailedException(String message) {
        super(message);
    }

    public InvocationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getCode() {
        return McpError.INVOCATION_FAILED;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
