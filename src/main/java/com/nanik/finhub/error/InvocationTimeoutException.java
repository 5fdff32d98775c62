package com.nanik.finhub.error;

import com.nanik.finhub.protocol.McpError;

import java.time.Duration;

/**
 * The worker did not answer within the tool's timeout budget.
 */
public class InvocationTimeoutException extends HubException {

    public InvocationTimeoutException(String toolName, String instanceId, Duration timeout) {
        super("Tool " + toolName + " on " + instanceId + " timed out after " + timeout.toMillis() + " ms");
    }

    @Override
    public int getCode() {
        return McpError.INVOCATION_TIMEOUT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
