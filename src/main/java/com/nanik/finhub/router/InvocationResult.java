package com.nanik.finhub.router;

import com.google.gson.JsonElement;

/**
 * Successful outcome of a routed tool call.
 */
public class InvocationResult {

    private final JsonElement output;
    private final String instanceId;
    private final String invocationId;
    private final int attempts;

    public InvocationResult(JsonElement output, String instanceId, String invocationId, int attempts) {
        this.output = output;
        this.instanceId = instanceId;
        this.invocationId = invocationId;
        this.attempts = attempts;
    }

    /** The worker's result payload. */
    public JsonElement getOutput() {
        return output;
    }

    /** The instance that produced the result. */
    public String getInstanceId() {
        return instanceId;
    }

    /** Ledger id of the successful attempt. */
    public String getInvocationId() {
        return invocationId;
    }

    /** Attempts made, including failed ones on other instances. */
    public int getAttempts() {
        return attempts;
    }
}
