package com.nanik.finhub.ledger;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.time.Duration;
import java.time.Instant;

/**
 * One attempted invocation of a tool on a worker instance. Immutable; the
 * ledger replaces a RUNNING record with its terminal version.
 */
public class ExecutionRecord {

    private final String invocationId;
    private final String correlationId;
    private final int attempt;
    private final String toolId;
    private final String instanceId;
    private final JsonObject input;
    private final JsonElement output;
    private final String error;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant endedAt;

    private ExecutionRecord(String invocationId, String correlationId, int attempt, String toolId,
                            String instanceId, JsonObject input, JsonElement output, String error,
                            ExecutionStatus status, Instant startedAt, Instant endedAt) {
        this.invocationId = invocationId;
        this.correlationId = correlationId;
        this.attempt = attempt;
        this.toolId = toolId;
        this.instanceId = instanceId;
        this.input = input;
        this.output = output;
        this.error = error;
        this.status = status;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
    }

    /**
     * A new RUNNING record.
     */
    public static ExecutionRecord running(String invocationId, String correlationId, int attempt,
                                          String toolId, String instanceId, JsonObject input,
                                          Instant startedAt) {
        return new ExecutionRecord(invocationId, correlationId, attempt, toolId, instanceId,
                input, null, null, ExecutionStatus.RUNNING, startedAt, null);
    }

    ExecutionRecord complete(ExecutionStatus terminal, JsonElement output, String error, Instant endedAt) {
        return new ExecutionRecord(invocationId, correlationId, attempt, toolId, instanceId,
                input, output, error, terminal, startedAt, endedAt);
    }

    public String getInvocationId() {
        return invocationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getToolId() {
        return toolId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public JsonObject getInput() {
        return input;
    }

    public JsonElement getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    /**
     * Elapsed time, or null while RUNNING.
     */
    public Duration getDuration() {
        return endedAt == null ? null : Duration.between(startedAt, endedAt);
    }

    /**
     * Serialized form used by sinks and the history tool.
     */
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("invocation_id", invocationId);
        obj.addProperty("correlation_id", correlationId);
        obj.addProperty("attempt", attempt);
        obj.addProperty("tool_id", toolId);
        obj.addProperty("instance_id", instanceId);
        obj.addProperty("status", status.name());
        obj.addProperty("started_at", startedAt.toString());
        if (endedAt != null) {
            obj.addProperty("ended_at", endedAt.toString());
            obj.addProperty("duration_ms", getDuration().toMillis());
        }
        if (input != null) {
            obj.add("input", input);
        }
        if (output != null) {
            obj.add("output", output);
        }
        if (error != null) {
            obj.addProperty("error", error);
        }
        return obj;
    }

    @Override
    public String toString() {
        return "ExecutionRecord{" + invocationId + ", " + toolId + "@" + instanceId
                + ", attempt=" + attempt + ", " + status + "}";
    }
}
