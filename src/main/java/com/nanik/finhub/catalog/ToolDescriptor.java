package com.nanik.finhub.catalog;

import com.google.gson.JsonObject;

import java.time.Duration;
import java.util.Objects;

/**
 * A tool declared by one worker instance.
 *
 * The tool id is unique within its worker; the same id offered by several
 * workers fans out for load distribution. Equality covers the declared
 * attributes only, never the statistics.
 */
public class ToolDescriptor {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String toolId;
    private final String workerId;
    private final String name;
    private final String description;
    private final JsonObject inputSchema;
    private final JsonObject outputSchema; // optional
    private final int timeoutSeconds;
    private final int retryAttempts;
    private final ToolStats stats;

    public ToolDescriptor(String toolId, String workerId, String name, String description,
                          JsonObject inputSchema, JsonObject outputSchema,
                          int timeoutSeconds, int retryAttempts) {
        this(toolId, workerId, name, description, inputSchema, outputSchema,
             timeoutSeconds, retryAttempts, new ToolStats());
    }

    private ToolDescriptor(String toolId, String workerId, String name, String description,
                           JsonObject inputSchema, JsonObject outputSchema,
                           int timeoutSeconds, int retryAttempts, ToolStats stats) {
        this.toolId = toolId;
        this.workerId = workerId;
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.timeoutSeconds = timeoutSeconds;
        this.retryAttempts = retryAttempts;
        this.stats = stats;
    }

    /**
     * Create a tool with default timeout and retry budgets and an empty object schema.
     */
    public static ToolDescriptor simple(String toolId, String workerId, String description) {
        JsonObject schema = new JsonObject();
        schema.addProperty("type", "object");
        schema.add("properties", new JsonObject());
        return new ToolDescriptor(toolId, workerId, toolId, description, schema, null,
                DEFAULT_TIMEOUT_SECONDS, DEFAULT_RETRY_ATTEMPTS);
    }

    /**
     * Same declaration owned by another worker, with fresh statistics.
     */
    public ToolDescriptor withWorker(String newWorkerId) {
        return new ToolDescriptor(toolId, newWorkerId, name, description, inputSchema, outputSchema,
                timeoutSeconds, retryAttempts, new ToolStats());
    }

    /**
     * Same declaration with the given timeout budget.
     */
    public ToolDescriptor withTimeoutSeconds(int seconds) {
        return new ToolDescriptor(toolId, workerId, name, description, inputSchema, outputSchema,
                seconds, retryAttempts, stats.copy());
    }

    /**
     * Same declaration with the given retry budget.
     */
    public ToolDescriptor withRetryAttempts(int attempts) {
        return new ToolDescriptor(toolId, workerId, name, description, inputSchema, outputSchema,
                timeoutSeconds, attempts, stats.copy());
    }

    ToolDescriptor withStats(ToolStats carried) {
        return new ToolDescriptor(toolId, workerId, name, description, inputSchema, outputSchema,
                timeoutSeconds, retryAttempts, carried.copy());
    }

    ToolDescriptor copy() {
        return withStats(stats);
    }

    ToolStats stats() {
        return stats;
    }

    public String getToolId() {
        return toolId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    public JsonObject getOutputSchema() {
        return outputSchema;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    /**
     * Snapshot of the statistics at the time this descriptor was read.
     */
    public ToolStats getStats() {
        return stats.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolDescriptor)) {
            return false;
        }
        ToolDescriptor that = (ToolDescriptor) o;
        return timeoutSeconds == that.timeoutSeconds
                && retryAttempts == that.retryAttempts
                && toolId.equals(that.toolId)
                && Objects.equals(workerId, that.workerId)
                && Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(inputSchema, that.inputSchema)
                && Objects.equals(outputSchema, that.outputSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(toolId, workerId, name, description, inputSchema, outputSchema,
                timeoutSeconds, retryAttempts);
    }

    @Override
    public String toString() {
        return "ToolDescriptor{" + workerId + "/" + toolId + ", timeout=" + timeoutSeconds
                + "s, retries=" + retryAttempts + "}";
    }
}
