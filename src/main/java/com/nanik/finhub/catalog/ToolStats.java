package com.nanik.finhub.catalog;

import java.time.Instant;

/**
 * Aggregate invocation statistics of one tool on one worker instance.
 *
 * Counters only grow. The average latency covers successful invocations only,
 * since failed and timed-out attempts end at arbitrary points.
 */
public class ToolStats {

    private long totalInvocations;
    private long successfulInvocations;
    private long failedInvocations;
    private double averageLatencyMillis;
    private Instant lastInvokedAt;

    public ToolStats() {
    }

    private ToolStats(ToolStats other) {
        this.totalInvocations = other.totalInvocations;
        this.successfulInvocations = other.successfulInvocations;
        this.failedInvocations = other.failedInvocations;
        this.averageLatencyMillis = other.averageLatencyMillis;
        this.lastInvokedAt = other.lastInvokedAt;
    }

    /**
     * Fold one completed invocation into the statistics.
     */
    void record(boolean succeeded, long latencyMillis, Instant at) {
        totalInvocations++;
        if (succeeded) {
            successfulInvocations++;
            averageLatencyMillis += (latencyMillis - averageLatencyMillis) / successfulInvocations;
        } else {
            failedInvocations++;
        }
        lastInvokedAt = at;
    }

    /**
     * Combine two stats, weighting averages by successful counts.
     */
    public ToolStats merge(ToolStats other) {
        ToolStats merged = new ToolStats(this);
        merged.totalInvocations += other.totalInvocations;
        merged.failedInvocations += other.failedInvocations;
        long successes = successfulInvocations + other.successfulInvocations;
        if (successes > 0) {
            merged.averageLatencyMillis = (averageLatencyMillis * successfulInvocations
                    + other.averageLatencyMillis * other.successfulInvocations) / successes;
        }
        merged.successfulInvocations = successes;
        if (other.lastInvokedAt != null
                && (lastInvokedAt == null || other.lastInvokedAt.isAfter(lastInvokedAt))) {
            merged.lastInvokedAt = other.lastInvokedAt;
        }
        return merged;
    }

    ToolStats copy() {
        return new ToolStats(this);
    }

    public long getTotalInvocations() {
        return totalInvocations;
    }

    public long getSuccessfulInvocations() {
        return successfulInvocations;
    }

    public long getFailedInvocations() {
        return failedInvocations;
    }

    public double getAverageLatencyMillis() {
        return averageLatencyMillis;
    }

    public Instant getLastInvokedAt() {
        return lastInvokedAt;
    }

    /**
     * Fraction of successful invocations, 0 when nothing ran yet.
     */
    public double getSuccessRate() {
        return totalInvocations == 0 ? 0.0 : (double) successfulInvocations / totalInvocations;
    }

    @Override
    public String toString() {
        return "ToolStats{total=" + totalInvocations + ", ok=" + successfulInvocations
                + ", failed=" + failedInvocations + ", avgMs=" + averageLatencyMillis + "}";
    }
}
