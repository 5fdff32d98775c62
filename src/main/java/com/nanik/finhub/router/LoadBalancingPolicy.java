package com.nanik.finhub.router;

import com.nanik.finhub.catalog.WorkerInstance;

import java.util.List;

/**
 * Orders candidate instances for a tool call; the router tries them in order.
 */
public interface LoadBalancingPolicy {

    /**
     * Return the candidates ordered from most to least preferred.
     * The order must be deterministic for equal inputs.
     */
    List<WorkerInstance> rank(List<WorkerInstance> candidates);

    /**
     * Name used in configuration.
     */
    String getName();

    /**
     * Most preferred candidate, or null when there is none.
     */
    default WorkerInstance select(List<WorkerInstance> candidates) {
        List<WorkerInstance> ranked = rank(candidates);
        return ranked.isEmpty() ? null : ranked.get(0);
    }

    /**
     * Resolve a configured policy name.
     */
    static LoadBalancingPolicy forName(String name) {
        if (WeightedPriorityPolicy.NAME.equals(name)) {
            return new WeightedPriorityPolicy();
        }
        if (LeastLoadPolicy.NAME.equals(name)) {
            return new LeastLoadPolicy();
        }
        throw new IllegalArgumentException("Unknown load policy: " + name);
    }
}
