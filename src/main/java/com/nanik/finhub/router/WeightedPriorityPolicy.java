package com.nanik.finhub.router;

import com.nanik.finhub.catalog.WorkerInstance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Prefers high declared weight, discounted by in-flight load.
 *
 * Candidates are ordered by weight / (load + 1) descending, then weight
 * descending, load ascending and instance id. With equal loads this is plain
 * (weight desc, load asc, id) ordering; a heavily loaded high-weight instance
 * yields to an idle lower-weight one.
 */
public class WeightedPriorityPolicy implements LoadBalancingPolicy {

    public static final String NAME = "weighted_priority";

    private static final Comparator<WorkerInstance> ORDER = WeightedPriorityPolicy::compareScore;

    @Override
    public List<WorkerInstance> rank(List<WorkerInstance> candidates) {
        List<WorkerInstance> ranked = new ArrayList<>(candidates);
        ranked.sort(ORDER
                .thenComparing(Comparator.comparingInt(WorkerInstance::getWeight).reversed())
                .thenComparingInt(WorkerInstance::getCurrentLoad)
                .thenComparing(WorkerInstance::getId));
        return ranked;
    }

    // Cross-multiplied so equal ratios compare equal without floating point.
    private static int compareScore(WorkerInstance a, WorkerInstance b) {
        long left = (long) a.getWeight() * (b.getCurrentLoad() + 1);
        long right = (long) b.getWeight() * (a.getCurrentLoad() + 1);
        return Long.compare(right, left);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
