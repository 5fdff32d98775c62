package com.nanik.finhub.router;

import com.nanik.finhub.catalog.WorkerInstance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lowest current load first, ties broken by instance id.
 */
public class LeastLoadPolicy implements LoadBalancingPolicy {

    public static final String NAME = "least_load";

    private static final Comparator<WorkerInstance> ORDER =
            Comparator.comparingInt(WorkerInstance::getCurrentLoad)
                    .thenComparing(WorkerInstance::getId);

    @Override
    public List<WorkerInstance> rank(List<WorkerInstance> candidates) {
        List<WorkerInstance> ranked = new ArrayList<>(candidates);
        ranked.sort(ORDER);
        return ranked;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
