package com.nanik.finhub.health;

import com.nanik.finhub.catalog.WorkerInstance;

import java.time.Duration;

/**
 * Liveness check against a worker's declared health-check target.
 */
public interface HealthProbe {

    /**
     * Probe the instance.
     *
     * @param instance the worker to check
     * @param timeout  upper bound for the whole check
     * @return true for a success-class answer, false for any other answer
     * @throws Exception on timeout or when the worker cannot be reached
     */
    boolean probe(WorkerInstance instance, Duration timeout) throws Exception;
}
