package com.nanik.finhub.catalog;

/**
 * Health of a worker instance as last determined by probes.
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}
