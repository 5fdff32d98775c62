package com.nanik.finhub.catalog;

import java.time.Instant;
import java.util.Objects;

/**
 * One running worker process ("spoke") offering tools.
 *
 * The declared attributes come from the registration payload and never change
 * for a given object; re-registration replaces the stored instance. Runtime
 * attributes (load, health, failures, timestamps, active flag) are mutated only
 * by {@link CatalogStore} under its lock. Objects handed out by the store are
 * copies, so callers see a consistent snapshot.
 */
public class WorkerInstance {

    public static final int DEFAULT_WEIGHT = 100;
    public static final int DEFAULT_TTL_SECONDS = 300;
    public static final int DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS = 30;

    // Declared
    private final String id;
    private final String name;
    private final String address;
    private final int weight;
    private final String healthCheckUrl;
    private final int healthCheckIntervalSeconds;
    private final int ttlSeconds;

    // Runtime
    private int currentLoad;
    private HealthStatus healthStatus = HealthStatus.HEALTHY;
    private int consecutiveFailures;
    private Instant lastSeen;
    private Instant registeredAt;
    private long registration;
    private Instant deactivatedAt;
    private boolean active;

    public WorkerInstance(String id, String name, String address, int weight,
                          String healthCheckUrl, int healthCheckIntervalSeconds, int ttlSeconds) {
        this.id = id;
        this.name = name;
        this.address = address;
        this.weight = weight;
        this.healthCheckUrl = healthCheckUrl;
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * Instance with default health-check target, interval and TTL.
     */
    public WorkerInstance(String id, String address, int weight) {
        this(id, id, address, weight, null, DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS, DEFAULT_TTL_SECONDS);
    }

    WorkerInstance copy() {
        WorkerInstance c = new WorkerInstance(id, name, address, weight, healthCheckUrl,
                healthCheckIntervalSeconds, ttlSeconds);
        c.currentLoad = currentLoad;
        c.healthStatus = healthStatus;
        c.consecutiveFailures = consecutiveFailures;
        c.lastSeen = lastSeen;
        c.registeredAt = registeredAt;
        c.registration = registration;
        c.deactivatedAt = deactivatedAt;
        c.active = active;
        return c;
    }

    void deactivate(Instant at) {
        if (active) {
            active = false;
            deactivatedAt = at;
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * The declared health-check URL, or {@code <address>/health} when none was declared.
     */
    public String getHealthCheckUrl() {
        if (healthCheckUrl != null && !healthCheckUrl.isEmpty()) {
            return healthCheckUrl;
        }
        return address.endsWith("/") ? address + "health" : address + "/health";
    }

    /**
     * The health-check URL exactly as declared, possibly null.
     */
    public String getDeclaredHealthCheckUrl() {
        return healthCheckUrl;
    }

    public int getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    void setCurrentLoad(int currentLoad) {
        this.currentLoad = currentLoad;
    }

    public HealthStatus getHealthStatus() {
        return healthStatus;
    }

    void setHealthStatus(HealthStatus healthStatus) {
        this.healthStatus = healthStatus;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    /**
     * Sequence number of the registration call that stored this instance. A
     * re-registration under the same id gets a new number.
     */
    public long getRegistration() {
        return registration;
    }

    void setRegistration(long registration) {
        this.registration = registration;
    }

    public Instant getDeactivatedAt() {
        return deactivatedAt;
    }

    public boolean isActive() {
        return active;
    }

    void activate() {
        this.active = true;
        this.deactivatedAt = null;
    }

    /**
     * Active and healthy, i.e. eligible for discovery.
     */
    public boolean isAvailable() {
        return active && healthStatus == HealthStatus.HEALTHY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkerInstance)) {
            return false;
        }
        WorkerInstance that = (WorkerInstance) o;
        return weight == that.weight
                && healthCheckIntervalSeconds == that.healthCheckIntervalSeconds
                && ttlSeconds == that.ttlSeconds
                && id.equals(that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(address, that.address)
                && Objects.equals(healthCheckUrl, that.healthCheckUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, address, weight, healthCheckUrl, healthCheckIntervalSeconds, ttlSeconds);
    }

    @Override
    public String toString() {
        return "WorkerInstance{id='" + id + "', address='" + address + "', weight=" + weight
                + ", load=" + currentLoad + ", health=" + healthStatus + ", active=" + active + "}";
    }
}
