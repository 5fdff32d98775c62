package com.nanik.finhub.router;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link InstanceBreaker} per worker instance, created on first use.
 *
 * A breaker opens after {@code failureThreshold} consecutive failed calls: the
 * count-based window holds exactly that many calls and opens only at a 100%
 * failure rate. After {@code recoveryTimeout} one trial call is let through.
 */
public class BreakerRegistry {

    // Slow calls end as tool timeouts, which are counted as failures already
    private static final Duration SLOW_CALL_THRESHOLD = Duration.ofDays(1);

    private final CircuitBreakerRegistry registry;
    private final Map<String, InstanceBreaker> breakers = new ConcurrentHashMap<>();

    public BreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.registry = CircuitBreakerRegistry.of(config(failureThreshold, recoveryTimeout, clock));
    }

    static CircuitBreakerConfig config(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .slowCallDurationThreshold(SLOW_CALL_THRESHOLD)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(recoveryTimeout)
                .clock(clock)
                .build();
    }

    public InstanceBreaker forInstance(String instanceId) {
        return breakers.computeIfAbsent(instanceId, id -> new InstanceBreaker(registry.circuitBreaker(id)));
    }

    /**
     * Current state of the instance's breaker; CLOSED if it never had one.
     */
    public CircuitBreaker.State stateOf(String instanceId) {
        InstanceBreaker breaker = breakers.get(instanceId);
        return breaker == null ? CircuitBreaker.State.CLOSED : breaker.getState();
    }

    /**
     * Drop the breaker of an instance that left the catalog.
     */
    public void remove(String instanceId) {
        breakers.remove(instanceId);
        registry.remove(instanceId);
    }

    /**
     * States of all known breakers, ordered by instance id.
     */
    public Map<String, CircuitBreaker.State> snapshot() {
        Map<String, CircuitBreaker.State> states = new TreeMap<>();
        breakers.forEach((id, breaker) -> states.put(id, breaker.getState()));
        return states;
    }
}
