package com.nanik.finhub.catalog;

import com.nanik.finhub.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * In-memory source of truth for registered worker instances and their tools.
 *
 * Every mutation runs under one lock; reads return copies taken under the same
 * lock. No I/O ever happens while the lock is held.
 */
public class CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(CatalogStore.class);

    /** Tool ids with this prefix belong to the hub's own management tools. */
    public static final String RESERVED_TOOL_PREFIX = "hub_";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.\\-]{0,127}");

    private final Object lock = new Object();
    private final Map<String, WorkerInstance> instances = new LinkedHashMap<>();
    private final Map<String, Map<String, ToolDescriptor>> toolsByInstance = new HashMap<>();
    private final Clock clock;
    private long registrations;

    public CatalogStore(Clock clock) {
        this.clock = clock;
    }

    // ---------------------------------------------------------------- registration

    /**
     * Upsert a worker instance and replace its tool set.
     *
     * The instance becomes active and HEALTHY with a fresh last-seen time and a
     * zero failure counter. In-flight load and the statistics of tools that are
     * declared again carry over from the previous registration.
     *
     * @return snapshot of the stored instance
     * @throws ValidationException naming the offending field
     */
    public WorkerInstance register(WorkerInstance instance, List<ToolDescriptor> tools) {
        validate(instance, tools);
        Instant now = clock.instant();

        synchronized (lock) {
            WorkerInstance previous = instances.get(instance.getId());
            WorkerInstance stored = instance.copy();
            stored.setCurrentLoad(previous != null ? previous.getCurrentLoad() : 0);
            stored.setRegisteredAt(previous != null ? previous.getRegisteredAt() : now);
            stored.setRegistration(++registrations);
            stored.setHealthStatus(HealthStatus.HEALTHY);
            stored.setConsecutiveFailures(0);
            stored.setLastSeen(now);
            stored.activate();

            Map<String, ToolDescriptor> oldTools = toolsByInstance.getOrDefault(instance.getId(), Map.of());
            Map<String, ToolDescriptor> newTools = new LinkedHashMap<>();
            for (ToolDescriptor tool : tools) {
                ToolDescriptor bound = tool.withWorker(instance.getId());
                ToolDescriptor old = oldTools.get(tool.getToolId());
                newTools.put(tool.getToolId(), old != null ? bound.withStats(old.stats()) : bound);
            }

            instances.put(stored.getId(), stored);
            toolsByInstance.put(stored.getId(), newTools);

            log.info("{} worker {} at {} with {} tool(s)",
                    previous == null ? "Registered" : "Re-registered",
                    stored.getId(), stored.getAddress(), newTools.size());
            return stored.copy();
        }
    }

    /**
     * Mark an instance inactive and drop its tools. No error if it is unknown or already inactive.
     *
     * @return true if an active instance was deregistered
     */
    public boolean deregister(String instanceId) {
        synchronized (lock) {
            WorkerInstance instance = instances.get(instanceId);
            toolsByInstance.remove(instanceId);
            if (instance == null || !instance.isActive()) {
                return false;
            }
            instance.deactivate(clock.instant());
            log.info("Deregistered worker {}", instanceId);
            return true;
        }
    }

    private void validate(WorkerInstance instance, List<ToolDescriptor> tools) {
        if (instance == null) {
            throw new ValidationException("instance", "is required");
        }
        requireIdentifier("instance_id", instance.getId());
        String address = instance.getAddress();
        if (address == null || address.trim().isEmpty()) {
            throw new ValidationException("address", "is required");
        }
        requireHttpUrl("address", address);
        if (instance.getDeclaredHealthCheckUrl() != null && !instance.getDeclaredHealthCheckUrl().isEmpty()) {
            requireHttpUrl("health_check_url", instance.getDeclaredHealthCheckUrl());
        }
        if (instance.getWeight() <= 0) {
            throw new ValidationException("weight", "must be a positive integer");
        }
        if (instance.getTtlSeconds() <= 0) {
            throw new ValidationException("ttl_seconds", "must be positive");
        }
        if (instance.getHealthCheckIntervalSeconds() <= 0) {
            throw new ValidationException("health_check_interval", "must be positive");
        }
        if (tools == null) {
            throw new ValidationException("tools", "is required");
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < tools.size(); i++) {
            ToolDescriptor tool = tools.get(i);
            String field = "tools[" + i + "].tool_id";
            if (tool == null) {
                throw new ValidationException("tools[" + i + "]", "is null");
            }
            requireIdentifier(field, tool.getToolId());
            if (tool.getToolId().startsWith(RESERVED_TOOL_PREFIX)) {
                throw new ValidationException(field, "prefix '" + RESERVED_TOOL_PREFIX + "' is reserved");
            }
            if (!seen.add(tool.getToolId())) {
                throw new ValidationException(field, "duplicate tool id " + tool.getToolId());
            }
            if (tool.getTimeoutSeconds() <= 0) {
                throw new ValidationException("tools[" + i + "].timeout_seconds", "must be positive");
            }
            if (tool.getRetryAttempts() < 0) {
                throw new ValidationException("tools[" + i + "].retry_attempts", "must not be negative");
            }
            if (tool.getInputSchema() != null && tool.getInputSchema().has("type")
                    && !"object".equals(tool.getInputSchema().get("type").getAsString())) {
                throw new ValidationException("tools[" + i + "].input_schema", "type must be \"object\"");
            }
        }
    }

    private static void requireIdentifier(String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(field, "is required");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new ValidationException(field, "malformed identifier '" + value + "'");
        }
    }

    private static void requireHttpUrl(String field, String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new ValidationException(field, "must be an http(s) URL with a host: " + value);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException(field, "malformed URL: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------- discovery

    /**
     * Active, HEALTHY instances offering the tool, ordered by id.
     */
    public List<WorkerInstance> discover(String toolName) {
        return discover(toolName, Collections.emptySet());
    }

    /**
     * Active, HEALTHY instances offering the tool, ordered by id, minus the excluded ids.
     */
    public List<WorkerInstance> discover(String toolName, Set<String> excluded) {
        List<WorkerInstance> result = new ArrayList<>();
        synchronized (lock) {
            for (WorkerInstance instance : instances.values()) {
                if (!instance.isAvailable() || excluded.contains(instance.getId())) {
                    continue;
                }
                Map<String, ToolDescriptor> tools = toolsByInstance.get(instance.getId());
                if (tools != null && tools.containsKey(toolName)) {
                    result.add(instance.copy());
                }
            }
        }
        result.sort(Comparator.comparing(WorkerInstance::getId));
        return result;
    }

    /**
     * One descriptor per tool id currently offered by an available instance, ordered by tool id.
     * When several instances offer a tool, the declaration of the lowest instance id is used.
     */
    public List<ToolDescriptor> discoverableTools() {
        Map<String, ToolDescriptor> byTool = new TreeMap<>();
        synchronized (lock) {
            List<String> ids = new ArrayList<>(instances.keySet());
            Collections.sort(ids);
            for (String id : ids) {
                if (!instances.get(id).isAvailable()) {
                    continue;
                }
                for (ToolDescriptor tool : toolsByInstance.getOrDefault(id, Map.of()).values()) {
                    byTool.putIfAbsent(tool.getToolId(), tool.copy());
                }
            }
        }
        return new ArrayList<>(byTool.values());
    }

    public Optional<WorkerInstance> get(String instanceId) {
        synchronized (lock) {
            WorkerInstance instance = instances.get(instanceId);
            return instance == null ? Optional.empty() : Optional.of(instance.copy());
        }
    }

    /**
     * All instances, active or not, in registration order.
     */
    public List<WorkerInstance> listAll() {
        List<WorkerInstance> result = new ArrayList<>();
        synchronized (lock) {
            for (WorkerInstance instance : instances.values()) {
                result.add(instance.copy());
            }
        }
        return result;
    }

    public List<WorkerInstance> listActive() {
        List<WorkerInstance> result = new ArrayList<>();
        synchronized (lock) {
            for (WorkerInstance instance : instances.values()) {
                if (instance.isActive()) {
                    result.add(instance.copy());
                }
            }
        }
        return result;
    }

    public List<ToolDescriptor> toolsOf(String instanceId) {
        List<ToolDescriptor> result = new ArrayList<>();
        synchronized (lock) {
            for (ToolDescriptor tool : toolsByInstance.getOrDefault(instanceId, Map.of()).values()) {
                result.add(tool.copy());
            }
        }
        return result;
    }

    public Optional<ToolDescriptor> findTool(String instanceId, String toolId) {
        synchronized (lock) {
            ToolDescriptor tool = toolsByInstance.getOrDefault(instanceId, Map.of()).get(toolId);
            return tool == null ? Optional.empty() : Optional.of(tool.copy());
        }
    }

    /**
     * Ids of every tool declared by a known instance, available or not, in order.
     */
    public SortedSet<String> declaredToolIds() {
        SortedSet<String> ids = new TreeSet<>();
        synchronized (lock) {
            for (Map<String, ToolDescriptor> tools : toolsByInstance.values()) {
                ids.addAll(tools.keySet());
            }
        }
        return ids;
    }

    /**
     * Statistics of a tool merged across every instance that currently declares it.
     */
    public ToolStats aggregateStats(String toolId) {
        ToolStats total = new ToolStats();
        synchronized (lock) {
            for (Map<String, ToolDescriptor> tools : toolsByInstance.values()) {
                ToolDescriptor tool = tools.get(toolId);
                if (tool != null) {
                    total = total.merge(tool.stats());
                }
            }
        }
        return total;
    }

    // ---------------------------------------------------------------- health monitor

    /**
     * A probe of {@code probed} succeeded: HEALTHY, failure counter reset,
     * last-seen refreshed.
     *
     * @param probed the snapshot the probe was sent to
     * @return false if the instance is unknown, no longer active, or was
     *         re-registered after the snapshot was taken
     */
    public boolean recordProbeSuccess(WorkerInstance probed) {
        synchronized (lock) {
            WorkerInstance instance = currentRegistration(probed);
            if (instance == null) {
                return false;
            }
            instance.setHealthStatus(HealthStatus.HEALTHY);
            instance.setConsecutiveFailures(0);
            instance.setLastSeen(clock.instant());
            return true;
        }
    }

    /**
     * A probe failed. When the failure count reaches the threshold the instance
     * becomes UNHEALTHY and inactive.
     *
     * Ignored under the same conditions as {@link #recordProbeSuccess}.
     *
     * @return true if this failure deactivated the instance
     */
    public boolean recordProbeFailure(WorkerInstance probed, int failureThreshold) {
        synchronized (lock) {
            WorkerInstance instance = currentRegistration(probed);
            if (instance == null) {
                return false;
            }
            int failures = instance.getConsecutiveFailures() + 1;
            instance.setConsecutiveFailures(failures);
            if (failures >= failureThreshold) {
                instance.setHealthStatus(HealthStatus.UNHEALTHY);
                instance.deactivate(clock.instant());
                return true;
            }
            return false;
        }
    }

    private WorkerInstance currentRegistration(WorkerInstance probed) {
        WorkerInstance instance = instances.get(probed.getId());
        if (instance == null || !instance.isActive()) {
            return null;
        }
        if (instance.getRegistration() != probed.getRegistration()) {
            log.debug("Dropping probe result for {}: re-registered since the probe started", probed.getId());
            return null;
        }
        return instance;
    }

    /**
     * Deactivate every active instance whose last-seen time is older than its TTL.
     *
     * @return ids of the instances deactivated
     */
    public List<String> expireStale() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        synchronized (lock) {
            for (WorkerInstance instance : instances.values()) {
                if (!instance.isActive() || instance.getLastSeen() == null) {
                    continue;
                }
                Instant deadline = instance.getLastSeen().plusSeconds(instance.getTtlSeconds());
                if (now.isAfter(deadline)) {
                    instance.deactivate(now);
                    expired.add(instance.getId());
                }
            }
        }
        return expired;
    }

    /**
     * Remove instances that have been inactive for at least the retention period.
     *
     * @return ids of the instances removed
     */
    public List<String> purgeInactive(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<String> purged = new ArrayList<>();
        synchronized (lock) {
            Iterator<WorkerInstance> it = instances.values().iterator();
            while (it.hasNext()) {
                WorkerInstance instance = it.next();
                if (!instance.isActive() && instance.getCurrentLoad() == 0
                        && instance.getDeactivatedAt() != null
                        && !instance.getDeactivatedAt().isAfter(cutoff)) {
                    it.remove();
                    toolsByInstance.remove(instance.getId());
                    purged.add(instance.getId());
                }
            }
        }
        return purged;
    }

    // ---------------------------------------------------------------- router

    /**
     * Count one dispatched invocation against the instance.
     */
    public void acquireLoad(String instanceId) {
        synchronized (lock) {
            WorkerInstance instance = instances.get(instanceId);
            if (instance != null) {
                instance.setCurrentLoad(instance.getCurrentLoad() + 1);
            }
        }
    }

    /**
     * Release one completed invocation. Load never drops below zero.
     */
    public void releaseLoad(String instanceId) {
        synchronized (lock) {
            WorkerInstance instance = instances.get(instanceId);
            if (instance != null && instance.getCurrentLoad() > 0) {
                instance.setCurrentLoad(instance.getCurrentLoad() - 1);
            }
        }
    }

    /**
     * A call succeeded on the instance: failure counter reset, last-seen refreshed.
     */
    public void recordInvocationSuccess(String instanceId) {
        synchronized (lock) {
            WorkerInstance instance = instances.get(instanceId);
            if (instance != null) {
                instance.setConsecutiveFailures(0);
                if (instance.isActive()) {
                    instance.setLastSeen(clock.instant());
                }
            }
        }
    }

    // ---------------------------------------------------------------- ledger

    /**
     * Fold one completed attempt into the tool's statistics. Unknown tools are ignored.
     */
    public void recordToolOutcome(String instanceId, String toolId, boolean succeeded, long latencyMillis) {
        synchronized (lock) {
            ToolDescriptor tool = toolsByInstance.getOrDefault(instanceId, Map.of()).get(toolId);
            if (tool != null) {
                tool.stats().record(succeeded, latencyMillis, clock.instant());
            }
        }
    }

    /**
     * Explicitly reset the statistics of a tool on every instance.
     *
     * @return number of descriptors reset
     */
    public int resetStats(String toolId) {
        int reset = 0;
        synchronized (lock) {
            for (Map<String, ToolDescriptor> tools : toolsByInstance.values()) {
                ToolDescriptor tool = tools.get(toolId);
                if (tool != null) {
                    tools.put(toolId, tool.withStats(new ToolStats()));
                    reset++;
                }
            }
        }
        return reset;
    }
}
