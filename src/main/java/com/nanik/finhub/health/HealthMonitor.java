package com.nanik.finhub.health;

import com.nanik.finhub.catalog.CatalogStore;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.config.HubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Background liveness tracking for registered workers.
 *
 * Runs two independent cycles:
 * - probe cycle: probes every active instance in parallel, counts failures,
 *   deactivates an instance once it reaches the failure threshold;
 * - cleanup cycle: deactivates instances silent for longer than their TTL and
 *   purges instances that stayed inactive past the retention period.
 *
 * A failing probe is contained inside its cycle: it is logged and counted,
 * never propagated.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final CatalogStore catalog;
    private final HealthProbe probe;
    private final Duration probeInterval;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final Duration cleanupInterval;
    private final Duration inactiveRetention;

    private final ExecutorService probeExecutor;
    private final List<Consumer<String>> purgeListeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> probeTask;
    private ScheduledFuture<?> cleanupTask;

    public HealthMonitor(CatalogStore catalog, HealthProbe probe, HubConfig config) {
        this.catalog = catalog;
        this.probe = probe;
        this.probeInterval = config.getHealthCheckInterval();
        this.probeTimeout = config.getProbeTimeout();
        this.failureThreshold = config.getHealthFailureThreshold();
        this.cleanupInterval = config.getCleanupInterval();
        this.inactiveRetention = config.getInactiveRetention();
        this.probeExecutor = Executors.newCachedThreadPool(daemonThreads("health-probe"));
    }

    /**
     * Schedule both cycles. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(2, daemonThreads("health-monitor"));
        probeTask = scheduler.scheduleWithFixedDelay(this::probeCycleSafely,
                probeInterval.toMillis(), probeInterval.toMillis(), TimeUnit.MILLISECONDS);
        cleanupTask = scheduler.scheduleWithFixedDelay(this::cleanupCycleSafely,
                cleanupInterval.toMillis(), cleanupInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Health monitor started (probe every {}s, cleanup every {}s)",
                probeInterval.getSeconds(), cleanupInterval.getSeconds());
    }

    /**
     * Cancel both cycles and release the probe threads.
     */
    public synchronized void stop() {
        if (probeTask != null) {
            probeTask.cancel(true);
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(true);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        probeExecutor.shutdownNow();
        log.info("Health monitor stopped");
    }

    /**
     * Called with the id of every instance a cleanup cycle purges.
     */
    public void addPurgeListener(Consumer<String> listener) {
        purgeListeners.add(listener);
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void probeCycleSafely() {
        try {
            ProbeReport report = runProbeCycle();
            if (report.failed > 0) {
                log.info("Probe cycle: {}", report);
            } else {
                log.debug("Probe cycle: {}", report);
            }
        } catch (RuntimeException e) {
            log.error("Probe cycle aborted", e);
        }
    }

    private void cleanupCycleSafely() {
        try {
            CleanupReport report = runCleanupCycle();
            if (!report.expired.isEmpty() || !report.purged.isEmpty()) {
                log.info("Cleanup cycle: {}", report);
            }
        } catch (RuntimeException e) {
            log.error("Cleanup cycle aborted", e);
        }
    }

    /**
     * Probe every active instance once and apply the outcomes to the catalog.
     */
    public ProbeReport runProbeCycle() {
        ProbeReport report = new ProbeReport();
        List<WorkerInstance> targets = catalog.listActive();

        Map<WorkerInstance, Future<Boolean>> pending = new LinkedHashMap<>();
        for (WorkerInstance instance : targets) {
            try {
                pending.put(instance, probeExecutor.submit(() -> probe.probe(instance, probeTimeout)));
            } catch (RejectedExecutionException e) {
                log.warn("Probe executor rejected {}: monitor is stopping", instance.getId());
                return report;
            }
        }

        long deadline = System.nanoTime() + probeTimeout.toNanos();
        for (Map.Entry<WorkerInstance, Future<Boolean>> entry : pending.entrySet()) {
            WorkerInstance probed = entry.getKey();
            String instanceId = probed.getId();
            boolean healthy;
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                healthy = Boolean.TRUE.equals(entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
                if (!healthy) {
                    log.debug("Probe of {} returned a non-success answer", instanceId);
                }
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                log.debug("Probe of {} timed out after {} ms", instanceId, probeTimeout.toMillis());
                healthy = false;
            } catch (ExecutionException e) {
                log.debug("Probe of {} failed: {}", instanceId, e.getCause().toString());
                healthy = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                return report;
            }

            report.probed++;
            if (healthy) {
                report.healthy++;
                catalog.recordProbeSuccess(probed);
            } else {
                report.failed++;
                if (catalog.recordProbeFailure(probed, failureThreshold)) {
                    report.deactivated.add(instanceId);
                    log.warn("Worker {} deactivated after {} consecutive failed probes",
                            instanceId, failureThreshold);
                }
            }
        }
        return report;
    }

    /**
     * Expire silent instances and purge long-inactive ones.
     */
    public CleanupReport runCleanupCycle() {
        CleanupReport report = new CleanupReport();
        report.expired.addAll(catalog.expireStale());
        for (String id : report.expired) {
            log.warn("Worker {} expired: no activity within its TTL", id);
        }
        report.purged.addAll(catalog.purgeInactive(inactiveRetention));
        for (String id : report.purged) {
            log.info("Worker {} purged from catalog", id);
            purgeListeners.forEach(listener -> listener.accept(id));
        }
        return report;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    /** Outcome of one probe cycle. */
    public static final class ProbeReport {
        public int probed;
        public int healthy;
        public int failed;
        public final List<String> deactivated = new ArrayList<>();

        @Override
        public String toString() {
            return "ProbeReport{probed=" + probed + ", healthy=" + healthy
                    + ", failed=" + failed + ", deactivated=" + deactivated + "}";
        }
    }

    /** Outcome of one cleanup cycle. */
    public static final class CleanupReport {
        public final List<String> expired = new ArrayList<>();
        public final List<String> purged = new ArrayList<>();

        @Override
        public String toString() {
            return "CleanupReport{expired=" + expired + ", purged=" + purged + "}";
        }
    }
}
