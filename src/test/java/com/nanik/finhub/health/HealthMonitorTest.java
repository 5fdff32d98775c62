package com.nanik.finhub.health;

import com.nanik.finhub.catalog.CatalogStore;
import com.nanik.finhub.catalog.HealthStatus;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.config.HubConfig;
import com.nanik.finhub.testing.FakeHealthProbe;
import com.nanik.finhub.testing.FakeHealthProbe.Answer;
import com.nanik.finhub.testing.MutableClock;
import com.nanik.finhub.testing.Workers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private MutableClock clock;
    private CatalogStore catalog;
    private FakeHealthProbe probe;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        catalog = new CatalogStore(clock);
        probe = new FakeHealthProbe();
        monitor = new HealthMonitor(catalog, probe, new HubConfig().setProbeTimeoutSeconds(0.3));
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    @Test
    void three_failed_probes_make_an_instance_unhealthy_and_undiscoverable() {
        Workers.register(catalog, "risk-1", 100, "var_calculator");
        Workers.register(catalog, "risk-2", 100, "var_calculator");
        probe.answer("risk-1", Answer.UNHEALTHY);

        monitor.runProbeCycle();
        monitor.runProbeCycle();
        assertEquals(2, catalog.discover("var_calculator").size(), "still under the threshold");

        HealthMonitor.ProbeReport report = monitor.runProbeCycle();

        assertEquals(List.of("risk-1"), report.deactivated);
        WorkerInstance failed = catalog.get("risk-1").orElseThrow();
        assertEquals(HealthStatus.UNHEALTHY, failed.getHealthStatus());
        assertEquals(3, failed.getConsecutiveFailures());
        assertEquals(List.of("risk-2"),
                catalog.discover("var_calculator").stream().map(WorkerInstance::getId)
                        .collect(Collectors.toList()));
    }

    @Test
    void a_successful_probe_resets_the_failure_count() {
        Workers.register(catalog, "risk-1", 100, "var_calculator");
        probe.answer("risk-1", Answer.UNHEALTHY);
        monitor.runProbeCycle();
        monitor.runProbeCycle();

        probe.answer("risk-1", Answer.HEALTHY);
        clock.advanceSeconds(10);
        monitor.runProbeCycle();

        WorkerInstance instance = catalog.get("risk-1").orElseThrow();
        assertEquals(0, instance.getConsecutiveFailures());
        assertEquals(clock.instant(), instance.getLastSeen());
    }

    @Test
    void probe_exceptions_and_hangs_count_as_failures_without_escaping() {
        Workers.register(catalog, "broken", 100, "a");
        Workers.register(catalog, "stuck", 100, "a");
        Workers.register(catalog, "fine", 100, "a");
        probe.answer("broken", Answer.THROWS).answer("stuck", Answer.HANGS);

        HealthMonitor.ProbeReport report = monitor.runProbeCycle();

        assertEquals(3, report.probed);
        assertEquals(1, report.healthy);
        assertEquals(2, report.failed);
        assertEquals(1, catalog.get("broken").orElseThrow().getConsecutiveFailures());
        assertEquals(1, catalog.get("stuck").orElseThrow().getConsecutiveFailures());
        assertEquals(0, catalog.get("fine").orElseThrow().getConsecutiveFailures());
    }

    @Test
    void inactive_instances_are_not_probed() {
        Workers.register(catalog, "gone", 100, "a");
        catalog.deregister("gone");

        HealthMonitor.ProbeReport report = monitor.runProbeCycle();

        assertEquals(0, report.probed);
        assertEquals(0, probe.probeCount());
    }

    @Test
    void cleanup_expires_silent_instances_then_purges_them_after_retention() {
        Workers.register(catalog, "silent", 100, "a");

        clock.advanceSeconds(WorkerInstance.DEFAULT_TTL_SECONDS + 1);
        HealthMonitor.CleanupReport first = monitor.runCleanupCycle();
        assertEquals(List.of("silent"), first.expired);
        assertTrue(first.purged.isEmpty());
        assertTrue(catalog.discover("a").isEmpty());

        clock.advanceSeconds(600);
        HealthMonitor.CleanupReport second = monitor.runCleanupCycle();
        assertEquals(List.of("silent"), second.purged);
        assertFalse(catalog.get("silent").isPresent());
    }

    @Test
    void purged_instances_are_reported_to_listeners() {
        List<String> purged = new CopyOnWriteArrayList<>();
        monitor.addPurgeListener(purged::add);
        Workers.register(catalog, "silent", 100, "a");

        clock.advanceSeconds(WorkerInstance.DEFAULT_TTL_SECONDS + 1);
        monitor.runCleanupCycle();
        assertTrue(purged.isEmpty());

        clock.advanceSeconds(600);
        monitor.runCleanupCycle();
        assertEquals(List.of("silent"), purged);
    }

    @Test
    void result_of_a_probe_sent_before_reregistration_is_dropped() {
        Workers.register(catalog, "risk-1", 100, "var_calculator");
        HealthProbe reregisterWhileProbing = (instance, timeout) -> {
            Workers.register(catalog, instance.getId(), 100, "var_calculator");
            return false;
        };
        monitor.stop();
        monitor = new HealthMonitor(catalog, reregisterWhileProbing,
                new HubConfig().setProbeTimeoutSeconds(0.3).setHealthFailureThreshold(1));

        HealthMonitor.ProbeReport report = monitor.runProbeCycle();

        assertEquals(1, report.failed);
        assertTrue(report.deactivated.isEmpty());
        WorkerInstance stored = catalog.get("risk-1").orElseThrow();
        assertTrue(stored.isActive());
        assertEquals(HealthStatus.HEALTHY, stored.getHealthStatus());
        assertEquals(0, stored.getConsecutiveFailures());

        monitor.stop();
        monitor = new HealthMonitor(catalog, probe.answer("risk-1", Answer.UNHEALTHY),
                new HubConfig().setProbeTimeoutSeconds(0.3).setHealthFailureThreshold(1));
        assertEquals(List.of("risk-1"), monitor.runProbeCycle().deactivated);
    }

    @Test
    void scheduled_cycles_run_in_the_background() {
        HubConfig config = new HubConfig()
                .setHealthCheckIntervalSeconds(0.05)
                .setProbeTimeoutSeconds(0.5)
                .setCleanupIntervalSeconds(0.05);
        monitor.stop();
        monitor = new HealthMonitor(catalog, probe, config);
        Workers.register(catalog, "flaky", 100, "a");
        probe.answer("flaky", Answer.THROWS);

        monitor.start();
        assertTrue(monitor.isRunning());

        await().atMost(Duration.ofSeconds(5))
                .until(() -> catalog.get("flaky").orElseThrow().getHealthStatus() == HealthStatus.UNHEALTHY);
        assertFalse(catalog.get("flaky").orElseThrow().isActive());

        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
