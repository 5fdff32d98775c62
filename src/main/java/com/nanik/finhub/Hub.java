package com.nanik.finhub;

import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.CatalogStore;
import com.nanik.finhub.catalog.Registration;
import com.nanik.finhub.catalog.RegistrationCodec;
import com.nanik.finhub.config.HubConfig;
import com.nanik.finhub.error.ValidationException;
import com.nanik.finhub.health.HealthMonitor;
import com.nanik.finhub.health.HealthProbe;
import com.nanik.finhub.health.HttpHealthProbe;
import com.nanik.finhub.ledger.ExecutionLedger;
import com.nanik.finhub.ledger.JsonLinesLedgerSink;
import com.nanik.finhub.router.BreakerRegistry;
import com.nanik.finhub.router.ExecutionRouter;
import com.nanik.finhub.router.HttpWorkerInvoker;
import com.nanik.finhub.router.LoadBalancingPolicy;
import com.nanik.finhub.router.WorkerInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the hub components together from a {@link HubConfig}.
 *
 * One instance owns the catalog, the breakers, the ledger, the router and the
 * health monitor; nothing is static.
 */
public class Hub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Hub.class);

    private final HubConfig config;
    private final Clock clock;
    private final CatalogStore catalog;
    private final BreakerRegistry breakers;
    private final ExecutionLedger ledger;
    private final ExecutionRouter router;
    private final HealthMonitor monitor;
    private final RegistrationCodec codec = new RegistrationCodec();

    /**
     * Production wiring: system clock, HTTP probe and HTTP worker transport.
     */
    public static Hub create(HubConfig config) throws IOException {
        Clock clock = Clock.systemUTC();
        CatalogStore catalog = new CatalogStore(clock);
        ExecutionLedger ledger = config.getLedgerFile() == null
                ? new ExecutionLedger(catalog, clock, config.getLedgerMaxRecords())
                : new ExecutionLedger(catalog, clock, config.getLedgerMaxRecords(),
                        new JsonLinesLedgerSink(Paths.get(config.getLedgerFile())));
        return new Hub(config, clock, catalog, ledger, new HttpHealthProbe(),
                new HttpWorkerInvoker(config.getInvokePath()));
    }

    /**
     * Wiring with an in-memory ledger and the given collaborators.
     */
    public Hub(HubConfig config, Clock clock, HealthProbe probe, WorkerInvoker invoker) {
        this(config, clock, new CatalogStore(clock), null, probe, invoker);
    }

    private Hub(HubConfig config, Clock clock, CatalogStore catalog, ExecutionLedger ledger,
                HealthProbe probe, WorkerInvoker invoker) {
        this.config = config;
        this.clock = clock;
        this.catalog = catalog;
        this.ledger = ledger != null
                ? ledger
                : new ExecutionLedger(catalog, clock, config.getLedgerMaxRecords());
        this.breakers = new BreakerRegistry(config.getCircuitFailureThreshold(),
                config.getCircuitRecoveryTimeout(), clock);
        this.router = new ExecutionRouter(catalog, breakers, LoadBalancingPolicy.forName(config.getLoadPolicy()),
                invoker, this.ledger, config.getMaxConcurrentExecutions());
        this.monitor = new HealthMonitor(catalog, probe, config);
        this.monitor.addPurgeListener(breakers::remove);
    }

    /**
     * Register the workers listed in the configuration. Invalid entries are
     * logged and skipped.
     *
     * @return number of workers registered
     */
    public int registerConfiguredWorkers() {
        int registered = 0;
        for (JsonObject payload : config.getWorkers()) {
            try {
                Registration registration = codec.parse(payload);
                catalog.register(registration.getInstance(), registration.getTools());
                registered++;
            } catch (ValidationException e) {
                log.warn("Skipping configured worker: {}", e.getMessage());
            }
        }
        return registered;
    }

    /**
     * Remove an instance from the catalog and forget its breaker.
     */
    public boolean deregister(String instanceId) {
        boolean removed = catalog.deregister(instanceId);
        breakers.remove(instanceId);
        return removed;
    }

    public void start() {
        monitor.start();
    }

    @Override
    public void close() {
        monitor.stop();
        router.close();
        ledger.close();
    }

    public HubConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public CatalogStore getCatalog() {
        return catalog;
    }

    public BreakerRegistry getBreakers() {
        return breakers;
    }

    public ExecutionLedger getLedger() {
        return ledger;
    }

    public ExecutionRouter getRouter() {
        return router;
    }

    public HealthMonitor getMonitor() {
        return monitor;
    }

    public RegistrationCodec getCodec() {
        return codec;
    }
}
