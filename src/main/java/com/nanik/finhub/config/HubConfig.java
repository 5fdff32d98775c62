package com.nanik.finhub.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Hub settings, read from JSON (snake_case keys). Every field has a default,
 * so an empty object is a valid configuration.
 *
 * Lookup order: explicit path argument, the {@code finhub.config} system
 * property, {@code finhub.json} on the classpath, built-in defaults.
 * Durations are given in (possibly fractional) seconds.
 */
public class HubConfig {

    private static final Logger log = LoggerFactory.getLogger(HubConfig.class);

    public static final String CONFIG_PROPERTY = "finhub.config";
    public static final String CLASSPATH_RESOURCE = "/finhub.json";

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private String serverName = "fin-hub";
    private String serverVersion = "1.0.0";

    // Health monitor
    private double healthCheckIntervalSeconds = 30;
    private double probeTimeoutSeconds = 10;
    private int healthFailureThreshold = 3;
    private double cleanupIntervalSeconds = 60;
    private double inactiveRetentionSeconds = 600;

    // Router
    private int circuitFailureThreshold = 5;
    private double circuitRecoveryTimeoutSeconds = 60;
    private int maxConcurrentExecutions = 10;
    private String loadPolicy = "weighted_priority";
    private String invokePath = "/mcp";

    // Ledger
    private int ledgerMaxRecords = 10_000;
    private String ledgerFile;

    // Workers registered at startup, same shape as a registration payload
    private List<JsonObject> workers = new ArrayList<>();

    /**
     * Load using the standard lookup order.
     *
     * @param explicitPath path given on the command line, may be null
     */
    public static HubConfig load(String explicitPath) throws IOException {
        String path = explicitPath != null ? explicitPath : System.getProperty(CONFIG_PROPERTY);
        if (path != null) {
            Path file = Paths.get(path);
            log.info("Loading configuration from {}", file.toAbsolutePath());
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return parse(reader);
            }
        }
        try (InputStream in = HubConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                log.info("Loading configuration from classpath {}", CLASSPATH_RESOURCE);
                return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }
        log.info("No configuration found, using defaults");
        return new HubConfig().validate();
    }

    /**
     * Parse a JSON document. Unknown keys are ignored.
     */
    public static HubConfig parse(Reader reader) {
        HubConfig config;
        try {
            config = GSON.fromJson(reader, HubConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid hub configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new HubConfig();
        }
        if (config.workers == null) {
            config.workers = new ArrayList<>();
        }
        return config.validate();
    }

    /**
     * Reject settings that would make a cycle or a breaker meaningless.
     */
    public HubConfig validate() {
        requirePositive("health_check_interval_seconds", healthCheckIntervalSeconds);
        requirePositive("probe_timeout_seconds", probeTimeoutSeconds);
        requirePositive("health_failure_threshold", healthFailureThreshold);
        requirePositive("cleanup_interval_seconds", cleanupIntervalSeconds);
        requirePositive("inactive_retention_seconds", inactiveRetentionSeconds);
        requirePositive("circuit_failure_threshold", circuitFailureThreshold);
        requirePositive("circuit_recovery_timeout_seconds", circuitRecoveryTimeoutSeconds);
        requirePositive("max_concurrent_executions", maxConcurrentExecutions);
        requirePositive("ledger_max_records", ledgerMaxRecords);
        if (!"weighted_priority".equals(loadPolicy) && !"least_load".equals(loadPolicy)) {
            throw new IllegalArgumentException(
                    "load_policy must be weighted_priority or least_load, got " + loadPolicy);
        }
        return this;
    }

    private static void requirePositive(String key, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    public String getServerName() {
        return serverName;
    }

    public String getServerVersion() {
        return serverVersion;
    }

    public Duration getHealthCheckInterval() {
        return seconds(healthCheckIntervalSeconds);
    }

    public HubConfig setHealthCheckIntervalSeconds(double value) {
        this.healthCheckIntervalSeconds = value;
        return this;
    }

    public Duration getProbeTimeout() {
        return seconds(probeTimeoutSeconds);
    }

    public HubConfig setProbeTimeoutSeconds(double value) {
        this.probeTimeoutSeconds = value;
        return this;
    }

    public int getHealthFailureThreshold() {
        return healthFailureThreshold;
    }

    public HubConfig setHealthFailureThreshold(int value) {
        this.healthFailureThreshold = value;
        return this;
    }

    public Duration getCleanupInterval() {
        return seconds(cleanupIntervalSeconds);
    }

    public HubConfig setCleanupIntervalSeconds(double value) {
        this.cleanupIntervalSeconds = value;
        return this;
    }

    public Duration getInactiveRetention() {
        return seconds(inactiveRetentionSeconds);
    }

    public HubConfig setInactiveRetentionSeconds(double value) {
        this.inactiveRetentionSeconds = value;
        return this;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public HubConfig setCircuitFailureThreshold(int value) {
        this.circuitFailureThreshold = value;
        return this;
    }

    public Duration getCircuitRecoveryTimeout() {
        return seconds(circuitRecoveryTimeoutSeconds);
    }

    public HubConfig setCircuitRecoveryTimeoutSeconds(double value) {
        this.circuitRecoveryTimeoutSeconds = value;
        return this;
    }

    public int getMaxConcurrentExecutions() {
        return maxConcurrentExecutions;
    }

    public HubConfig setMaxConcurrentExecutions(int value) {
        this.maxConcurrentExecutions = value;
        return this;
    }

    public String getLoadPolicy() {
        return loadPolicy;
    }

    public HubConfig setLoadPolicy(String value) {
        this.loadPolicy = value;
        return this;
    }

    public String getInvokePath() {
        return invokePath;
    }

    public int getLedgerMaxRecords() {
        return ledgerMaxRecords;
    }

    public HubConfig setLedgerMaxRecords(int value) {
        this.ledgerMaxRecords = value;
        return this;
    }

    public String getLedgerFile() {
        return ledgerFile;
    }

    public HubConfig setLedgerFile(String value) {
        this.ledgerFile = value;
        return this;
    }

    public List<JsonObject> getWorkers() {
        return workers;
    }
}
