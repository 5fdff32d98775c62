package com.nanik.finhub.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HubConfigTest {

    @Test
    void empty_document_yields_reference_defaults() {
        HubConfig config = HubConfig.parse(new StringReader("{}"));

        assertEquals("fin-hub", config.getServerName());
        assertEquals(Duration.ofSeconds(30), config.getHealthCheckInterval());
        assertEquals(Duration.ofSeconds(10), config.getProbeTimeout());
        assertEquals(3, config.getHealthFailureThreshold());
        assertEquals(Duration.ofSeconds(60), config.getCleanupInterval());
        assertEquals(Duration.ofSeconds(600), config.getInactiveRetention());
        assertEquals(5, config.getCircuitFailureThreshold());
        assertEquals(Duration.ofSeconds(60), config.getCircuitRecoveryTimeout());
        assertEquals(10, config.getMaxConcurrentExecutions());
        assertEquals("weighted_priority", config.getLoadPolicy());
        assertEquals("/mcp", config.getInvokePath());
        assertEquals(10_000, config.getLedgerMaxRecords());
        assertNull(config.getLedgerFile());
        assertTrue(config.getWorkers().isEmpty());
    }

    @Test
    void snake_case_keys_override_defaults() {
        HubConfig config = HubConfig.parse(new StringReader("{"
                + "\"server_name\":\"test-hub\",\"health_check_interval_seconds\":0.5,"
                + "\"circuit_failure_threshold\":2,\"load_policy\":\"least_load\","
                + "\"ledger_file\":\"/tmp/ledger.jsonl\",\"unknown_key\":true,"
                + "\"workers\":[{\"instance_id\":\"w1\",\"address\":\"http://localhost:9001\"}]}"));

        assertEquals("test-hub", config.getServerName());
        assertEquals(Duration.ofMillis(500), config.getHealthCheckInterval());
        assertEquals(2, config.getCircuitFailureThreshold());
        assertEquals("least_load", config.getLoadPolicy());
        assertEquals("/tmp/ledger.jsonl", config.getLedgerFile());
        assertEquals(1, config.getWorkers().size());
        assertEquals("w1", config.getWorkers().get(0).get("instance_id").getAsString());
    }

    @Test
    void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> HubConfig.parse(new StringReader("{\"max_concurrent_executions\":0}")));
        assertThrows(IllegalArgumentException.class,
                () -> HubConfig.parse(new StringReader("{\"load_policy\":\"round_robin\"}")));
        assertThrows(IllegalArgumentException.class,
                () -> HubConfig.parse(new StringReader("{\"probe_timeout_seconds\":\"soon\"}")));
    }

    @Test
    void explicit_path_wins_over_classpath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("hub.json");
        Files.write(file, "{\"server_name\":\"from-file\"}".getBytes(StandardCharsets.UTF_8));

        HubConfig config = HubConfig.load(file.toString());

        assertEquals("from-file", config.getServerName());
    }

    @Test
    void classpath_configuration_lists_the_builtin_workers() throws IOException {
        HubConfig config = HubConfig.load(null);

        assertEquals(3, config.getWorkers().size());
        assertEquals("market-spoke", config.getWorkers().get(0).get("instance_id").getAsString());
    }
}
