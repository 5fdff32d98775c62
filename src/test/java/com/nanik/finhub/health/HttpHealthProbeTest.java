package com.nanik.finhub.health;

import com.nanik.finhub.catalog.WorkerInstance;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpHealthProbeTest {

    private HttpServer server;
    private String base;
    private final HttpHealthProbe probe = new HttpHealthProbe();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/ready", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void default_health_endpoint_answering_2xx_is_healthy() throws Exception {
        WorkerInstance instance = new WorkerInstance("w1", base, 100);

        assertTrue(probe.probe(instance, Duration.ofSeconds(2)));
    }

    @Test
    void declared_endpoint_answering_5xx_is_unhealthy() throws Exception {
        WorkerInstance instance = new WorkerInstance("w1", "w1", base, 100, base + "/ready", 30, 300);

        assertFalse(probe.probe(instance, Duration.ofSeconds(2)));
    }

    @Test
    void unreachable_worker_raises() {
        WorkerInstance instance = new WorkerInstance("w1", "http://127.0.0.1:1", 100);

        assertThrows(IOException.class, () -> probe.probe(instance, Duration.ofSeconds(2)));
    }
}
