package com.nanik.finhub.mcp;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nanik.finhub.Hub;
import com.nanik.finhub.config.HubConfig;
import com.nanik.finhub.testing.FakeHealthProbe;
import com.nanik.finhub.testing.FakeWorkerInvoker;
import com.nanik.finhub.testing.MutableClock;
import com.nanik.finhub.testing.Workers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the server through its stdio transport, one JSON message per line.
 */
class StdioServerTest {

    private Hub hub;

    @BeforeEach
    void setUp() {
        hub = new Hub(new HubConfig(), new MutableClock(), new FakeHealthProbe(), new FakeWorkerInvoker());
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
    }

    @AfterEach
    void tearDown() {
        hub.close();
    }

    private Map<Integer, JsonObject> run(String... lines) {
        String input = String.join("\n", lines) + "\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StdioTransport transport = new StdioTransport(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);

        new McpServer(hub, transport).start();

        Map<Integer, JsonObject> responses = new HashMap<>();
        for (String line : out.toString(StandardCharsets.UTF_8).split("\n")) {
            if (line.trim().isEmpty()) {
                continue;
            }
            JsonObject response = JsonParser.parseString(line).getAsJsonObject();
            responses.put(response.get("id").getAsInt(), response);
        }
        return responses;
    }

    @Test
    @Timeout(10)
    void answers_every_request_and_stops_at_end_of_input() {
        Map<Integer, JsonObject> responses = run(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":\"2025-03-26\"}}",
                "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
                "",
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"stock_quote\",\"arguments\":{}}}");

        assertEquals(3, responses.size());
        assertEquals("2025-03-26", responses.get(1).getAsJsonObject("result")
                .get("protocolVersion").getAsString());
        assertTrue(responses.get(2).has("result"));
        assertEquals("market-1", responses.get(3).getAsJsonObject("result")
                .getAsJsonObject("_meta").get("instance_id").getAsString());
    }

    @Test
    @Timeout(10)
    void shutdown_request_ends_the_loop() {
        Map<Integer, JsonObject> responses = run(
                "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"shutdown\"}");

        assertTrue(responses.get(7).has("result"));
    }
}
