package com.nanik.finhub.mcp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.config.HubConfig;
import com.nanik.finhub.protocol.McpError;
import com.nanik.finhub.protocol.McpResponse;
import com.nanik.finhub.testing.FakeHealthProbe;
import com.nanik.finhub.testing.FakeWorkerInvoker;
import com.nanik.finhub.testing.MutableClock;
import com.nanik.finhub.testing.Workers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class McpServerTest {

    private MutableClock clock;
    private FakeWorkerInvoker invoker;
    private Hub hub;
    private McpServer server;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        invoker = new FakeWorkerInvoker();
        hub = new Hub(new HubConfig().setCircuitFailureThreshold(2), clock, new FakeHealthProbe(), invoker);
        server = new McpServer(hub, new StdioTransport(new ByteArrayInputStream(new byte[0]),
                new ByteArrayOutputStream()));
    }

    @AfterEach
    void tearDown() {
        hub.close();
    }

    private JsonObject send(String json) {
        McpResponse response = server.handle(json);
        assertNotNull(response, "expected a response to " + json);
        return response.toJson();
    }

    private JsonObject request(int id, String method, String params) {
        return send("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"" + method + "\""
                + (params != null ? ",\"params\":" + params : "") + "}");
    }

    private JsonObject callTool(int id, String name, String arguments) {
        return request(id, "tools/call", "{\"name\":\"" + name + "\",\"arguments\":" + arguments + "}");
    }

    private static int errorCode(JsonObject response) {
        assertTrue(response.has("error"), "expected an error in " + response);
        return response.getAsJsonObject("error").get("code").getAsInt();
    }

    /** The JSON document a hub tool returned as text. */
    private static JsonObject toolPayload(JsonObject response) {
        assertFalse(response.has("error"), "unexpected error " + response);
        JsonObject result = response.getAsJsonObject("result");
        String text = result.getAsJsonArray("content").get(0).getAsJsonObject().get("text").getAsString();
        return JsonParser.parseString(text).getAsJsonObject();
    }

    private static List<String> toolNames(JsonObject listResponse) {
        List<String> names = new ArrayList<>();
        for (JsonElement tool : listResponse.getAsJsonObject("result").getAsJsonArray("tools")) {
            names.add(tool.getAsJsonObject().get("name").getAsString());
        }
        return names;
    }

    @Test
    void initialize_negotiates_the_protocol_version_once() {
        JsonObject response = request(1, "initialize", "{\"protocolVersion\":\"2024-11-05\"}");

        JsonObject result = response.getAsJsonObject("result");
        assertEquals("2024-11-05", result.get("protocolVersion").getAsString());
        assertEquals("fin-hub", result.getAsJsonObject("serverInfo").get("name").getAsString());
        assertTrue(result.getAsJsonObject("capabilities").has("tools"));

        assertEquals(McpError.INVALID_REQUEST, errorCode(request(2, "initialize", "{}")));
    }

    @Test
    void unsupported_protocol_version_gets_the_newest_supported_one() {
        JsonObject response = request(1, "initialize", "{\"protocolVersion\":\"1999-01-01\"}");

        assertEquals(McpServer.SUPPORTED_PROTOCOL_VERSIONS.get(0),
                response.getAsJsonObject("result").get("protocolVersion").getAsString());
    }

    @Test
    void notifications_get_no_response() {
        assertNull(server.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"));
        assertTrue(server.isInitialized());

        assertNull(server.handle("{\"jsonrpc\":\"2.0\",\"method\":\"no/such/method\"}"));
    }

    @Test
    void ping_answers_with_an_empty_result() {
        JsonObject response = request(5, "ping", null);

        assertEquals(5, response.get("id").getAsInt());
        assertEquals(0, response.getAsJsonObject("result").size());
    }

    @Test
    void unknown_method_and_bad_envelopes_are_reported() {
        JsonObject unknown = request(9, "resources/list", null);
        assertEquals(McpError.METHOD_NOT_FOUND, errorCode(unknown));
        assertEquals(9, unknown.get("id").getAsInt());

        assertEquals(McpError.PARSE_ERROR, errorCode(send("{oops")));
        assertEquals(McpError.INVALID_REQUEST, errorCode(send("{\"jsonrpc\":\"2.0\",\"id\":1}")));
    }

    @Test
    void tools_list_shows_hub_tools_and_worker_tools() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        Workers.register(hub.getCatalog(), "market-2", 100, "stock_quote", "news");

        List<String> names = toolNames(request(1, "tools/list", null));

        assertTrue(names.containsAll(List.of("hub_register_spoke", "hub_unregister_spoke", "hub_list_spokes",
                "hub_status", "hub_health_check", "hub_search_tools", "hub_execution_history", "hub_tool_stats")));
        assertEquals(10, names.size());
        assertEquals(List.of("news", "stock_quote"), names.subList(8, 10));
    }

    @Test
    void tools_call_routes_to_a_worker() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");

        JsonObject response = callTool(3, "stock_quote", "{\"symbol\":\"AAPL\"}");

        JsonObject payload = toolPayload(response);
        assertEquals("market-1", payload.get("instance").getAsString());
        JsonObject meta = response.getAsJsonObject("result").getAsJsonObject("_meta");
        assertEquals("market-1", meta.get("instance_id").getAsString());
        assertEquals(1, meta.get("attempts").getAsInt());
        assertEquals("3", hub.getLedger().find(meta.get("invocation_id").getAsString())
                .orElseThrow().getCorrelationId());
    }

    @Test
    void worker_content_is_passed_through() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        invoker.on("market-1", (instance, tool, args) -> JsonParser.parseString(
                "{\"content\":[{\"type\":\"text\",\"text\":\"AAPL 189.50\"}]}"));

        JsonObject result = callTool(3, "stock_quote", "{}").getAsJsonObject("result");

        assertEquals("AAPL 189.50",
                result.getAsJsonArray("content").get(0).getAsJsonObject().get("text").getAsString());
    }

    @Test
    void routing_failures_become_structured_errors() {
        assertEquals(McpError.TOOL_UNAVAILABLE, errorCode(callTool(1, "stock_quote", "{}")));

        hub.getCatalog().register(Workers.instance("market-1", 100),
                List.of(Workers.tool("stock_quote").withRetryAttempts(0)));
        invoker.failing("market-1");
        assertEquals(McpError.INVOCATION_FAILED, errorCode(callTool(2, "stock_quote", "{}")));
        assertEquals(McpError.INVOCATION_FAILED, errorCode(callTool(3, "stock_quote", "{}")));
        assertEquals(McpError.CIRCUIT_OPEN, errorCode(callTool(4, "stock_quote", "{}")));
    }

    @Test
    void tools_call_validates_its_params() {
        assertEquals(McpError.INVALID_PARAMS, errorCode(request(1, "tools/call", "{}")));
        assertEquals(McpError.INVALID_PARAMS, errorCode(callTool(2, "stock_quote", "[1]")));
    }

    @Test
    void spokes_register_and_unregister_through_hub_tools() {
        JsonObject registered = toolPayload(callTool(1, "hub_register_spoke", "{"
                + "\"instance_id\":\"risk-1\",\"address\":\"http://localhost:8002\","
                + "\"tools\":[{\"tool_id\":\"var_calculator\",\"description\":\"Value at risk\"}]}"));
        assertEquals("registered", registered.get("status").getAsString());
        assertTrue(toolNames(request(2, "tools/list", null)).contains("var_calculator"));

        JsonObject spokes = toolPayload(callTool(3, "hub_list_spokes", "{}"));
        JsonObject spoke = spokes.getAsJsonArray("spokes").get(0).getAsJsonObject();
        assertEquals("risk-1", spoke.get("instance_id").getAsString());
        assertEquals("HEALTHY", spoke.get("health_status").getAsString());
        assertEquals("CLOSED", spoke.get("circuit_state").getAsString());

        JsonObject removed = toolPayload(callTool(4, "hub_unregister_spoke", "{\"instance_id\":\"risk-1\"}"));
        assertEquals("unregistered", removed.get("status").getAsString());
        assertFalse(toolNames(request(5, "tools/list", null)).contains("var_calculator"));

        JsonObject again = toolPayload(callTool(6, "hub_unregister_spoke", "{\"instance_id\":\"risk-1\"}"));
        assertEquals("not_registered", again.get("status").getAsString());
    }

    @Test
    void invalid_registration_names_the_field() {
        JsonObject response = callTool(1, "hub_register_spoke",
                "{\"instance_id\":\"risk-1\",\"address\":\"not a url\",\"tools\":[]}");

        assertEquals(McpError.INVALID_PARAMS, errorCode(response));
        assertTrue(response.getAsJsonObject("error").get("data").getAsString().startsWith("address"));
        assertTrue(hub.getCatalog().listAll().isEmpty());
    }

    @Test
    void health_check_reports_the_share_of_healthy_instances() {
        Workers.register(hub.getCatalog(), "a", 100, "t");
        Workers.register(hub.getCatalog(), "b", 100, "t");
        WorkerInstance c = Workers.register(hub.getCatalog(), "c", 100, "t");
        hub.getCatalog().recordProbeFailure(c, 1);

        JsonObject health = toolPayload(callTool(1, "hub_health_check", "{}"));

        assertEquals(3, health.get("total_spokes").getAsInt());
        assertEquals(2, health.get("healthy_spokes").getAsInt());
        assertEquals(66.7, health.get("health_score").getAsDouble(), 0.0001);
        assertFalse(health.get("all_spokes_healthy").getAsBoolean());
    }

    @Test
    void search_ranks_tools_by_relevance() {
        hub.getCatalog().register(Workers.instance("market-1", 100), List.of(
                Workers.tool("stock_quote"),
                Workers.tool("stock_screener"),
                Workers.tool("var_calculator")));

        JsonObject found = toolPayload(callTool(1, "hub_search_tools", "{\"query\":\"stock_quote\"}"));

        JsonArray matches = found.getAsJsonArray("matching_tools");
        assertEquals("stock_quote", matches.get(0).getAsJsonObject().get("name").getAsString());
        assertEquals(McpError.INVALID_PARAMS, errorCode(callTool(2, "hub_search_tools", "{}")));
    }

    @Test
    void execution_history_and_status_reflect_routed_calls() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        callTool(1, "stock_quote", "{}");
        callTool(2, "stock_quote", "{}");

        JsonObject history = toolPayload(callTool(3, "hub_execution_history", "{\"limit\":5}"));
        assertEquals(2, history.get("count").getAsInt());
        assertEquals("2", history.getAsJsonArray("records").get(0).getAsJsonObject()
                .get("correlation_id").getAsString());

        JsonObject byRequest = toolPayload(callTool(4, "hub_execution_history", "{\"correlation_id\":\"1\"}"));
        assertEquals(1, byRequest.get("count").getAsInt());

        JsonObject status = toolPayload(callTool(5, "hub_status", "{}"));
        assertEquals(2, status.getAsJsonObject("executions").get("succeeded").getAsInt());
        assertEquals(1, status.getAsJsonObject("catalog").get("discoverable_tools").getAsInt());
        assertEquals("weighted_priority", status.getAsJsonObject("router").get("load_policy").getAsString());
    }

    @Test
    void execution_history_filters_by_start_time() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        callTool(1, "stock_quote", "{}");
        clock.advanceSeconds(60);
        callTool(2, "stock_quote", "{}");
        clock.advanceSeconds(60);
        callTool(3, "stock_quote", "{}");

        JsonObject window = toolPayload(callTool(4, "hub_execution_history",
                "{\"from\":\"2024-01-01T00:01:00Z\",\"to\":\"2024-01-01T00:02:00Z\"}"));
        assertEquals(1, window.get("count").getAsInt());
        assertEquals("2", window.getAsJsonArray("records").get(0).getAsJsonObject()
                .get("correlation_id").getAsString());

        JsonObject since = toolPayload(callTool(5, "hub_execution_history", "{\"from\":\"2024-01-01T00:01:00Z\"}"));
        assertEquals(2, since.get("count").getAsInt());

        JsonObject until = toolPayload(callTool(6, "hub_execution_history", "{\"to\":\"2024-01-01T00:01:00Z\"}"));
        assertEquals(1, until.get("count").getAsInt());

        assertEquals(McpError.INVALID_PARAMS,
                errorCode(callTool(7, "hub_execution_history", "{\"from\":\"yesterday\"}")));
        assertEquals(McpError.INVALID_PARAMS, errorCode(callTool(8, "hub_execution_history",
                "{\"from\":\"2024-01-01T00:02:00Z\",\"to\":\"2024-01-01T00:01:00Z\"}")));
    }

    @Test
    void tool_stats_report_success_rate_and_latency_and_can_be_reset() {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        Workers.register(hub.getCatalog(), "risk-1", 100, "var_calculator");
        callTool(1, "stock_quote", "{}");
        invoker.failing("market-1");
        callTool(2, "stock_quote", "{}");

        JsonObject all = toolPayload(callTool(3, "hub_tool_stats", "{}"));
        assertEquals(2, all.get("count").getAsInt());
        JsonObject quote = all.getAsJsonArray("tools").get(0).getAsJsonObject();
        assertEquals("stock_quote", quote.get("tool_id").getAsString());
        assertEquals(2, quote.get("total_invocations").getAsInt());
        assertEquals(1, quote.get("successful_invocations").getAsInt());
        assertEquals(1, quote.get("failed_invocations").getAsInt());
        assertEquals(50.0, quote.get("success_rate").getAsDouble(), 0.0001);
        assertEquals(0.0, quote.get("average_latency_ms").getAsDouble(), 0.0001);
        JsonObject idle = all.getAsJsonArray("tools").get(1).getAsJsonObject();
        assertEquals("var_calculator", idle.get("tool_id").getAsString());
        assertEquals(0, idle.get("total_invocations").getAsInt());

        JsonObject reset = toolPayload(callTool(4, "hub_tool_stats", "{\"tool_id\":\"stock_quote\",\"reset\":true}"));
        assertEquals(1, reset.get("count").getAsInt());
        assertEquals(2, reset.getAsJsonArray("tools").get(0).getAsJsonObject().get("total_invocations").getAsInt());
        assertEquals(1, reset.get("reset_instances").getAsInt());

        JsonObject after = toolPayload(callTool(5, "hub_tool_stats", "{\"tool_id\":\"stock_quote\"}"));
        assertEquals(0, after.getAsJsonArray("tools").get(0).getAsJsonObject().get("total_invocations").getAsInt());

        assertEquals(McpError.INVALID_PARAMS, errorCode(callTool(6, "hub_tool_stats", "{\"reset\":true}")));
        assertEquals(McpError.INVALID_PARAMS,
                errorCode(callTool(7, "hub_tool_stats", "{\"tool_id\":\"stock_quote\",\"reset\":\"yes\"}")));
        assertTrue(callTool(8, "hub_tool_stats", "{\"tool_id\":\"no_such_tool\"}")
                .getAsJsonObject("result").get("isError").getAsBoolean());
    }

    @Test
    void cancellation_notification_stops_an_in_flight_call() throws Exception {
        Workers.register(hub.getCatalog(), "market-1", 100, "stock_quote");
        CountDownLatch never = new CountDownLatch(1);
        invoker.on("market-1", (instance, tool, args) -> {
            never.await();
            return null;
        });

        ExecutorService client = Executors.newSingleThreadExecutor();
        try {
            Future<JsonObject> pending = client.submit(() -> callTool(42, "stock_quote", "{}"));
            await().atMost(Duration.ofSeconds(5)).until(() -> {
                server.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\","
                        + "\"params\":{\"requestId\":42}}");
                return pending.isDone();
            });

            JsonObject response = pending.get(1, TimeUnit.SECONDS);
            assertEquals(McpError.REQUEST_CANCELLED, errorCode(response));
            assertEquals(42, response.get("id").getAsInt());
        } finally {
            client.shutdownNow();
        }
    }
}
