package com.nanik.finhub.catalog;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nanik.finhub.error.ValidationException;
import com.nanik.finhub.testing.Workers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationCodecTest {

    private final RegistrationCodec codec = new RegistrationCodec();

    @Test
    void minimal_payload_takes_defaults() {
        Registration registration = codec.parse("{\"instance_id\":\"market-1\",\"address\":\"http://localhost:8001\","
                + "\"tools\":[{\"tool_id\":\"stock_quote\"}]}");

        WorkerInstance instance = registration.getInstance();
        assertEquals("market-1", instance.getId());
        assertEquals("market-1", instance.getName());
        assertEquals(WorkerInstance.DEFAULT_WEIGHT, instance.getWeight());
        assertEquals(WorkerInstance.DEFAULT_TTL_SECONDS, instance.getTtlSeconds());
        assertEquals(WorkerInstance.DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS, instance.getHealthCheckIntervalSeconds());
        assertEquals("http://localhost:8001/health", instance.getHealthCheckUrl());

        ToolDescriptor tool = registration.getTools().get(0);
        assertEquals("stock_quote", tool.getToolId());
        assertEquals("stock_quote", tool.getName());
        assertEquals("", tool.getDescription());
        assertEquals(ToolDescriptor.DEFAULT_TIMEOUT_SECONDS, tool.getTimeoutSeconds());
        assertEquals(ToolDescriptor.DEFAULT_RETRY_ATTEMPTS, tool.getRetryAttempts());
        assertEquals("object", tool.getInputSchema().get("type").getAsString());
    }

    @Test
    void full_payload_is_read_field_by_field() {
        JsonObject payload = JsonParser.parseString("{"
                + "\"instance_id\":\"risk-1\",\"name\":\"Risk Spoke\",\"address\":\"https://risk.example.com\","
                + "\"weight\":250,\"health_check_url\":\"https://risk.example.com/status\","
                + "\"health_check_interval\":15,\"ttl_seconds\":120,"
                + "\"tools\":[{\"tool_id\":\"var_calculator\",\"name\":\"VaR\",\"description\":\"Value at risk\","
                + "\"input_schema\":{\"type\":\"object\",\"properties\":{\"symbols\":{\"type\":\"array\"}}},"
                + "\"output_schema\":{\"type\":\"object\"},\"timeout_seconds\":45,\"retry_attempts\":1}]}")
                .getAsJsonObject();

        Registration registration = codec.parse(payload);

        WorkerInstance instance = registration.getInstance();
        assertEquals("Risk Spoke", instance.getName());
        assertEquals(250, instance.getWeight());
        assertEquals("https://risk.example.com/status", instance.getHealthCheckUrl());
        assertEquals(15, instance.getHealthCheckIntervalSeconds());
        assertEquals(120, instance.getTtlSeconds());

        ToolDescriptor tool = registration.getTools().get(0);
        assertEquals("VaR", tool.getName());
        assertEquals("risk-1", tool.getWorkerId());
        assertEquals(45, tool.getTimeoutSeconds());
        assertEquals(1, tool.getRetryAttempts());
        assertNotNull(tool.getOutputSchema());
    }

    @Test
    void serialized_registration_parses_back_to_an_equal_one() {
        WorkerInstance instance = new WorkerInstance("portfolio-1", "Portfolio", "http://localhost:8003", 120,
                "http://localhost:8003/ready", 20, 90);
        List<ToolDescriptor> tools = List.of(
                Workers.tool("portfolio_optimizer").withWorker("portfolio-1").withTimeoutSeconds(60),
                Workers.tool("backtester").withWorker("portfolio-1").withRetryAttempts(0));

        Registration parsed = codec.parse(codec.toJson(instance, tools));

        assertEquals(new Registration(instance, tools), parsed);
    }

    @Test
    void structural_problems_are_validation_errors() {
        ValidationException missingId = assertThrows(ValidationException.class,
                () -> codec.parse("{\"address\":\"http://localhost:8001\"}"));
        assertEquals("instance_id", missingId.getField());

        ValidationException missingToolId = assertThrows(ValidationException.class,
                () -> codec.parse("{\"instance_id\":\"w\",\"tools\":[{\"name\":\"x\"}]}"));
        assertEquals("tools[0].tool_id", missingToolId.getField());

        ValidationException wrongType = assertThrows(ValidationException.class,
                () -> codec.parse("{\"instance_id\":\"w\",\"weight\":\"heavy\"}"));
        assertEquals("payload", wrongType.getField());

        assertThrows(ValidationException.class, () -> codec.parse("[1,2]"));
        assertThrows(ValidationException.class, () -> codec.parse("{not json"));
    }
}
