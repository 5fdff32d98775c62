package com.nanik.finhub.testing;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.error.InvocationFailedException;
import com.nanik.finhub.router.WorkerInvoker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable worker transport. Unscripted instances echo the instance and tool id.
 */
public class FakeWorkerInvoker implements WorkerInvoker {

    @FunctionalInterface
    public interface Behavior {
        JsonElement respond(WorkerInstance instance, String toolId, JsonObject arguments) throws Exception;
    }

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    public FakeWorkerInvoker on(String instanceId, Behavior behavior) {
        behaviors.put(instanceId, behavior);
        return this;
    }

    public FakeWorkerInvoker failing(String instanceId) {
        return on(instanceId, (instance, toolId, args) -> {
            throw new InvocationFailedException("worker " + instance.getId() + " is down");
        });
    }

    @Override
    public JsonElement invoke(WorkerInstance instance, String toolId, JsonObject arguments, Duration timeout)
            throws Exception {
        calls.add(instance.getId());
        Behavior behavior = behaviors.get(instance.getId());
        if (behavior != null) {
            return behavior.respond(instance, toolId, arguments);
        }
        return echo(instance.getId(), toolId);
    }

    public static JsonObject echo(String instanceId, String toolId) {
        JsonObject reply = new JsonObject();
        reply.addProperty("instance", instanceId);
        reply.addProperty("tool", toolId);
        return reply;
    }

    /** Instance ids in call order. */
    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    public long callsTo(String instanceId) {
        return calls.stream().filter(instanceId::equals).count();
    }
}
