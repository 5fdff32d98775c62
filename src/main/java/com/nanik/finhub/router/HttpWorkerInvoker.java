package com.nanik.finhub.router;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.error.InvocationFailedException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Calls a worker's MCP endpoint over HTTP with a JSON-RPC 2.0 {@code tools/call} request.
 *
 * Request:  POST {address}{path}  {"jsonrpc":"2.0","id":"...","method":"tools/call",
 *                                  "params":{"name":"...","arguments":{...}}}
 * A JSON-RPC error, a result flagged {@code isError} or a non-2xx status is
 * reported as {@link InvocationFailedException}.
 */
public class HttpWorkerInvoker implements WorkerInvoker {

    private final HttpClient client;
    private final String path;
    private final Gson gson = new Gson();

    public HttpWorkerInvoker(String path) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), path);
    }

    public HttpWorkerInvoker(HttpClient client, String path) {
        this.client = client;
        this.path = path.startsWith("/") ? path : "/" + path;
    }

    @Override
    public JsonElement invoke(WorkerInstance instance, String toolId, JsonObject arguments, Duration timeout)
            throws Exception {
        JsonObject params = new JsonObject();
        params.addProperty("name", toolId);
        params.add("arguments", arguments);

        JsonObject body = new JsonObject();
        body.addProperty("jsonrpc", "2.0");
        body.addProperty("id", UUID.randomUUID().toString());
        body.addProperty("method", "tools/call");
        body.add("params", params);

        HttpRequest request = HttpRequest.newBuilder(endpoint(instance))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(body), StandardCharsets.UTF_8))
                .build();

        CompletableFuture<HttpResponse<String>> pending =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            response = pending.get();
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new InvocationFailedException("Worker " + instance.getId() + " unreachable: " + cause, cause);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new InvocationFailedException("Worker " + instance.getId() + " answered HTTP " + response.statusCode());
        }
        return unwrap(instance, response.body());
    }

    private URI endpoint(WorkerInstance instance) {
        String address = instance.getAddress();
        if (address.endsWith("/")) {
            address = address.substring(0, address.length() - 1);
        }
        return URI.create(address + path);
    }

    private JsonElement unwrap(WorkerInstance instance, String body) {
        JsonObject reply;
        try {
            reply = gson.fromJson(body, JsonObject.class);
        } catch (JsonParseException e) {
            throw new InvocationFailedException("Worker " + instance.getId() + " sent invalid JSON: " + e.getMessage(), e);
        }
        if (reply == null) {
            throw new InvocationFailedException("Worker " + instance.getId() + " sent an empty reply");
        }
        if (reply.has("error") && reply.get("error").isJsonObject()) {
            JsonObject error = reply.getAsJsonObject("error");
            String message = error.has("message") ? error.get("message").getAsString() : "unknown error";
            throw new InvocationFailedException("Worker " + instance.getId() + " error: " + message);
        }
        JsonElement result = reply.get("result");
        if (result == null) {
            throw new InvocationFailedException("Worker " + instance.getId() + " reply has no result");
        }
        if (result.isJsonObject() && result.getAsJsonObject().has("isError")
                && result.getAsJsonObject().get("isError").getAsBoolean()) {
            throw new InvocationFailedException("Worker " + instance.getId() + " tool error: " + result);
        }
        return result;
    }
}
