package com.nanik.finhub.mcp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.Hub;
import com.nanik.finhub.catalog.ToolDescriptor;
import com.nanik.finhub.config.HubConfig;
import com.nanik.finhub.error.HubException;
import com.nanik.finhub.protocol.McpError;
import com.nanik.finhub.protocol.McpRequest;
import com.nanik.finhub.protocol.McpResponse;
import com.nanik.finhub.router.InvocationResult;
import com.nanik.finhub.tools.ToolDefinition;
import com.nanik.finhub.tools.ToolResult;
import com.nanik.finhub.tools.impl.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MCP server of the hub.
 *
 * Implements the Model Context Protocol over stdio. Handles lifecycle methods
 * (initialize, initialized, shutdown), serves the built-in hub tools and routes
 * every other tool call to a worker through the {@link com.nanik.finhub.router.ExecutionRouter}.
 * Each incoming message is handled on its own request thread.
 */
public class McpServer {

    private static final Logger log = LoggerFactory.getLogger(McpServer.class);

    /** Newest first. */
    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = Arrays.asList("2025-03-26", "2024-11-05");

    private final Hub hub;
    private final StdioTransport transport;
    private final JsonRpcHandler rpcHandler;
    private final ToolRegistry toolRegistry;
    private final Map<String, MethodHandler> methods = new HashMap<>();
    private final AtomicBoolean initializeReceived = new AtomicBoolean();
    private final ExecutorService requestExecutor;

    private volatile boolean initialized = false;
    private volatile boolean running = false;

    /**
     * Handles one JSON-RPC method.
     */
    @FunctionalInterface
    interface MethodHandler {
        McpResponse handle(McpRequest request);
    }

    public McpServer(Hub hub, StdioTransport transport) {
        this.hub = hub;
        this.transport = transport;
        this.rpcHandler = new JsonRpcHandler();
        this.toolRegistry = new ToolRegistry();

        AtomicInteger counter = new AtomicInteger(1);
        this.requestExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mcp-request-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        registerBuiltInTools();
        registerMethods();
    }

    private void registerBuiltInTools() {
        toolRegistry.registerAll(
                new RegisterSpokeTool(hub),
                new UnregisterSpokeTool(hub),
                new ListSpokesTool(hub),
                new HubStatusTool(hub),
                new HubHealthCheckTool(hub),
                new SearchToolsTool(hub),
                new ExecutionHistoryTool(hub),
                new ToolStatsTool(hub));
    }

    private void registerMethods() {
        methods.put("initialize", this::handleInitialize);
        methods.put("notifications/initialized", this::handleInitialized);
        methods.put("ping", request -> McpResponse.success(request.getId(), new JsonObject()));
        methods.put("tools/list", this::handleToolsList);
        methods.put("tools/call", this::handleToolsCall);
        methods.put("notifications/cancelled", this::handleCancelled);
        methods.put("shutdown", this::handleShutdown);
    }

    /**
     * Start the MCP server. Returns when stdin is exhausted or shutdown is requested.
     */
    public void start() {
        log.info("Starting {} v{}", hub.getConfig().getServerName(), hub.getConfig().getServerVersion());
        transport.start();
        running = true;

        // Main message loop
        while (running) {
            try {
                String message = transport.readMessage();
                if (message == null) {
                    break;
                }
                requestExecutor.execute(() -> process(message));
            } catch (InterruptedException e) {
                log.info("Server interrupted");
                Thread.currentThread().interrupt();
                break;
            } catch (RejectedExecutionException e) {
                log.warn("Request dropped, server is stopping");
            }
        }

        running = false;
        transport.stop();
        drainRequests();
        log.info("Server stopped");
    }

    private void process(String message) {
        try {
            McpResponse response = handle(message);
            if (response != null) {
                transport.send(rpcHandler.serialize(response));
            }
        } catch (RuntimeException e) {
            log.error("Error handling message", e);
        }
    }

    private void drainRequests() {
        requestExecutor.shutdown();
        try {
            if (!requestExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Requests still running at shutdown, interrupting");
                requestExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            requestExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handle one raw message.
     *
     * @return the response to write, or null for notifications
     */
    public McpResponse handle(String message) {
        JsonRpcHandler.ParseResult parseResult = rpcHandler.parseRequest(message);

        if (!parseResult.isSuccess()) {
            log.debug("Rejected message: {}", parseResult.getErrorResponse().getError());
            return parseResult.getErrorResponse();
        }

        McpRequest request = parseResult.getRequest();
        String method = request.getMethod();
        log.debug("Received: {}", method);

        McpResponse response;
        MethodHandler handler = methods.get(method);
        if (handler == null) {
            response = McpResponse.error(request.getId(), McpError.methodNotFound(method));
        } else {
            try {
                response = handler.handle(request);
            } catch (HubException e) {
                McpError error = e.toMcpError();
                if (error.isRoutingError()) {
                    log.info("{} for request {} failed: {}", method, request.getIdKey(), e.getMessage());
                } else {
                    log.debug("{} failed: {}", method, e.getMessage());
                }
                response = McpResponse.error(request.getId(), error);
            } catch (RuntimeException e) {
                log.error("Error processing {}", method, e);
                response = McpResponse.error(request.getId(), McpError.internalError(e));
            }
        }

        // Notifications never get a response
        return request.isNotification() ? null : response;
    }

    /**
     * Handle initialize request.
     */
    private McpResponse handleInitialize(McpRequest request) {
        if (!initializeReceived.compareAndSet(false, true)) {
            return McpResponse.error(request.getId(),
                McpError.invalidRequest("Already initialized"));
        }

        String requested = request.getStringParam("protocolVersion");
        String version = SUPPORTED_PROTOCOL_VERSIONS.contains(requested)
                ? requested
                : SUPPORTED_PROTOCOL_VERSIONS.get(0);

        // Build response
        JsonObject result = new JsonObject();
        result.addProperty("protocolVersion", version);

        // Server info
        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", hub.getConfig().getServerName());
        serverInfo.addProperty("version", hub.getConfig().getServerVersion());
        result.add("serverInfo", serverInfo);

        // Capabilities
        JsonObject capabilities = new JsonObject();
        JsonObject tools = new JsonObject();
        tools.addProperty("listChanged", false);
        capabilities.add("tools", tools);
        result.add("capabilities", capabilities);

        log.info("Initialized with protocol version {} (client asked for {})", version, requested);
        return McpResponse.success(request.getId(), result);
    }

    /**
     * Handle initialized notification.
     */
    private McpResponse handleInitialized(McpRequest request) {
        initialized = true;
        log.debug("Client confirmed initialization");
        return McpResponse.success(request.getId(), new JsonObject());
    }

    /**
     * Handle cancellation notification for an in-flight tools/call.
     */
    private McpResponse handleCancelled(McpRequest request) {
        JsonElement requestId = request.getParams().get("requestId");
        if (requestId == null || !requestId.isJsonPrimitive()) {
            log.debug("Cancellation without a requestId ignored");
        } else if (!hub.getRouter().cancel(requestId.getAsString())) {
            log.debug("Nothing in flight for request {}", requestId);
        }
        return McpResponse.success(request.getId(), new JsonObject());
    }

    /**
     * Handle shutdown request.
     */
    private McpResponse handleShutdown(McpRequest request) {
        log.info("Shutdown requested");
        running = false;
        transport.stop();
        return McpResponse.success(request.getId(), new JsonObject());
    }

    /**
     * Handle tools/list request: built-in tools first, then worker tools.
     */
    private McpResponse handleToolsList(McpRequest request) {
        JsonArray toolsArray = new JsonArray();

        for (ToolDefinition def : toolRegistry.getAllDefinitions()) {
            toolsArray.add(def.toJson());
        }
        for (ToolDescriptor descriptor : hub.getCatalog().discoverableTools()) {
            toolsArray.add(ToolDefinition.of(descriptor).toJson());
        }

        JsonObject result = new JsonObject();
        result.add("tools", toolsArray);
        return McpResponse.success(request.getId(), result);
    }

    /**
     * Handle tools/call request.
     */
    private McpResponse handleToolsCall(McpRequest request) {
        String toolName = request.getStringParam("name");

        if (toolName == null || toolName.isEmpty()) {
            return McpResponse.error(request.getId(), McpError.invalidParams("Missing 'name' parameter"));
        }
        JsonElement rawArgs = request.getParams().get("arguments");
        if (rawArgs != null && !rawArgs.isJsonNull() && !rawArgs.isJsonObject()) {
            return McpResponse.error(request.getId(), McpError.invalidParams("'arguments' must be an object"));
        }
        JsonObject toolArgs = request.getObjectParam("arguments");

        if (toolRegistry.hasTool(toolName)) {
            // Create a sub-request with the tool arguments
            ToolResult result = toolRegistry.execute(toolName, request.forTool(toolName, toolArgs));
            return McpResponse.success(request.getId(), result.toJson());
        }

        InvocationResult invocation = hub.getRouter().route(request.getIdKey(), toolName, toolArgs);

        JsonObject resultObj = ToolResult.fromWorker(invocation.getOutput()).toJson();
        JsonObject meta = new JsonObject();
        meta.addProperty("instance_id", invocation.getInstanceId());
        meta.addProperty("invocation_id", invocation.getInvocationId());
        meta.addProperty("attempts", invocation.getAttempts());
        resultObj.add("_meta", meta);
        return McpResponse.success(request.getId(), resultObj);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Main entry point. The optional first argument is the path of a JSON configuration file.
     */
    public static void main(String[] args) {
        HubConfig config;
        try {
            config = HubConfig.load(args.length > 0 ? args[0] : null);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        Hub hub;
        try {
            hub = Hub.create(config);
        } catch (IOException e) {
            log.error("Cannot open ledger file {}: {}", config.getLedgerFile(), e.getMessage());
            System.exit(1);
            return;
        }

        try {
            int workers = hub.registerConfiguredWorkers();
            log.info("{} configured worker(s) registered", workers);
            hub.start();
            new McpServer(hub, new StdioTransport()).start();
        } finally {
            hub.close();
        }
    }
}
