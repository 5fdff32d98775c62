package com.nanik.finhub.router;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.CatalogStore;
import com.nanik.finhub.catalog.ToolDescriptor;
import com.nanik.finhub.catalog.WorkerInstance;
import com.nanik.finhub.error.*;
import com.nanik.finhub.ledger.ExecutionLedger;
import com.nanik.finhub.ledger.ExecutionRecord;
import com.nanik.finhub.ledger.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes a tool call to one healthy worker instance.
 *
 * For each attempt: discover candidates (minus instances that already failed
 * this request), rank them with the load policy, take the first one whose
 * circuit breaker grants a permit, dispatch with the tool's timeout, record the
 * outcome. Failures and timeouts are retried on another instance while the
 * tool's retry budget lasts. The number of requests in flight across the hub is
 * bounded; requests over the bound fail fast.
 */
public class ExecutionRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    private final CatalogStore catalog;
    private final BreakerRegistry breakers;
    private final LoadBalancingPolicy policy;
    private final WorkerInvoker invoker;
    private final ExecutionLedger ledger;
    private final int maxConcurrent;
    private final Semaphore permits;
    private final ExecutorService invocationExecutor;
    private final Map<String, Future<JsonElement>> inFlight = new ConcurrentHashMap<>();

    public ExecutionRouter(CatalogStore catalog, BreakerRegistry breakers, LoadBalancingPolicy policy,
                           WorkerInvoker invoker, ExecutionLedger ledger, int maxConcurrent) {
        this.catalog = catalog;
        this.breakers = breakers;
        this.policy = policy;
        this.invoker = invoker;
        this.ledger = ledger;
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent);
        AtomicInteger counter = new AtomicInteger(1);
        this.invocationExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-invoker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Route one tool call.
     *
     * @param correlationId id of the client request, used for cancellation and the audit trail;
     *                      a random id is used when null
     * @param toolName      tool to run
     * @param arguments     tool arguments, may be null
     * @return the result of the first successful attempt
     * @throws HubException typed failure; never a raw transport exception
     */
    public InvocationResult route(String correlationId, String toolName, JsonObject arguments) {
        if (toolName == null || toolName.trim().isEmpty()) {
            throw new ValidationException("name", "tool name is required");
        }
        String requestId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        JsonObject args = arguments != null ? arguments : new JsonObject();

        if (!permits.tryAcquire()) {
            log.warn("Rejected {} for tool {}: {} executions already running", requestId, toolName, maxConcurrent);
            throw new BackpressureException(maxConcurrent);
        }
        try {
            return routeWithRetries(requestId, toolName, args);
        } finally {
            permits.release();
        }
    }

    private InvocationResult routeWithRetries(String requestId, String toolName, JsonObject args) {
        Set<String> excluded = new HashSet<>();
        HubException lastFailure = null;
        int retryBudget = -1;
        int attempt = 0;

        while (true) {
            List<WorkerInstance> candidates = catalog.discover(toolName, excluded);
            if (candidates.isEmpty()) {
                if (lastFailure != null) {
                    log.warn("No other instance left for {} after {} attempt(s)", toolName, attempt);
                    throw lastFailure;
                }
                throw new ToolUnavailableException(toolName);
            }

            WorkerInstance chosen = null;
            InstanceBreaker.Permit permit = null;
            for (WorkerInstance candidate : policy.rank(candidates)) {
                permit = breakers.forInstance(candidate.getId()).tryAcquire();
                if (permit != null) {
                    chosen = candidate;
                    break;
                }
            }
            if (chosen == null) {
                if (lastFailure != null) {
                    throw lastFailure;
                }
                throw new CircuitOpenException("Circuit open for all " + candidates.size()
                        + " instance(s) offering " + toolName);
            }

            Optional<ToolDescriptor> tool = catalog.findTool(chosen.getId(), toolName);
            if (!tool.isPresent()) {
                // Deregistered between discovery and selection
                permit.release();
                excluded.add(chosen.getId());
                continue;
            }
            if (retryBudget < 0) {
                retryBudget = tool.get().getRetryAttempts();
            }

            attempt++;
            try {
                AttemptOutcome outcome = attempt(requestId, attempt, chosen, tool.get(), args, permit);
                return new InvocationResult(outcome.output, chosen.getId(), outcome.invocationId, attempt);
            } catch (HubException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastFailure = e;
                excluded.add(chosen.getId());
                if (attempt > retryBudget) {
                    log.warn("Tool {} failed after {} attempt(s): {}", toolName, attempt, e.getMessage());
                    throw e;
                }
                log.info("Attempt {} of {} on {} failed ({}), retrying elsewhere",
                        attempt, toolName, chosen.getId(), e.getMessage());
            }
        }
    }

    private AttemptOutcome attempt(String requestId, int attempt, WorkerInstance instance, ToolDescriptor tool,
                                   JsonObject args, InstanceBreaker.Permit permit) {
        String instanceId = instance.getId();
        Duration timeout = tool.getTimeout();

        catalog.acquireLoad(instanceId);
        ExecutionRecord record = ledger.start(requestId, attempt, tool.getToolId(), instanceId, args);
        Future<JsonElement> call;
        try {
            call = invocationExecutor.submit(() -> invoker.invoke(instance, tool.getToolId(), args, timeout));
        } catch (RejectedExecutionException e) {
            catalog.releaseLoad(instanceId);
            permit.release();
            ledger.complete(record.getInvocationId(), ExecutionStatus.CANCELLED, null, "router closed");
            throw new InvocationCancelledException("Router is shutting down");
        }
        inFlight.put(requestId, call);
        long startNanos = System.nanoTime();

        try {
            JsonElement output = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            catalog.releaseLoad(instanceId);
            ledger.complete(record.getInvocationId(), ExecutionStatus.SUCCEEDED, output, null);
            permit.succeeded(elapsedSince(startNanos));
            catalog.recordInvocationSuccess(instanceId);
            return new AttemptOutcome(output, record.getInvocationId());
        } catch (TimeoutException e) {
            call.cancel(true);
            catalog.releaseLoad(instanceId);
            InvocationTimeoutException failure = new InvocationTimeoutException(tool.getToolId(), instanceId, timeout);
            ledger.complete(record.getInvocationId(), ExecutionStatus.TIMED_OUT, null, failure.getMessage());
            permit.failed(elapsedSince(startNanos), failure);
            throw failure;
        } catch (CancellationException e) {
            catalog.releaseLoad(instanceId);
            ledger.complete(record.getInvocationId(), ExecutionStatus.CANCELLED, null, "cancelled by client");
            permit.release();
            throw new InvocationCancelledException("Request " + requestId + " was cancelled");
        } catch (ExecutionException e) {
            catalog.releaseLoad(instanceId);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            InvocationFailedException failure = cause instanceof InvocationFailedException
                    ? (InvocationFailedException) cause
                    : new InvocationFailedException("Tool " + tool.getToolId() + " on " + instanceId
                            + " failed: " + cause, cause);
            ledger.complete(record.getInvocationId(), ExecutionStatus.FAILED, null, failure.getMessage());
            permit.failed(elapsedSince(startNanos), failure);
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            catalog.releaseLoad(instanceId);
            ledger.complete(record.getInvocationId(), ExecutionStatus.CANCELLED, null, "interrupted");
            permit.release();
            throw new InvocationCancelledException("Request " + requestId + " was interrupted");
        } finally {
            inFlight.remove(requestId, call);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Cancel the in-flight attempt of a request. The caller of {@link #route}
     * receives {@link InvocationCancelledException}.
     *
     * @return true if an attempt was in flight
     */
    public boolean cancel(String correlationId) {
        Future<JsonElement> call = inFlight.get(correlationId);
        if (call == null) {
            return false;
        }
        log.info("Cancelling request {}", correlationId);
        return call.cancel(true);
    }

    /**
     * Requests currently holding an execution permit.
     */
    public int getRunningCount() {
        return maxConcurrent - permits.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public LoadBalancingPolicy getPolicy() {
        return policy;
    }

    public BreakerRegistry getBreakers() {
        return breakers;
    }

    @Override
    public void close() {
        invocationExecutor.shutdownNow();
    }

    private static final class AttemptOutcome {
        final JsonElement output;
        final String invocationId;

        AttemptOutcome(JsonElement output, String invocationId) {
            this.output = output;
            this.invocationId = invocationId;
        }
    }
}
