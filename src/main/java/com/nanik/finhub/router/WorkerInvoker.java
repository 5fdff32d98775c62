package com.nanik.finhub.router;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.WorkerInstance;

import java.time.Duration;

/**
 * Transport used to run a tool on a worker instance.
 *
 * Implementations block the calling thread until the worker answers. The
 * router enforces the timeout independently and interrupts the call when it
 * gives up, so implementations should respond to interruption.
 */
public interface WorkerInvoker {

    /**
     * Invoke a tool on the instance.
     *
     * @param instance  target worker
     * @param toolId    tool to run
     * @param arguments tool arguments, never null
     * @param timeout   the tool's timeout budget
     * @return the worker's result payload
     * @throws com.nanik.finhub.error.InvocationFailedException when the worker reports an error
     * @throws Exception when the worker cannot be reached
     */
    JsonElement invoke(WorkerInstance instance, String toolId, JsonObject arguments, Duration timeout)
            throws Exception;
}
