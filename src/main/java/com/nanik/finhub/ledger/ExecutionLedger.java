package com.nanik.finhub.ledger;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.finhub.catalog.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Append-only record of invocation attempts.
 *
 * Completing a record feeds the outcome into the catalog's tool statistics.
 * An optional {@link LedgerSink} mirrors every record on a background thread;
 * sink failures are logged and never reach the invocation path.
 *
 * The in-memory index keeps at most {@code maxRecords} entries, dropping the
 * oldest completed ones first.
 */
public class ExecutionLedger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private final Object lock = new Object();
    private final LinkedHashMap<String, ExecutionRecord> records = new LinkedHashMap<>();
    private final CatalogStore catalog;
    private final Clock clock;
    private final int maxRecords;
    private final LedgerSink sink;
    private final ExecutorService sinkWriter;

    public ExecutionLedger(CatalogStore catalog, Clock clock, int maxRecords) {
        this(catalog, clock, maxRecords, null);
    }

    public ExecutionLedger(CatalogStore catalog, Clock clock, int maxRecords, LedgerSink sink) {
        this.catalog = catalog;
        this.clock = clock;
        this.maxRecords = maxRecords;
        this.sink = sink;
        this.sinkWriter = sink == null ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-sink");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create and append a RUNNING record for a new attempt.
     */
    public ExecutionRecord start(String correlationId, int attempt, String toolId,
                                 String instanceId, JsonObject input) {
        ExecutionRecord record = ExecutionRecord.running(UUID.randomUUID().toString(), correlationId,
                attempt, toolId, instanceId, input, clock.instant());
        record(record);
        return record;
    }

    /**
     * Append a RUNNING record.
     *
     * @throws IllegalArgumentException if the record is not RUNNING or its id is already known
     */
    public void record(ExecutionRecord record) {
        if (record.getStatus() != ExecutionStatus.RUNNING) {
            throw new IllegalArgumentException("Only RUNNING records can be appended: " + record);
        }
        synchronized (lock) {
            if (records.containsKey(record.getInvocationId())) {
                throw new IllegalArgumentException("Duplicate invocation id " + record.getInvocationId());
            }
            records.put(record.getInvocationId(), record);
            evictOverflow();
        }
        mirror(record);
    }

    /**
     * Move a RUNNING record to a terminal state.
     *
     * @return false if the record is unknown or already terminal; the call then has no effect
     */
    public boolean complete(String invocationId, ExecutionStatus status, JsonElement output, String error) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        ExecutionRecord completed;
        synchronized (lock) {
            ExecutionRecord current = records.get(invocationId);
            if (current == null || current.getStatus().isTerminal()) {
                return false;
            }
            completed = current.complete(status, output, error, clock.instant());
            records.put(invocationId, completed);
        }

        if (status != ExecutionStatus.CANCELLED) {
            catalog.recordToolOutcome(completed.getInstanceId(), completed.getToolId(),
                    status == ExecutionStatus.SUCCEEDED, completed.getDuration().toMillis());
        }
        mirror(completed);
        return true;
    }

    private void evictOverflow() {
        Iterator<ExecutionRecord> it = records.values().iterator();
        while (records.size() > maxRecords && it.hasNext()) {
            if (it.next().getStatus().isTerminal()) {
                it.remove();
            }
        }
    }

    private void mirror(ExecutionRecord record) {
        if (sink == null) {
            return;
        }
        try {
            sinkWriter.execute(() -> {
                try {
                    sink.append(record);
                } catch (IOException | RuntimeException e) {
                    log.warn("Ledger sink could not persist {}: {}", record.getInvocationId(), e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Ledger sink closed, {} not persisted", record.getInvocationId());
        }
    }

    public Optional<ExecutionRecord> find(String invocationId) {
        synchronized (lock) {
            return Optional.ofNullable(records.get(invocationId));
        }
    }

    /**
     * All attempts made for one gateway request, in order.
     */
    public List<ExecutionRecord> findByCorrelation(String correlationId) {
        List<ExecutionRecord> result = new ArrayList<>();
        synchronized (lock) {
            for (ExecutionRecord record : records.values()) {
                if (Objects.equals(correlationId, record.getCorrelationId())) {
                    result.add(record);
                }
            }
        }
        return result;
    }

    /**
     * Records started within [from, to).
     */
    public List<ExecutionRecord> findBetween(Instant from, Instant to) {
        List<ExecutionRecord> result = new ArrayList<>();
        synchronized (lock) {
            for (ExecutionRecord record : records.values()) {
                Instant started = record.getStartedAt();
                if (!started.isBefore(from) && started.isBefore(to)) {
                    result.add(record);
                }
            }
        }
        return result;
    }

    /**
     * The most recent records, newest first.
     */
    public List<ExecutionRecord> recent(int limit) {
        List<ExecutionRecord> all;
        synchronized (lock) {
            all = new ArrayList<>(records.values());
        }
        Collections.reverse(all);
        return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
    }

    /**
     * Number of indexed records per status.
     */
    public Map<ExecutionStatus, Integer> summary() {
        Map<ExecutionStatus, Integer> counts = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            counts.put(status, 0);
        }
        synchronized (lock) {
            for (ExecutionRecord record : records.values()) {
                counts.merge(record.getStatus(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    /**
     * Flush pending sink writes and close the sink.
     */
    @Override
    public void close() {
        if (sink == null) {
            return;
        }
        sinkWriter.shutdown();
        try {
            if (!sinkWriter.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Ledger sink did not drain within 5s");
            }
            sink.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.warn("Closing ledger sink failed: {}", e.toString());
        }
    }
}
