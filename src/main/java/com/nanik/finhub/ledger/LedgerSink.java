package com.nanik.finhub.ledger;

import java.io.IOException;

/**
 * Optional durable mirror of the ledger. Receives every record version
 * (RUNNING, then terminal) in order, from a single writer thread.
 */
public interface LedgerSink {

    void append(ExecutionRecord record) throws IOException;

    default void close() throws IOException {
    }
}
