package com.nanik.finhub.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Transport layer for MCP using stdin/stdout.
 *
 * Reads JSON-RPC messages from stdin (one per line).
 * Writes JSON-RPC responses to stdout (one per line); writes from concurrent
 * request threads are serialized. Logging goes to stderr through SLF4J.
 */
public class StdioTransport {

    private static final Logger log = LoggerFactory.getLogger(StdioTransport.class);

    private final BufferedReader reader;
    private final PrintWriter writer;
    private final BlockingQueue<String> messageQueue;
    private volatile boolean running;
    private volatile boolean inputClosed;
    private Thread readerThread;

    public StdioTransport() {
        this(System.in, System.out);
    }

    public StdioTransport(InputStream in, OutputStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true);
        this.messageQueue = new LinkedBlockingQueue<>();
        this.running = false;
    }

    /**
     * Start the transport (begin reading from stdin in background).
     */
    public void start() {
        running = true;
        readerThread = new Thread(this::readLoop, "StdioTransport-Reader");
        readerThread.setDaemon(true);
        readerThread.start();
        log.debug("Transport started");
    }

    /**
     * Stop the transport. Pending {@link #readMessage()} calls return null.
     */
    public void stop() {
        running = false;
        if (readerThread != null) {
            readerThread.interrupt();
        }
        log.debug("Transport stopped");
    }

    /**
     * Background loop to read messages from stdin.
     */
    private void readLoop() {
        try {
            String line;
            while (running && (line = reader.readLine()) != null) {
                if (!line.trim().isEmpty()) {
                    messageQueue.offer(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.error("Error reading from stdin: {}", e.getMessage());
            }
        } finally {
            inputClosed = true;
        }
        log.debug("Reader loop ended");
    }

    /**
     * Read the next message.
     * Blocks until a message is available; returns null once the input is
     * exhausted or the transport is stopped.
     */
    public String readMessage() throws InterruptedException {
        while (true) {
            String message = messageQueue.poll(100, TimeUnit.MILLISECONDS);
            if (message != null) {
                return message;
            }
            if (inputClosed || !running) {
                return messageQueue.poll();
            }
        }
    }

    /**
     * Write one line of JSON to stdout.
     */
    public synchronized void send(String json) {
        writer.println(json);
        writer.flush();
    }

    public boolean isRunning() {
        return running;
    }
}
