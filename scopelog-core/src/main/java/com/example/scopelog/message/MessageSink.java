/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.message;

import com.example.scopelog.ScopeLogConfig;
import com.example.scopelog.api.console.ConsoleSink;
import com.example.scopelog.format.LogTimestamps;
import com.example.scopelog.format.ThreadTag;
import com.example.scopelog.sink.RotatingFileSink;

import java.io.Closeable;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Destination of committed {@link MessageLog} lines.
 *
 * <p>File lines look like {@code [2025-01-31 12:00:00] tid=8134650221953429121 "message"}.
 * Console sinks get the bare message. Both writes of one commit happen while
 * the file sink's monitor is held, so lines from different threads never
 * interleave within a destination.
 *
 * <p>One instance per process is expected (see {@link com.example.scopelog.ScopeLog});
 * tests and embedders may create their own against separate files.
 *
 * <p><b>Thread Safety:</b> All methods are thread-safe.
 */
public class MessageSink implements Closeable {

    private final ScopeLogConfig config;
    private final Clock clock;
    private final RotatingFileSink fileSink = new RotatingFileSink();
    private final List<ConsoleSink> consoleSinks;

    public MessageSink(ScopeLogConfig config, List<ConsoleSink> consoleSinks) {
        this(config, consoleSinks, Clock.systemDefaultZone());
    }

    public MessageSink(ScopeLogConfig config, List<ConsoleSink> consoleSinks, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.consoleSinks = new CopyOnWriteArrayList<ConsoleSink>(consoleSinks);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Start a message routed by the configured default flags.
     */
    public MessageLog log() {
        return new MessageLog(this, config.isLogToFile(), config.isLogToConsole());
    }

    /**
     * Start a message with explicit routing.
     */
    public MessageLog log(boolean toFile, boolean toConsole) {
        return new MessageLog(this, toFile, toConsole);
    }

    /**
     * Log the given fields as one line with the default routing.
     */
    public void log(Object... fields) {
        try (MessageLog message = log()) {
            message.appendAll(fields);
        }
    }

    void commit(String message, boolean toFile, boolean toConsole) {
        if (!toFile && !toConsole) {
            return;
        }
        String line = formatLine(LogTimestamps.now(clock), ThreadTag.current(), message);

        synchronized (fileSink) {
            if (toFile) {
                // A failed open leaves the sink closed and the write is counted as dropped
                fileSink.ensureOpen(config.getOutputFile(), config.getOutputMaxBytes());
                fileSink.writeLine(line);
            }
            if (toConsole) {
                writeToConsole(message);
            }
        }
    }

    private void writeToConsole(String message) {
        for (ConsoleSink sink : consoleSinks) {
            try {
                sink.println(message);
            } catch (RuntimeException e) {
                System.err.println("[MessageSink] Console sink failed: " + sink.getName() + ": " + e);
            }
        }
    }

    /**
     * Format a committed message as a file line.
     */
    public static String formatLine(String timestamp, String threadTag, String message) {
        return "[" + timestamp + "] tid=" + threadTag + " \"" + message + "\"";
    }

    public void addConsoleSink(ConsoleSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("Console sink cannot be null");
        }
        consoleSinks.add(sink);
    }

    public void removeConsoleSink(ConsoleSink sink) {
        consoleSinks.remove(sink);
    }

    public List<ConsoleSink> getConsoleSinks() {
        return Collections.unmodifiableList(consoleSinks);
    }

    public RotatingFileSink getFileSink() {
        return fileSink;
    }

    public ScopeLogConfig getConfig() {
        return config;
    }

    /**
     * Close the message file. The next file commit reopens it.
     */
    public void terminate() {
        fileSink.terminate();
    }

    @Override
    public void close() {
        terminate();
    }
}
