/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.scope;

import com.example.scopelog.ScopeLogConfig;
import com.example.scopelog.format.LogTimestamps;
import com.example.scopelog.sink.RotatingFileSink;

import java.io.Closeable;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Diagnostics file recording scope entry and exit events, with detection of a
 * previous run that died inside an open scope.
 *
 * <p><b>Event format:</b> {@code [yyyy-MM-dd HH:mm:ss] <label>:<phase> <sourceFile> |<depth>}
 * where phase is {@code start...}, {@code end!} or free text from
 * {@link ScopeTracer#mark(String)}, and depth is the number of open scopes
 * across all threads after the event.
 *
 * <p><b>Crash detection:</b> The first time the file is opened, before anything
 * is written, the last non-empty line of the existing file is inspected. If its
 * trailing {@code |<depth>} is positive, the previous run exited with scopes
 * still open and {@value #CRASH_SENTINEL} is written ahead of this run's events.
 * The check runs once per instance; it is advisory and never throws.
 *
 * <p><b>Depth consistency:</b> The counter update and the event write happen in
 * one critical section on the file sink, so depths in the file follow line
 * order even with many threads.
 *
 * <p><b>Thread Safety:</b> All methods are thread-safe.
 */
public class DiagnosticsLog implements Closeable {

    public static final String CRASH_SENTINEL = "## CRASH POINT ##";

    private final ScopeLogConfig config;
    private final Clock clock;
    private final RotatingFileSink fileSink = new RotatingFileSink();
    private final AtomicInteger liveDepth = new AtomicInteger();
    private final AtomicLong underflows = new AtomicLong();

    // Guarded by fileSink
    private boolean crashChecked;
    private boolean crashedLastRun;

    public DiagnosticsLog(ScopeLogConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public DiagnosticsLog(ScopeLogConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Open a scope labelled {@code function}.
     *
     * @param function function or region name
     * @param sourceFile source file printed with every event of the scope
     * @param line line number, kept on the tracer but not printed
     */
    public ScopeTracer enter(String function, String sourceFile, int line) {
        return enter(function, null, sourceFile, line);
    }

    /**
     * Open a scope labelled {@code function:name}, or {@code function} when
     * {@code name} is null or empty.
     */
    public ScopeTracer enter(String function, String name, String sourceFile, int line) {
        if (function == null) {
            throw new IllegalArgumentException("Function name cannot be null");
        }
        ScopeTracer scope = new ScopeTracer(this, ScopeTracer.label(function, name),
            sourceFile != null ? sourceFile : CallSite.UNKNOWN_FILE, line);
        recordStart(scope);
        return scope;
    }

    /**
     * Open a scope for the calling method, taking its name, source file and
     * line from the stack.
     */
    public ScopeTracer enterHere() {
        return enterHere(null);
    }

    /**
     * Open a scope for the calling method with a custom name appended to the label.
     */
    public ScopeTracer enterHere(String name) {
        CallSite site = CallSite.capture();
        return enter(site.method, name, site.file, site.line);
    }

    /**
     * Open the diagnostics file now instead of on the first event.
     * Runs crash detection if it has not run yet.
     *
     * @return true if the file is open
     */
    public boolean open() {
        synchronized (fileSink) {
            return ensureOpen();
        }
    }

    /**
     * Whether the previous run left scopes open. Opens the file (and runs the
     * check) if that has not happened yet.
     */
    public boolean isCrashedLastRun() {
        synchronized (fileSink) {
            ensureOpen();
            return crashedLastRun;
        }
    }

    void recordStart(ScopeTracer scope) {
        synchronized (fileSink) {
            ensureOpen();
            int depth = liveDepth.incrementAndGet();
            writeEvent(scope, ScopeTracer.START_PHASE, depth);
        }
    }

    void recordEnd(ScopeTracer scope) {
        synchronized (fileSink) {
            ensureOpen();
            int depth = decrementDepth();
            writeEvent(scope, ScopeTracer.END_PHASE, depth);
        }
    }

    void recordMark(ScopeTracer scope, String message) {
        synchronized (fileSink) {
            ensureOpen();
            writeEvent(scope, message, liveDepth.get());
        }
    }

    // Clamped at zero: an end without a start is a caller bug, not a reason to write negative depths
    private int decrementDepth() {
        int previous = liveDepth.getAndUpdate(depth -> depth > 0 ? depth - 1 : 0);
        if (previous > 0) {
            return previous - 1;
        }
        if (underflows.getAndIncrement() == 0) {
            System.err.println("[DiagnosticsLog] Scope closed while no scope was open; depth kept at 0");
        }
        return 0;
    }

    private boolean ensureOpen() {
        if (fileSink.isOpen()) {
            return true;
        }
        Path path = config.getDiagnosticsFile();

        boolean firstOpen = !crashChecked;
        if (firstOpen) {
            // Must read the old tail before rotation moves it away
            crashChecked = true;
            crashedLastRun = CrashDetector.previousRunCrashed(path);
        }

        boolean opened = fileSink.ensureOpen(path, config.getDiagnosticsMaxBytes());
        if (opened && firstOpen && crashedLastRun) {
            fileSink.writeLine(CRASH_SENTINEL);
        }
        return opened;
    }

    private void writeEvent(ScopeTracer scope, String phase, int depth) {
        fileSink.writeLine(formatEvent(LogTimestamps.now(clock), scope.getLabel(), phase,
            scope.getSourceFile(), depth));
    }

    /**
     * Format one event line.
     */
    public static String formatEvent(String timestamp, String label, String phase, String sourceFile, int depth) {
        return "[" + timestamp + "] " + label + ":" + phase + " " + sourceFile + " |" + depth;
    }

    /**
     * @return number of scopes currently open across all threads
     */
    public int getLiveDepth() {
        return liveDepth.get();
    }

    /**
     * @return number of scope ends seen while no scope was open
     */
    public long getUnderflowCount() {
        return underflows.get();
    }

    public RotatingFileSink getFileSink() {
        return fileSink;
    }

    public ScopeLogConfig getConfig() {
        return config;
    }

    /**
     * Close the diagnostics file. The next event reopens it; crash detection
     * does not run again.
     */
    public void terminate() {
        fileSink.terminate();
    }

    @Override
    public void close() {
        terminate();
    }
}
