/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.scope;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open scope in the diagnostics log.
 *
 * <p>Created by {@link DiagnosticsLog#enter}, which has already written the
 * {@code start...} event. {@link #close()} writes the matching {@code end!}
 * event; use try-with-resources so it runs on every exit path:
 * <pre>
 * try (ScopeTracer scope = diagnostics.enter("load", "Loader.java", 42)) {
 *     scope.mark("header parsed");
 *     ...
 * }
 * </pre>
 */
public class ScopeTracer implements AutoCloseable {

    static final String START_PHASE = "start...";
    static final String END_PHASE = "end!";

    private final DiagnosticsLog log;
    private final String label;
    private final String sourceFile;
    private final int line;
    private final AtomicBoolean closed = new AtomicBoolean();

    ScopeTracer(DiagnosticsLog log, String label, String sourceFile, int line) {
        this.log = log;
        this.label = label;
        this.sourceFile = sourceFile;
        this.line = line;
    }

    /**
     * Write an intermediate event with free text in place of the phase,
     * carrying the current depth unchanged.
     */
    public void mark(String message) {
        log.recordMark(this, String.valueOf(message));
    }

    /**
     * Write the end event. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.recordEnd(this);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return {@code function} or {@code function:name}
     */
    public String getLabel() {
        return label;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    /**
     * Line the scope was opened at. Kept for callers; not part of the event text.
     */
    public int getLine() {
        return line;
    }

    static String label(String function, String name) {
        if (name == null || name.isEmpty()) {
            return function;
        }
        return function + ":" + name;
    }

    @Override
    public String toString() {
        return "ScopeTracer{" + label + " " + sourceFile + ":" + line + (isClosed() ? ", closed" : "") + "}";
    }
}
