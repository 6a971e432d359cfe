/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.api.console;

/**
 * Console backend for committed log messages.
 *
 * <p>A console sink receives the bare message text, without the timestamp and
 * thread tag that the file sink adds. Standard output is the built-in backend;
 * additional sinks mirror the same text to other channels (an IDE console, a
 * debugger output window, a UI log viewer).
 *
 * <p><b>Thread Safety:</b> {@link #println(String)} is always called while the
 * message sink's lock is held, so calls never overlap. Sinks should still
 * return quickly because every logging thread waits on that lock.
 *
 * <p><b>Registration:</b> Register via:
 * <ul>
 *   <li>Programmatic: {@code messageSink.addConsoleSink(sink)}</li>
 *   <li>System property: {@code -Dscopelog.console.sinks=com.example.MySink}</li>
 *   <li>ServiceLoader: {@code META-INF/services/com.example.scopelog.api.console.ConsoleSink}</li>
 * </ul>
 *
 * <p><b>Example Implementation:</b>
 * <pre>
 * public class StderrConsoleSink implements ConsoleSink {
 *     public void println(String message) {
 *         System.err.println(message);
 *     }
 *
 *     public String getName() { return "stderr"; }
 * }
 * </pre>
 */
public interface ConsoleSink {

    /**
     * Write one committed message.
     * Exceptions are caught and reported by the caller; they never reach the
     * code that logged the message.
     *
     * @param message the message body, never null
     */
    void println(String message);

    /**
     * Get sink name for error reports.
     * @return Sink name (e.g., "stdout", "debugger")
     */
    String getName();
}
