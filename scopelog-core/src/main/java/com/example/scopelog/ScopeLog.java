/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog;

import com.example.scopelog.console.ConsoleSinkLoader;
import com.example.scopelog.message.MessageLog;
import com.example.scopelog.message.MessageSink;
import com.example.scopelog.scope.DiagnosticsLog;
import com.example.scopelog.scope.ScopeTracer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide default instances.
 *
 * <p>Applications that do not wire their own {@link MessageSink} and
 * {@link DiagnosticsLog} use the ones held here. Both are built from
 * {@link ScopeLogConfig#fromSystemProperties()} and the console sinks found by
 * {@link ConsoleSinkLoader} when this class initializes. Files are opened on
 * first use.
 *
 * <pre>
 * try (MessageLog log = ScopeLog.log()) {
 *     log.append("request").append(id).append("done");
 * }
 *
 * try (ScopeTracer scope = ScopeLog.diagnostics().enterHere()) {
 *     ...
 * }
 * </pre>
 *
 * <p>Call {@link #terminate()} during orderly shutdown, or
 * {@link #installShutdownHook()} once at startup.
 */
public final class ScopeLog {

    private static final ScopeLogConfig CONFIG = ScopeLogConfig.fromSystemProperties();
    private static final MessageSink MESSAGES = new MessageSink(CONFIG, ConsoleSinkLoader.load());
    private static final DiagnosticsLog DIAGNOSTICS = new DiagnosticsLog(CONFIG);

    private static final AtomicBoolean SHUTDOWN_HOOK_INSTALLED = new AtomicBoolean();

    private ScopeLog() {
    }

    /**
     * Shared configuration of the default instances. Changes apply on the next
     * sink open or message creation.
     */
    public static ScopeLogConfig config() {
        return CONFIG;
    }

    public static MessageSink messages() {
        return MESSAGES;
    }

    public static DiagnosticsLog diagnostics() {
        return DIAGNOSTICS;
    }

    /**
     * Start a message on the default sink with the configured routing.
     */
    public static MessageLog log() {
        return MESSAGES.log();
    }

    /**
     * Start a message on the default sink, console only.
     */
    public static MessageLog logNoFile() {
        return MESSAGES.log(false, CONFIG.isLogToConsole());
    }

    /**
     * Open a scope on the default diagnostics log for the calling method.
     */
    public static ScopeTracer enterHere() {
        return DIAGNOSTICS.enterHere();
    }

    /**
     * Open a named scope on the default diagnostics log for the calling method.
     */
    public static ScopeTracer enterHere(String name) {
        return DIAGNOSTICS.enterHere(name);
    }

    /**
     * Close both default files. Later writes reopen them.
     */
    public static void terminate() {
        MESSAGES.terminate();
        DIAGNOSTICS.terminate();
    }

    /**
     * Register a shutdown hook that calls {@link #terminate()}. Only the first call registers.
     */
    public static void installShutdownHook() {
        if (!SHUTDOWN_HOOK_INSTALLED.compareAndSet(false, true)) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(ScopeLog::terminate, "ScopeLog-Shutdown"));
    }
}
