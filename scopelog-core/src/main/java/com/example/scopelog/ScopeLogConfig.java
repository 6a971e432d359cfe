/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Runtime configuration shared by the message sink and the diagnostics log.
 *
 * <p>Paths and thresholds are read when a sink opens, so a change takes effect
 * the next time the sink is (re)opened. The default flags are read when a
 * {@link com.example.scopelog.message.MessageLog} is created.
 *
 * <p>Defaults can be overridden with system properties:
 * <pre>
 * -Dscopelog.output.file=output.log
 * -Dscopelog.output.maxBytes=5242880
 * -Dscopelog.diagnostics.file=diagnostics.log
 * -Dscopelog.diagnostics.maxBytes=2097152
 * -Dscopelog.toFile=true
 * -Dscopelog.toConsole=true
 * </pre>
 *
 * <p><b>Thread Safety:</b> All fields are volatile; setters may be called from
 * any thread at any time.
 */
public class ScopeLogConfig {

    public static final String DEFAULT_OUTPUT_FILE = "output.log";
    public static final String DEFAULT_DIAGNOSTICS_FILE = "diagnostics.log";
    public static final long DEFAULT_OUTPUT_MAX_BYTES = 5L * 1024 * 1024;
    public static final long DEFAULT_DIAGNOSTICS_MAX_BYTES = 2L * 1024 * 1024;

    static final String PROP_OUTPUT_FILE = "scopelog.output.file";
    static final String PROP_OUTPUT_MAX_BYTES = "scopelog.output.maxBytes";
    static final String PROP_DIAGNOSTICS_FILE = "scopelog.diagnostics.file";
    static final String PROP_DIAGNOSTICS_MAX_BYTES = "scopelog.diagnostics.maxBytes";
    static final String PROP_TO_FILE = "scopelog.toFile";
    static final String PROP_TO_CONSOLE = "scopelog.toConsole";

    private volatile Path outputFile = Paths.get(DEFAULT_OUTPUT_FILE);
    private volatile long outputMaxBytes = DEFAULT_OUTPUT_MAX_BYTES;
    private volatile Path diagnosticsFile = Paths.get(DEFAULT_DIAGNOSTICS_FILE);
    private volatile long diagnosticsMaxBytes = DEFAULT_DIAGNOSTICS_MAX_BYTES;
    private volatile boolean logToFile = true;
    private volatile boolean logToConsole = true;

    /**
     * Create a configuration holding the built-in defaults.
     * System properties are not consulted; see {@link #fromSystemProperties()}.
     */
    public ScopeLogConfig() {
    }

    /**
     * Create a configuration from the {@code scopelog.*} system properties,
     * falling back to the defaults for anything unset.
     */
    public static ScopeLogConfig fromSystemProperties() {
        ScopeLogConfig config = new ScopeLogConfig();
        config.setOutputFile(System.getProperty(PROP_OUTPUT_FILE, DEFAULT_OUTPUT_FILE));
        config.setOutputMaxBytes(Long.getLong(PROP_OUTPUT_MAX_BYTES, DEFAULT_OUTPUT_MAX_BYTES));
        config.setDiagnosticsFile(System.getProperty(PROP_DIAGNOSTICS_FILE, DEFAULT_DIAGNOSTICS_FILE));
        config.setDiagnosticsMaxBytes(Long.getLong(PROP_DIAGNOSTICS_MAX_BYTES, DEFAULT_DIAGNOSTICS_MAX_BYTES));
        config.setLogToFile(booleanProperty(PROP_TO_FILE, true));
        config.setLogToConsole(booleanProperty(PROP_TO_CONSOLE, true));
        return config;
    }

    private static boolean booleanProperty(String name, boolean defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public ScopeLogConfig setOutputFile(String path) {
        return setOutputFile(Paths.get(Objects.requireNonNull(path, "path")));
    }

    public ScopeLogConfig setOutputFile(Path path) {
        this.outputFile = Objects.requireNonNull(path, "path");
        return this;
    }

    public long getOutputMaxBytes() {
        return outputMaxBytes;
    }

    public ScopeLogConfig setOutputMaxBytes(long maxBytes) {
        this.outputMaxBytes = requireNonNegative(maxBytes);
        return this;
    }

    public Path getDiagnosticsFile() {
        return diagnosticsFile;
    }

    public ScopeLogConfig setDiagnosticsFile(String path) {
        return setDiagnosticsFile(Paths.get(Objects.requireNonNull(path, "path")));
    }

    public ScopeLogConfig setDiagnosticsFile(Path path) {
        this.diagnosticsFile = Objects.requireNonNull(path, "path");
        return this;
    }

    public long getDiagnosticsMaxBytes() {
        return diagnosticsMaxBytes;
    }

    public ScopeLogConfig setDiagnosticsMaxBytes(long maxBytes) {
        this.diagnosticsMaxBytes = requireNonNegative(maxBytes);
        return this;
    }

    /**
     * Default file routing for newly created message logs.
     */
    public boolean isLogToFile() {
        return logToFile;
    }

    public ScopeLogConfig setLogToFile(boolean logToFile) {
        this.logToFile = logToFile;
        return this;
    }

    /**
     * Default console routing for newly created message logs.
     */
    public boolean isLogToConsole() {
        return logToConsole;
    }

    public ScopeLogConfig setLogToConsole(boolean logToConsole) {
        this.logToConsole = logToConsole;
        return this;
    }

    private static long requireNonNegative(long maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must be >= 0: " + maxBytes);
        }
        return maxBytes;
    }

    @Override
    public String toString() {
        return "ScopeLogConfig{outputFile=" + outputFile +
               ", outputMaxBytes=" + outputMaxBytes +
               ", diagnosticsFile=" + diagnosticsFile +
               ", diagnosticsMaxBytes=" + diagnosticsMaxBytes +
               ", logToFile=" + logToFile +
               ", logToConsole=" + logToConsole + "}";
    }
}
