/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */
package com.example.scopelog.benchmarks;

import com.example.scopelog.ScopeLogConfig;
import com.example.scopelog.message.MessageLog;
import com.example.scopelog.message.MessageSink;
import com.example.scopelog.scope.DiagnosticsLog;
import com.example.scopelog.scope.ScopeTracer;
import org.openjdk.jmh.annotations.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the cost of one committed message and one scope open/close.
 *
 * Every operation flushes to disk, so the numbers are dominated by the file
 * system. Run with:
 *   java -jar target/benchmarks.jar ScopeLogBenchmark
 *
 * Use -t 4 to see how the per-sink lock behaves under contention.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Fork(value = 1)
@Warmup(iterations = 1, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
public class ScopeLogBenchmark {

    private Path directory;
    private MessageSink messages;
    private DiagnosticsLog diagnostics;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        directory = Files.createTempDirectory("scopelog-bench");
        // Large thresholds so rotation never runs during a trial
        ScopeLogConfig config = new ScopeLogConfig()
            .setOutputFile(directory.resolve("output.log"))
            .setOutputMaxBytes(Long.MAX_VALUE)
            .setDiagnosticsFile(directory.resolve("diagnostics.log"))
            .setDiagnosticsMaxBytes(Long.MAX_VALUE)
            .setLogToConsole(false);
        messages = new MessageSink(config, Collections.emptyList());
        diagnostics = new DiagnosticsLog(config);
        diagnostics.open();
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        messages.close();
        diagnostics.close();
        Files.deleteIfExists(directory.resolve("output.log"));
        Files.deleteIfExists(directory.resolve("diagnostics.log"));
        Files.deleteIfExists(directory);
    }

    @Benchmark
    public void commitMessage() {
        try (MessageLog log = messages.log(true, false)) {
            log.append("request").append(42).append("served in").append(1.5).append("ms");
        }
    }

    @Benchmark
    public void emptyMessageIsFree() {
        try (MessageLog log = messages.log(true, false)) {
            log.noSpace();
        }
    }

    @Benchmark
    public void openAndCloseScope() {
        try (ScopeTracer scope = diagnostics.enter("openAndCloseScope", "ScopeLogBenchmark.java", 0)) {
            scope.getLabel();
        }
    }
}
