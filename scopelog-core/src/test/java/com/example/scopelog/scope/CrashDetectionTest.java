/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.scope;

import com.example.scopelog.ScopeLogConfig;
import com.example.scopelog.sink.RotatingFileSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the crash sentinel written when the previous run ended inside a scope.
 */
public class CrashDetectionTest {

    private static final String START = "[2025-01-01 10:00:00] main:start... Main.java |1";
    private static final String NESTED = "[2025-01-01 10:00:01] load:start... Loader.java |3";
    private static final String CLEAN_END = "[2025-01-01 10:00:02] main:end! Main.java |0";

    @TempDir
    Path dir;

    @Test
    public void testPositiveDepth_WritesSentinelBeforeNewEvents() throws IOException {
        Path file = writeDiagnostics(START, NESTED);
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        diagnostics.enter("main", "Main.java", 1).close();
        diagnostics.close();

        List<String> lines = read(file);
        assertThat(lines).hasSize(5);
        assertThat(lines.subList(0, 3)).containsExactly(START, NESTED, DiagnosticsLog.CRASH_SENTINEL);
        assertThat(lines.get(3)).endsWith("main:start... Main.java |1");
        assertThat(lines.get(4)).endsWith("main:end! Main.java |0");
        assertThat(diagnostics.isCrashedLastRun()).isTrue();
    }

    @Test
    public void testCleanShutdown_NoSentinel() throws IOException {
        Path file = writeDiagnostics(START, CLEAN_END);
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        diagnostics.enter("main", "Main.java", 1).close();
        diagnostics.close();

        assertThat(read(file)).doesNotContain(DiagnosticsLog.CRASH_SENTINEL).hasSize(4);
        assertThat(diagnostics.isCrashedLastRun()).isFalse();
    }

    @Test
    public void testMissingFile_NoSentinel() throws IOException {
        Path file = dir.resolve("diagnostics.log");
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        diagnostics.enter("main", "Main.java", 1).close();
        diagnostics.close();

        assertThat(read(file)).hasSize(2).doesNotContain(DiagnosticsLog.CRASH_SENTINEL);
    }

    @Test
    public void testMalformedLastLine_NoSentinel() throws IOException {
        Path file = writeDiagnostics(NESTED, "garbage without a bar");
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        assertThat(diagnostics.isCrashedLastRun()).isFalse();
        diagnostics.close();
    }

    @Test
    public void testTrailingBlankLines_AreSkipped() throws IOException {
        Path file = writeDiagnostics(START, NESTED, "", "   ", "");
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        assertThat(diagnostics.isCrashedLastRun()).isTrue();
        diagnostics.close();
    }

    @Test
    public void testSentinel_WrittenOncePerInstance() throws IOException {
        Path file = writeDiagnostics(START);
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        diagnostics.enter("a", "A.java", 1);
        diagnostics.terminate();
        diagnostics.enter("b", "B.java", 1);
        diagnostics.close();

        List<String> lines = read(file);
        assertThat(lines.stream().filter(DiagnosticsLog.CRASH_SENTINEL::equals).count()).isEqualTo(1);
        // The new run ends with open scopes, so the next instance reports a crash
        assertThat(lines.get(lines.size() - 1)).endsWith("|2");
        DiagnosticsLog nextRun = newLog(file, 1024 * 1024);
        assertThat(nextRun.isCrashedLastRun()).isTrue();
        nextRun.close();
    }

    @Test
    public void testCrashAndRotation_SentinelStartsNewFile() throws IOException {
        Path file = writeDiagnostics(START, NESTED);
        Path backup = RotatingFileSink.backupPathFor(file);
        DiagnosticsLog diagnostics = newLog(file, 10);

        diagnostics.enter("main", "Main.java", 1).close();
        diagnostics.close();

        assertThat(read(backup)).containsExactly(START, NESTED);
        List<String> lines = read(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(DiagnosticsLog.CRASH_SENTINEL);
    }

    @Test
    public void testOpen_WritesSentinelWithoutEvents() throws IOException {
        Path file = writeDiagnostics(NESTED);
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        assertThat(diagnostics.open()).isTrue();
        diagnostics.close();

        assertThat(read(file)).containsExactly(NESTED, DiagnosticsLog.CRASH_SENTINEL);
    }

    @Test
    public void testCrashOnlyLeftSentinel_IsNotACrash() throws IOException {
        // A run that crashed, wrote the sentinel and then died before any event
        Path file = writeDiagnostics(NESTED, DiagnosticsLog.CRASH_SENTINEL);
        DiagnosticsLog diagnostics = newLog(file, 1024 * 1024);

        assertThat(diagnostics.isCrashedLastRun()).isFalse();
        diagnostics.close();
    }

    private DiagnosticsLog newLog(Path file, long maxBytes) {
        return new DiagnosticsLog(new ScopeLogConfig()
            .setDiagnosticsFile(file)
            .setDiagnosticsMaxBytes(maxBytes));
    }

    private Path writeDiagnostics(String... lines) throws IOException {
        Path file = dir.resolve("diagnostics.log");
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    private static List<String> read(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }
}
