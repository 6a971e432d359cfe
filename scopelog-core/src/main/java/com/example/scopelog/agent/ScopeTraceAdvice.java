/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.agent;

import com.example.scopelog.ScopeLog;
import com.example.scopelog.scope.DiagnosticsLog;
import com.example.scopelog.scope.ScopeTracer;
import net.bytebuddy.asm.Advice;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * ByteBuddy advice that wraps a method body in a {@link ScopeTracer}.
 *
 * <p>The label and source file are computed once per method at instrumentation
 * time and bound as constants through {@link Label} and {@link SourceFile}
 * (see {@link ScopeTraceAgent#adviceFor}).
 *
 * <p>ByteBuddy inlines this code into instrumented classes, so everything it
 * touches must be public.
 */
public class ScopeTraceAdvice {

    /** Constant scope label of the instrumented method. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.PARAMETER)
    public @interface Label {
    }

    /** Constant source file name of the instrumented method. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.PARAMETER)
    public @interface SourceFile {
    }

    private static volatile DiagnosticsLog diagnostics;

    /**
     * Route instrumented scopes to {@code log} instead of the process default.
     */
    public static void bind(DiagnosticsLog log) {
        diagnostics = log;
    }

    public static DiagnosticsLog diagnostics() {
        DiagnosticsLog log = diagnostics;
        return log != null ? log : ScopeLog.diagnostics();
    }

    @Advice.OnMethodEnter
    public static ScopeTracer onMethodEnter(@Label String label, @SourceFile String sourceFile) {
        return open(label, sourceFile);
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onMethodExit(@Advice.Enter ScopeTracer scope) {
        if (scope != null) {
            scope.close();
        }
    }

    public static ScopeTracer open(String label, String sourceFile) {
        return diagnostics().enter(label, sourceFile, 0);
    }
}
