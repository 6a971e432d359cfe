/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.scope;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Method name, source file and line of the code that opened a scope.
 */
final class CallSite {

    static final String UNKNOWN_FILE = "Unknown";

    // Frames of the tracing entry points themselves; the caller is the first frame outside these
    private static final Set<String> TRACING_CLASSES = new HashSet<String>(Arrays.asList(
        "com.example.scopelog.scope.CallSite",
        "com.example.scopelog.scope.DiagnosticsLog",
        "com.example.scopelog.ScopeLog"
    ));

    private static final StackWalker WALKER = StackWalker.getInstance();

    final String method;
    final String file;
    final int line;

    private CallSite(String method, String file, int line) {
        this.method = method;
        this.file = file;
        this.line = line;
    }

    static CallSite capture() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !TRACING_CLASSES.contains(frame.getClassName()))
                .findFirst())
            .map(frame -> new CallSite(
                frame.getMethodName(),
                frame.getFileName() != null ? frame.getFileName() : UNKNOWN_FILE,
                frame.getLineNumber()))
            .orElse(new CallSite("unknown", UNKNOWN_FILE, -1));
    }
}
