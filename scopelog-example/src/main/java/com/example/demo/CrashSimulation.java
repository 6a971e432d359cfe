/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.scopelog.ScopeLog;
import com.example.scopelog.scope.ScopeTracer;

/**
 * Dies inside two open scopes so the next run finds a crash point.
 *
 * Run twice:
 *   java -cp ... com.example.demo.CrashSimulation
 *   java -cp ... com.example.demo.CrashSimulation
 *
 * The second run writes "## CRASH POINT ##" into diagnostics.log right after
 * the first run's last "|2" event, then crashes again.
 */
public class CrashSimulation {

    public static void main(String[] args) {
        if (ScopeLog.diagnostics().isCrashedLastRun()) {
            System.out.println("Previous run crashed inside an open scope");
        }

        try (ScopeTracer outer = ScopeLog.enterHere("outer")) {
            try (ScopeTracer inner = ScopeLog.enterHere("inner")) {
                inner.mark("about to halt");
                // halt skips shutdown hooks and finally blocks, like a native crash
                Runtime.getRuntime().halt(3);
            }
        }
    }
}
