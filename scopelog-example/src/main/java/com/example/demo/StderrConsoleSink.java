/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.scopelog.api.console.ConsoleSink;

/**
 * Example console sink mirroring messages to standard error, the way a
 * debugger output window would receive them.
 * Registered through META-INF/services, so it is picked up automatically.
 */
public class StderrConsoleSink implements ConsoleSink {

    @Override
    public void println(String message) {
        System.err.println("[mirror] " + message);
    }

    @Override
    public String getName() {
        return "stderr-mirror";
    }
}
