/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.console;

import com.example.scopelog.api.console.ConsoleSink;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Built-in console sink writing each message on its own line to standard output.
 */
public class StdoutConsoleSink implements ConsoleSink {

    private final PrintStream out;

    public StdoutConsoleSink() {
        this(System.out);
    }

    public StdoutConsoleSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void println(String message) {
        out.println(message);
        out.flush();
    }

    @Override
    public String getName() {
        return "stdout";
    }
}
