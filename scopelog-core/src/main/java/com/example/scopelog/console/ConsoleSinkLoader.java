/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.console;

import com.example.scopelog.api.console.ConsoleSink;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Discovers the console sinks a process starts with.
 *
 * <p>The list always begins with {@link StdoutConsoleSink}, followed by sinks
 * named in {@code -Dscopelog.console.sinks} and then sinks found through
 * {@link ServiceLoader}. Selection happens once at startup; message commits
 * never branch on the platform.
 */
public final class ConsoleSinkLoader {

    static final String PROP_CONSOLE_SINKS = "scopelog.console.sinks";

    private ConsoleSinkLoader() {
    }

    /**
     * Load the default console sinks.
     * @return mutable list, standard output first
     */
    public static List<ConsoleSink> load() {
        List<ConsoleSink> sinks = new ArrayList<ConsoleSink>();
        sinks.add(new StdoutConsoleSink());
        sinks.addAll(loadFromSystemProperty());
        sinks.addAll(loadFromServiceLoader());
        return sinks;
    }

    // Load from -Dscopelog.console.sinks=com.example.Sink1,com.example.Sink2
    static List<ConsoleSink> loadFromSystemProperty() {
        List<ConsoleSink> sinks = new ArrayList<ConsoleSink>();
        String prop = System.getProperty(PROP_CONSOLE_SINKS);
        if (prop == null || prop.trim().isEmpty()) {
            return sinks;
        }

        for (String className : prop.split(",")) {
            className = className.trim();
            if (className.isEmpty()) {
                continue;
            }
            try {
                Class<?> clazz = Class.forName(className);
                Object instance = clazz.getDeclaredConstructor().newInstance();
                if (!(instance instanceof ConsoleSink)) {
                    System.err.println("[ConsoleSinkLoader] Not a ConsoleSink: " + className);
                    continue;
                }
                ConsoleSink sink = (ConsoleSink) instance;
                sinks.add(sink);
                System.out.println("[ConsoleSinkLoader] Loaded from system property: " + sink.getName());
            } catch (Exception e) {
                System.err.println("[ConsoleSinkLoader] Failed to load console sink: " + className);
                e.printStackTrace();
            }
        }
        return sinks;
    }

    // Load from META-INF/services/com.example.scopelog.api.console.ConsoleSink
    static List<ConsoleSink> loadFromServiceLoader() {
        List<ConsoleSink> sinks = new ArrayList<ConsoleSink>();
        try {
            ServiceLoader<ConsoleSink> loader = ServiceLoader.load(ConsoleSink.class);
            for (ConsoleSink sink : loader) {
                sinks.add(sink);
                System.out.println("[ConsoleSinkLoader] Loaded via ServiceLoader: " + sink.getName());
            }
        } catch (Exception | ServiceConfigurationError e) {
            System.err.println("[ConsoleSinkLoader] ServiceLoader failed");
            e.printStackTrace();
        }
        return sinks;
    }
}
