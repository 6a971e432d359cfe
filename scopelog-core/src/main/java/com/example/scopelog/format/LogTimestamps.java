/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.format;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Second-resolution local timestamps, {@code yyyy-MM-dd HH:mm:ss}.
 */
public final class LogTimestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private LogTimestamps() {
    }

    /**
     * Format the current time of {@code clock} in the clock's zone.
     */
    public static String now(Clock clock) {
        return FORMAT.format(LocalDateTime.now(clock));
    }

    /**
     * Format the current time in the system default zone.
     */
    public static String now() {
        return now(Clock.systemDefaultZone());
    }
}
