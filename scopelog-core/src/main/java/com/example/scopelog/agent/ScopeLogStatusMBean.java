/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.agent;

/**
 * JMX MBean interface for diagnostic logging status
 */
public interface ScopeLogStatusMBean {
    // Scope tracing
    int getLiveDepth();
    boolean isCrashedLastRun();
    long getUnderflowCount();

    // Sink health
    boolean isMessageSinkHealthy();
    boolean isDiagnosticsSinkHealthy();
    long getDroppedMessageWrites();
    long getDroppedDiagnosticsWrites();

    String getSummary();

    // Control operations
    void terminate();
}
