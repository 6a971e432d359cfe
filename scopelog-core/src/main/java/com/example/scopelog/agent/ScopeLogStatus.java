/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.agent;

import com.example.scopelog.message.MessageSink;
import com.example.scopelog.scope.DiagnosticsLog;

import java.util.Date;

/**
 * JMX MBean implementation.
 * Follows JMX Standard MBean naming convention:
 * - Interface: ScopeLogStatusMBean
 * - Implementation: ScopeLogStatus (this class)
 */
public class ScopeLogStatus implements ScopeLogStatusMBean {

    private final MessageSink messages;
    private final DiagnosticsLog diagnostics;

    public ScopeLogStatus(MessageSink messages, DiagnosticsLog diagnostics) {
        this.messages = messages;
        this.diagnostics = diagnostics;
    }

    @Override
    public int getLiveDepth() {
        return diagnostics.getLiveDepth();
    }

    @Override
    public boolean isCrashedLastRun() {
        return diagnostics.isCrashedLastRun();
    }

    @Override
    public long getUnderflowCount() {
        return diagnostics.getUnderflowCount();
    }

    @Override
    public boolean isMessageSinkHealthy() {
        return messages.getFileSink().isHealthy();
    }

    @Override
    public boolean isDiagnosticsSinkHealthy() {
        return diagnostics.getFileSink().isHealthy();
    }

    @Override
    public long getDroppedMessageWrites() {
        return messages.getFileSink().getDroppedWrites();
    }

    @Override
    public long getDroppedDiagnosticsWrites() {
        return diagnostics.getFileSink().getDroppedWrites();
    }

    @Override
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== ScopeLog Status ===\n");
        sb.append("Time: ").append(new Date()).append("\n");
        sb.append("Message file: ").append(messages.getConfig().getOutputFile())
          .append(messages.getFileSink().isHealthy() ? " (healthy" : " (UNHEALTHY")
          .append(", dropped=").append(getDroppedMessageWrites()).append(")\n");
        sb.append("Diagnostics file: ").append(diagnostics.getConfig().getDiagnosticsFile())
          .append(diagnostics.getFileSink().isHealthy() ? " (healthy" : " (UNHEALTHY")
          .append(", dropped=").append(getDroppedDiagnosticsWrites()).append(")\n");
        sb.append("Open scopes: ").append(getLiveDepth()).append("\n");
        sb.append("Previous run crashed: ").append(isCrashedLastRun()).append("\n");
        if (getUnderflowCount() > 0) {
            sb.append("Unbalanced scope ends: ").append(getUnderflowCount()).append("\n");
        }
        return sb.toString();
    }

    @Override
    public void terminate() {
        messages.terminate();
        diagnostics.terminate();
    }
}
