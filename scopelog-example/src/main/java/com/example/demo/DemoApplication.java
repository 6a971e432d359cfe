/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.scopelog.ScopeLog;
import com.example.scopelog.message.LogToken;
import com.example.scopelog.message.MessageLog;
import com.example.scopelog.scope.ScopeTracer;

/**
 * Demo application showing message logging and scope tracing.
 *
 * Run without the agent to see manual scopes only:
 *   java -cp target/scopelog-example-*.jar:../scopelog-core/target/scopelog-core-*.jar \
 *        com.example.demo.DemoApplication
 *
 * Run with the agent to also trace the @Traced methods of OrderService:
 *   java -javaagent:../scopelog-core/target/scopelog-core-*-agent.jar=include=com.example.demo.* \
 *        -cp target/scopelog-example-*.jar com.example.demo.DemoApplication
 *
 * Then look at output.log and diagnostics.log in the working directory.
 */
public class DemoApplication {

    public static void main(String[] args) throws InterruptedException {
        ScopeLog.installShutdownHook();

        System.out.println("=== ScopeLog Demo ===");
        if (ScopeLog.diagnostics().isCrashedLastRun()) {
            System.out.println("Previous run crashed; see " + ScopeLog.config().getDiagnosticsFile());
        }

        try (ScopeTracer scope = ScopeLog.enterHere()) {
            DemoApplication app = new DemoApplication();
            app.logSomeMessages();
            scope.mark("messages logged");

            app.processOrdersOnWorkers();
            scope.mark("orders processed");
        }

        System.out.println("\nOpen scopes at exit: " + ScopeLog.diagnostics().getLiveDepth());
    }

    /**
     * Shows field joining and the persistent no-space mode.
     */
    public void logSomeMessages() {
        try (MessageLog log = ScopeLog.log()) {
            log.append("Demo started with").append(Runtime.getRuntime().availableProcessors()).append("cpus");
        }

        // "ratio=0.75 (3/4)"
        try (MessageLog log = ScopeLog.log()) {
            log.append("ratio=").append(LogToken.NO_SPACE).append(0.75)
               .append(LogToken.SPACE).append("(3/4)");
        }

        // Console only
        try (MessageLog log = ScopeLog.logNoFile()) {
            log.append("this line is not written to").append(ScopeLog.config().getOutputFile());
        }

        ScopeLog.messages().log("one-shot", "message", 42);
    }

    /**
     * Concurrent scopes: depths in diagnostics.log count open scopes across threads.
     */
    public void processOrdersOnWorkers() throws InterruptedException {
        OrderService service = new OrderService();
        Thread[] workers = new Thread[3];
        for (int i = 0; i < workers.length; i++) {
            final int worker = i;
            workers[i] = new Thread(() -> {
                try (ScopeTracer scope = ScopeLog.enterHere("worker-" + worker)) {
                    service.placeOrder("order-" + worker, 10 * (worker + 1));
                }
            }, "demo-worker-" + i);
            workers[i].start();
        }
        for (Thread worker : workers) {
            worker.join();
        }
    }
}
