/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.demo;

import com.example.scopelog.ScopeLog;
import com.example.scopelog.api.trace.Traced;

/**
 * Service whose methods are traced by the agent through {@link Traced}.
 * Without the agent the annotations do nothing and only messages are logged.
 */
public class OrderService {

    @Traced
    public void placeOrder(String orderId, int quantity) {
        ScopeLog.messages().log("placing", orderId, "qty", quantity);
        reserveStock(orderId, quantity);
        charge(orderId, quantity * 3);
    }

    @Traced("stock")
    public void reserveStock(String orderId, int quantity) {
        ScopeLog.messages().log("reserved", quantity, "for", orderId);
    }

    @Traced("payment")
    public void charge(String orderId, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Negative amount for " + orderId);
        }
        ScopeLog.messages().log("charged", amount, "for", orderId);
    }

    // Not annotated: never traced with the default agent arguments
    public String describe(String orderId) {
        return "Order " + orderId;
    }
}
