/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.api.trace;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method whose entry and exit should be recorded in the diagnostics log
 * when the scope trace agent is attached.
 *
 * <p>The recorded label is {@code SimpleClassName.method}. A non-empty
 * {@link #value()} is appended after a colon, e.g. {@code Parser.parse:header}.
 *
 * <p>Without the agent the annotation has no effect.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Traced {

    /**
     * Optional custom scope name appended to the method label.
     */
    String value() default "";
}
