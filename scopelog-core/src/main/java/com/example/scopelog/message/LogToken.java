/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.message;

/**
 * Separator mode switches understood by {@link MessageLog#append(Object)}.
 *
 * <p>The mode is persistent: after {@link #NO_SPACE} every following field is
 * glued to the previous one until {@link #SPACE} is appended.
 */
public enum LogToken {
    /** Stop inserting a space between fields. */
    NO_SPACE,
    /** Resume inserting a space between fields. */
    SPACE
}
