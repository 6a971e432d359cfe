/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.format;

/**
 * Numeric thread tag printed as {@code tid=<n>} in message lines.
 *
 * <p>The tag is a 64-bit FNV-1a hash of the thread id's decimal string, printed
 * unsigned. It is stable for the lifetime of a thread. Different threads may
 * collide; the tag only needs to tell threads apart in practice.
 */
public final class ThreadTag {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    // Hash once per thread
    private static final ThreadLocal<String> CURRENT =
        ThreadLocal.withInitial(() -> render(of(Thread.currentThread())));

    private ThreadTag() {
    }

    /**
     * Rendered tag of the calling thread.
     */
    public static String current() {
        return CURRENT.get();
    }

    /**
     * Tag for {@code thread}.
     */
    @SuppressWarnings("deprecation")
    public static long of(Thread thread) {
        return hash(String.valueOf(thread.getId()));
    }

    /**
     * Unsigned decimal rendering of a tag.
     */
    public static String render(long tag) {
        return Long.toUnsignedString(tag);
    }

    static long hash(String value) {
        long hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < value.length(); i++) {
            hash ^= value.charAt(i);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
