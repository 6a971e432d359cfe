/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.message;

/**
 * Builder for one message line, committed once.
 *
 * <p>Fields are joined with a single space. Appending {@link LogToken#NO_SPACE}
 * switches separators off until {@link LogToken#SPACE} switches them back on.
 * The mode survives commits.
 *
 * <p>Use with try-with-resources so the line is committed on every exit path:
 * <pre>
 * try (MessageLog log = sink.log()) {
 *     log.append("loaded").append(count).append("entries");
 *     if (count == 0) {
 *         return;
 *     }
 *     log.noSpace().append(" from ").append(source);
 * }
 * </pre>
 *
 * <p><b>Thread Safety:</b> Not thread-safe. A message log belongs to the call
 * site that created it; concurrency is handled by the {@link MessageSink}.
 */
public class MessageLog implements AutoCloseable {

    private final MessageSink sink;
    private final boolean toFile;
    private final boolean toConsole;

    private final StringBuilder buffer = new StringBuilder();
    private boolean hasContent;
    private boolean noSpace;

    MessageLog(MessageSink sink, boolean toFile, boolean toConsole) {
        this.sink = sink;
        this.toFile = toFile;
        this.toConsole = toConsole;
    }

    /**
     * Append one field. {@link LogToken} values switch the separator mode
     * instead of being printed; {@code null} prints as {@code "null"}.
     */
    public MessageLog append(Object value) {
        if (value instanceof LogToken) {
            return append((LogToken) value);
        }
        if (hasContent && !noSpace) {
            buffer.append(' ');
        }
        buffer.append(value);
        hasContent = true;
        return this;
    }

    public MessageLog append(LogToken token) {
        noSpace = token == LogToken.NO_SPACE;
        return this;
    }

    /**
     * Append several fields in order, as if by repeated {@link #append(Object)}.
     */
    public MessageLog appendAll(Object... values) {
        if (values == null) {
            return append((Object) null);
        }
        for (Object value : values) {
            append(value);
        }
        return this;
    }

    public MessageLog noSpace() {
        return append(LogToken.NO_SPACE);
    }

    public MessageLog space() {
        return append(LogToken.SPACE);
    }

    /**
     * @return true if fields were appended since the last commit
     */
    public boolean hasContent() {
        return hasContent;
    }

    public boolean isNoSpace() {
        return noSpace;
    }

    public boolean isToFile() {
        return toFile;
    }

    public boolean isToConsole() {
        return toConsole;
    }

    /**
     * @return the text accumulated since the last commit
     */
    public String getMessage() {
        return buffer.toString();
    }

    /**
     * Commit the accumulated text. No-op when nothing was appended since the
     * last commit, so repeated calls write one line.
     */
    public void flush() {
        if (!hasContent) {
            return;
        }
        String message = buffer.toString();
        buffer.setLength(0);
        hasContent = false;

        sink.commit(message, toFile, toConsole);
    }

    @Override
    public void close() {
        flush();
    }
}
