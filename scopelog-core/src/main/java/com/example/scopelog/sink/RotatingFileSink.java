/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.sink;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only text file that is opened lazily and rotated to a single
 * {@code .old} backup when it is found over its size threshold at open time.
 *
 * <p><b>Rotation:</b> Only {@link #ensureOpen(Path, long)} checks the size. An
 * open handle keeps appending past the threshold until the sink is terminated
 * and reopened. Each rotation deletes the previous backup, so at most one
 * generation of history is kept.
 *
 * <p><b>Failure policy:</b> Nothing here throws. A failed open or write drops
 * the line, increments {@link #getDroppedWrites()} and flips
 * {@link #isHealthy()} to false until the next successful open. A failed
 * rotation is ignored and the original path is opened anyway.
 *
 * <p><b>Thread Safety:</b> All methods synchronize on this instance. Callers
 * that need a larger critical section (for example file plus console output of
 * the same message) synchronize on the sink themselves; the monitor is
 * reentrant.
 */
public class RotatingFileSink implements Closeable {

    public static final String BACKUP_SUFFIX = ".old";

    private final AtomicLong droppedWrites = new AtomicLong();

    private Writer writer;
    private Path openPath;
    private volatile boolean healthy = true;

    /**
     * Open {@code path} for appending if no handle is open yet.
     * Before opening, a file larger than {@code maxBytes} is moved to
     * {@code path + ".old"}, replacing any earlier backup.
     *
     * @param path file to append to
     * @param maxBytes rotation threshold in bytes
     * @return true if a handle is open after the call
     */
    public synchronized boolean ensureOpen(Path path, long maxBytes) {
        if (writer != null) {
            return true;
        }

        rotateIfTooLarge(path, maxBytes);

        try {
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            openPath = path;
            healthy = true;
            return true;
        } catch (IOException | SecurityException e) {
            writer = null;
            openPath = null;
            healthy = false;
            return false;
        }
    }

    /**
     * Append {@code text} followed by a newline and flush.
     * Dropped silently when the sink is not open or the write fails.
     */
    public synchronized void writeLine(String text) {
        if (writer == null) {
            droppedWrites.incrementAndGet();
            return;
        }
        try {
            writer.write(text);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            droppedWrites.incrementAndGet();
            healthy = false;
        }
    }

    /**
     * Close the handle. Safe to call repeatedly; the next
     * {@link #ensureOpen(Path, long)} reopens and re-checks the size.
     */
    public synchronized void terminate() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            healthy = false;
        } finally {
            writer = null;
            openPath = null;
        }
    }

    @Override
    public void close() {
        terminate();
    }

    public synchronized boolean isOpen() {
        return writer != null;
    }

    /**
     * @return the path of the open handle, or null when closed
     */
    public synchronized Path getOpenPath() {
        return openPath;
    }

    /**
     * @return false after a failed open or write, until the next successful open
     */
    public boolean isHealthy() {
        return healthy;
    }

    public long getDroppedWrites() {
        return droppedWrites.get();
    }

    /**
     * Backup location for {@code path}: same directory, {@code .old} appended to the file name.
     */
    public static Path backupPathFor(Path path) {
        return path.resolveSibling(path.getFileName().toString() + BACKUP_SUFFIX);
    }

    /**
     * Move {@code path} to its backup when it is larger than {@code maxBytes}.
     * Best effort: any I/O problem leaves the file where it is.
     *
     * @return true if the file was rotated
     */
    static boolean rotateIfTooLarge(Path path, long maxBytes) {
        try {
            if (!Files.isRegularFile(path) || Files.size(path) <= maxBytes) {
                return false;
            }
            Path backup = backupPathFor(path);
            Files.deleteIfExists(backup);
            try {
                Files.move(path, backup, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(path, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException | SecurityException e) {
            return false;
        }
    }
}
