/*
 * Copyright 2025 Justin Marsh
 * SPDX-License-Identifier: Apache-2.0
 */

package com.example.scopelog.scope;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Reads the depth recorded at the end of a previous run's diagnostics file.
 *
 * <p>Every event line ends in {@code |<depth>}. A clean shutdown leaves the
 * last line at depth 0; a positive depth means scopes were still open when the
 * process died. Anything unreadable counts as "no crash".
 */
final class CrashDetector {

    private static final int BLOCK_SIZE = 8192;

    private CrashDetector() {
    }

    /**
     * @return true if the last non-empty line of {@code path} ends in a positive depth
     */
    static boolean previousRunCrashed(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try {
            OptionalInt depth = parseDepth(lastNonEmptyLine(path));
            return depth.isPresent() && depth.getAsInt() > 0;
        } catch (IOException | SecurityException e) {
            return false;
        }
    }

    /**
     * Parse the integer after the rightmost {@code |}, ignoring surrounding whitespace.
     */
    static OptionalInt parseDepth(String line) {
        int bar = line.lastIndexOf('|');
        if (bar < 0) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(line.substring(bar + 1).trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Read backwards from the end of the file until a complete non-blank line is found.
     *
     * @return the line without its terminator, or "" for a blank or empty file
     */
    static String lastNonEmptyLine(Path path) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long position = file.length();
            byte[] tail = new byte[0];
            while (position > 0) {
                int chunk = (int) Math.min(BLOCK_SIZE, position);
                position -= chunk;

                byte[] merged = new byte[chunk + tail.length];
                file.seek(position);
                file.readFully(merged, 0, chunk);
                System.arraycopy(tail, 0, merged, chunk, tail.length);
                tail = merged;

                String line = lastCompleteLine(new String(tail, StandardCharsets.UTF_8), position == 0);
                if (line != null) {
                    return line;
                }
            }
            return "";
        }
    }

    /**
     * Last non-blank line of {@code text}, or null if it may continue before the
     * start of {@code text} and more of the file has to be read.
     */
    static String lastCompleteLine(String text, boolean atStartOfFile) {
        int end = text.length();
        while (end > 0) {
            int newline = text.lastIndexOf('\n', end - 1);
            String line = text.substring(newline + 1, end);
            if (!line.trim().isEmpty()) {
                return newline >= 0 || atStartOfFile ? line : null;
            }
            if (newline < 0) {
                break;
            }
            end = newline;
        }
        return atStartOfFile ? "" : null;
    }
}
