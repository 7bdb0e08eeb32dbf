/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable text indexed by line. A line includes its terminator, so
 * concatenating every line gives back the original text exactly.
 */
final class SourceLines {
    private final String text;
    private final int[] lineStarts;

    private SourceLines(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    static SourceLines of(String text) {
        List<Integer> starts = new ArrayList<>();
        if (!text.isEmpty()) {
            starts.add(0);
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                starts.add(i + 1);
            }
        }
        return new SourceLines(text, starts.stream().mapToInt(Integer::intValue).toArray());
    }

    String text() {
        return text;
    }

    int count() {
        return lineStarts.length;
    }

    /**
     * @param line The line to find the start of
     * @return The index of the first character of {@code line}
     */
    int start(int line) {
        return lineStarts[line];
    }

    /**
     * @param line The line to find the end of
     * @return The index just past {@code line}'s terminator
     */
    int end(int line) {
        return line + 1 < lineStarts.length ? lineStarts[line + 1] : text.length();
    }

    String line(int line) {
        return text.substring(start(line), end(line));
    }

    /**
     * @param from The first line of the span
     * @param to The line after the last line of the span
     * @return The text of the lines in {@code [from, to)}
     */
    String span(int from, int to) {
        if (from >= to) {
            return "";
        }
        return text.substring(start(from), end(to - 1));
    }

    /**
     * @param index The index to find the line of
     * @return The line {@code index} is in
     */
    int lineOfIndex(int index) {
        int found = Arrays.binarySearch(lineStarts, index);
        return found >= 0 ? found : -found - 2;
    }

    /**
     * @param index Index to start the view at
     * @return A view of the text from {@code index} to the end, without copying
     */
    CharSequence from(int index) {
        return CharBuffer.wrap(text, index, text.length());
    }

    boolean isBlank(int line) {
        return line(line).isBlank();
    }

    String indentation(int line) {
        int start = start(line);
        int end = start;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(start, end);
    }
}
