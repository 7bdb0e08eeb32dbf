/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import software.amazon.usefix.tree.ImportForest;

/**
 * A contiguous run of whole lines of a file, as classified by the
 * {@link Segmenter}. Concatenating the {@link #text()} of every segment of a
 * file gives back the file exactly.
 */
public sealed interface Segment permits Segment.Code, Segment.ImportBlock, Segment.ConflictBlock {
    /**
     * @return The original text of the segment, including line terminators
     */
    String text();

    /**
     * @return The 0-based line the segment starts at
     */
    int line();

    /**
     * Opaque text, passed through untouched.
     *
     * @param text The text
     * @param line The first line
     * @param parseFailure If some line in the segment began like an import
     *  declaration but failed to parse, the reason, otherwise {@code null}
     */
    record Code(String text, int line, String parseFailure) implements Segment {
        /**
         * @return Whether this segment is only whitespace
         */
        public boolean isBlank() {
            return text.isBlank();
        }
    }

    /**
     * A run of import declarations, possibly separated by blank lines.
     *
     * @param text The text
     * @param line The first line
     * @param scope Id of the scope the declarations are in
     * @param indentation The leading whitespace of the first declaration
     * @param forest Every import of the run
     */
    record ImportBlock(String text, int line, int scope, String indentation, ImportForest forest)
            implements Segment {}

    /**
     * A region bounded by merge conflict markers.
     *
     * @param text The text, markers included
     * @param line The line of the start marker
     * @param scope Id of the scope the region is in
     * @param scopeKnown Whether {@code scope} could be determined reliably;
     *  when it couldn't, the region must be left alone
     * @param nested Whether the region contains further conflict markers
     * @param ours The text between the start marker and the base or separator marker
     * @param oursLine The first line of {@code ours}
     * @param base The text of a diff3-style base section, or {@code null}
     * @param theirs The text between the separator marker and the end marker
     * @param theirsLine The first line of {@code theirs}
     */
    record ConflictBlock(
            String text,
            int line,
            int scope,
            boolean scopeKnown,
            boolean nested,
            String ours,
            int oursLine,
            String base,
            String theirs,
            int theirsLine
    ) implements Segment {
        /**
         * @return The leading whitespace of the first non-blank line of either side
         */
        public String indentation() {
            String indentation = firstIndentation(ours);
            if (indentation == null) {
                indentation = firstIndentation(theirs);
            }
            return indentation == null ? "" : indentation;
        }

        private static String firstIndentation(String side) {
            for (String line : side.split("\n")) {
                if (!line.isBlank()) {
                    int end = 0;
                    while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
                        end++;
                    }
                    return line.substring(0, end);
                }
            }
            return null;
        }
    }
}
