/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import software.amazon.usefix.tree.ImportForest;

/**
 * Splits a file into {@link Segment}s of whole lines: opaque code, runs of
 * import declarations, and merge conflict regions.
 *
 * <p>Import declarations, along with any doc comments and attributes before
 * them, are only looked for at the start of a line that begins in plain code
 * (not inside a literal or comment), and only when every declaration parses
 * and ends its line. Anything that starts like a
 * declaration but isn't one becomes code, so unrelated text is never
 * reinterpreted.
 *
 * <p>If the two sides of a conflict leave the code in different states (for
 * example, one side opens a block the other doesn't), the scope of anything
 * after the conflict is ambiguous. From that point on, no further imports
 * are recognized and later conflicts are marked as having no known scope.
 */
public final class Segmenter {
    static final String START_MARKER = "<<<<<<<";
    static final String BASE_MARKER = "|||||||";
    static final String SEPARATOR_MARKER = "=======";
    static final String END_MARKER = ">>>>>>>";

    private static final Logger LOGGER = Logger.getLogger(Segmenter.class.getName());

    private final SourceLines lines;
    private final List<Segment> segments = new ArrayList<>();
    private CodeScanner scanner = new CodeScanner();
    private boolean scopeLost;

    private int codeStart = -1;
    private int codeEnd;
    private String codeFailure;

    private Segmenter(String text) {
        this.lines = SourceLines.of(text);
    }

    /**
     * @param text The text to segment
     * @return The segments of {@code text}, in order
     */
    public static List<Segment> segment(String text) {
        Segmenter segmenter = new Segmenter(text);
        segmenter.run();
        return segmenter.segments;
    }

    private void run() {
        int line = 0;
        while (line < lines.count()) {
            if (isMarker(lines.line(line), START_MARKER)) {
                int next = conflict(line);
                if (next > line) {
                    line = next;
                    continue;
                }
            }

            if (!scopeLost && scanner.isNeutral() && startsLikeDeclaration(line)) {
                int next = importRun(line);
                if (next > line) {
                    line = next;
                    continue;
                }
            }

            code(line);
            line++;
        }
        flushCode();
    }

    private void code(int line) {
        if (codeStart < 0) {
            codeStart = line;
        }
        codeEnd = line + 1;
        scanner.scan(lines.line(line));
    }

    private void flushCode() {
        if (codeStart >= 0) {
            segments.add(new Segment.Code(lines.span(codeStart, codeEnd), codeStart, codeFailure));
            codeStart = -1;
            codeFailure = null;
        }
    }

    // Returns the line after the run, or `start` if there is no run here.
    private int importRun(int start) {
        ImportForest forest = ImportForest.empty();
        int end;
        try {
            end = declarationsAt(start, forest);
        } catch (ImportParseException e) {
            LOGGER.fine(() -> "Line " + (start + 1) + " is not an import: " + e.getMessage());
            if (codeFailure == null) {
                codeFailure = "line " + (start + 1) + ": " + e.reason();
            }
            return start;
        }

        while (end < lines.count()) {
            int next = end;
            while (next < lines.count() && lines.isBlank(next)) {
                next++;
            }
            if (next >= lines.count() || !startsLikeDeclaration(next)) {
                break;
            }

            ImportForest more = ImportForest.empty();
            try {
                end = declarationsAt(next, more);
            } catch (ImportParseException e) {
                break;
            }
            forest.mergeFrom(more);
        }

        flushCode();
        segments.add(new Segment.ImportBlock(
                lines.span(start, end), start, scanner.scope(), lines.indentation(start), forest));
        return end;
    }

    // Parses the declarations starting at the beginning of `line`, which must
    // end a line, and returns the line after them.
    private int declarationsAt(int line, ImportForest into) {
        String text = lines.text();
        int position = lines.start(line);
        while (true) {
            ImportDeclaration declaration = ImportParser.parseDeclaration(lines.from(position));
            declaration.paths().forEach(into::insert);
            position += declaration.length();

            int after = position;
            while (after < text.length() && (text.charAt(after) == ' ' || text.charAt(after) == '\t')) {
                after++;
            }
            if (after >= text.length() || text.charAt(after) == '\n' || text.charAt(after) == '\r') {
                return lines.lineOfIndex(position - 1) + 1;
            }
            if (!startsLikeDeclaration(text, after)) {
                throw new ImportParseException("unexpected text after `;`", lines.lineOfIndex(after) + 1,
                        after - lines.start(lines.lineOfIndex(after)) + 1);
            }
            position = after;
        }
    }

    // Returns the line after the conflict, or `start` if the start marker
    // isn't part of a complete conflict.
    private int conflict(int start) {
        int separator = -1;
        int base = -1;
        int end = -1;
        int depth = 0;
        boolean nested = false;
        for (int line = start + 1; line < lines.count() && end < 0; line++) {
            String text = lines.line(line);
            if (isMarker(text, START_MARKER)) {
                depth++;
                nested = true;
            } else if (isMarker(text, END_MARKER)) {
                if (depth == 0) {
                    end = line;
                } else {
                    depth--;
                }
            } else if (depth == 0 && separator < 0 && isSeparator(text)) {
                separator = line;
            } else if (depth == 0 && separator < 0 && base < 0 && isMarker(text, BASE_MARKER)) {
                base = line;
            }
        }

        if (end < 0 || separator < 0) {
            LOGGER.fine(() -> "Unterminated conflict marker at line " + (start + 1));
            return start;
        }

        int oursEnd = base >= 0 ? base : separator;
        boolean scopeKnown = !scopeLost && scanner.isNeutral();
        Segment.ConflictBlock block = new Segment.ConflictBlock(
                lines.span(start, end + 1),
                start,
                scanner.scope(),
                scopeKnown,
                nested,
                lines.span(start + 1, oursEnd),
                start + 1,
                base >= 0 ? lines.span(base + 1, separator) : null,
                lines.span(separator + 1, end),
                separator + 1);

        flushCode();
        segments.add(block);
        advancePast(block);
        return end + 1;
    }

    private void advancePast(Segment.ConflictBlock block) {
        int firstFresh = scanner.nextScope();
        CodeScanner ours = scanner.copy();
        ours.scan(block.ours());
        CodeScanner theirs = scanner.copy();
        theirs.scan(block.theirs());
        if (!block.nested() && ours.agreesWith(theirs, firstFresh)) {
            scanner = ours;
        } else {
            if (!scopeLost) {
                LOGGER.warning(() -> "The sides of the conflict at line " + (block.line() + 1)
                                     + " leave the code in different states; imports after it are left as is");
            }
            scopeLost = true;
            scanner = ours;
        }
    }

    private boolean startsLikeDeclaration(int line) {
        return startsLikeDeclaration(lines.text(), lines.start(line));
    }

    private static boolean startsLikeDeclaration(String text, int position) {
        int start = position;
        while (start < text.length() && (text.charAt(start) == ' ' || text.charAt(start) == '\t')) {
            start++;
        }
        return startsWithKeyword(text, start, "use")
               || startsWithKeyword(text, start, "pub")
               || text.startsWith("#[", start)
               || startsWithDocComment(text, start);
    }

    private static boolean startsWithDocComment(String text, int position) {
        if (text.startsWith("///", position)) {
            return !text.startsWith("////", position);
        }
        return text.startsWith("/**", position)
               && !text.startsWith("/***", position)
               && !text.startsWith("/**/", position);
    }

    private static boolean startsWithKeyword(String text, int position, String keyword) {
        if (!text.startsWith(keyword, position)) {
            return false;
        }
        int after = position + keyword.length();
        if (after >= text.length()) {
            return true;
        }
        char next = text.charAt(after);
        return next != '_' && !Character.isLetterOrDigit(next);
    }

    static boolean isMarker(String line, String marker) {
        if (!line.startsWith(marker)) {
            return false;
        }
        if (line.length() == marker.length()) {
            return true;
        }
        char next = line.charAt(marker.length());
        return next == ' ' || next == '\t' || next == '\r' || next == '\n';
    }

    static boolean isSeparator(String line) {
        return line.stripTrailing().equals(SEPARATOR_MARKER);
    }
}
