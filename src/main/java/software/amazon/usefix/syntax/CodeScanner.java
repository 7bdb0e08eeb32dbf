/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Tracks just enough of the lexical state of opaque code to know whether a
 * line starts inside a literal or comment, and which brace-delimited scope
 * it is in. Scopes are identified by an id assigned when their opening
 * brace is seen; the file scope is {@link #FILE_SCOPE}.
 */
final class CodeScanner {
    static final int FILE_SCOPE = 0;

    private enum Mode {
        CODE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        RAW_STRING
    }

    private final Deque<Integer> scopes;
    private Mode mode;
    private int commentDepth;
    private int rawHashes;
    private int nextScope;
    private char previous;

    CodeScanner() {
        this.scopes = new ArrayDeque<>();
        this.mode = Mode.CODE;
        this.nextScope = FILE_SCOPE + 1;
        this.previous = '\n';
    }

    private CodeScanner(CodeScanner other) {
        this.scopes = new ArrayDeque<>(other.scopes);
        this.mode = other.mode;
        this.commentDepth = other.commentDepth;
        this.rawHashes = other.rawHashes;
        this.nextScope = other.nextScope;
        this.previous = other.previous;
    }

    CodeScanner copy() {
        return new CodeScanner(this);
    }

    /**
     * @return Whether the scanner is in plain code, outside of any literal or comment
     */
    boolean isNeutral() {
        return mode == Mode.CODE;
    }

    /**
     * @return The id of the innermost enclosing scope
     */
    int scope() {
        Integer innermost = scopes.peek();
        return innermost == null ? FILE_SCOPE : innermost;
    }

    int nextScope() {
        return nextScope;
    }

    /**
     * Checks whether two scanners, copied from the same scanner and then fed
     * different text, ended in the same state. Scopes opened after the copy
     * get different ids in each scanner, so they only need to line up.
     *
     * @param other The other scanner
     * @param firstFreshScope {@link #nextScope()} at the time of the copy
     * @return Whether both scanners are in the same lexical state and scope
     */
    boolean agreesWith(CodeScanner other, int firstFreshScope) {
        if (mode != other.mode
                || commentDepth != other.commentDepth
                || rawHashes != other.rawHashes
                || scopes.size() != other.scopes.size()) {
            return false;
        }

        Iterator<Integer> mine = scopes.iterator();
        Iterator<Integer> theirs = other.scopes.iterator();
        while (mine.hasNext()) {
            int left = mine.next();
            int right = theirs.next();
            boolean leftFresh = left >= firstFreshScope;
            boolean rightFresh = right >= firstFreshScope;
            if (leftFresh != rightFresh || (!leftFresh && left != right)) {
                return false;
            }
        }
        return true;
    }

    void scan(CharSequence text) {
        int i = 0;
        while (i < text.length()) {
            i = switch (mode) {
                case CODE -> code(text, i);
                case LINE_COMMENT -> lineComment(text, i);
                case BLOCK_COMMENT -> blockComment(text, i);
                case STRING -> string(text, i);
                case RAW_STRING -> rawString(text, i);
            };
        }
    }

    private int code(CharSequence text, int i) {
        char c = text.charAt(i);
        char next = charAt(text, i + 1);
        int end = i + 1;
        if (c == '/' && next == '/') {
            mode = Mode.LINE_COMMENT;
            end = i + 2;
        } else if (c == '/' && next == '*') {
            mode = Mode.BLOCK_COMMENT;
            commentDepth = 1;
            end = i + 2;
        } else if (c == '"') {
            mode = Mode.STRING;
        } else if ((c == 'r' || c == 'b') && !isIdentPart(previous)) {
            end = rawStringStart(text, i);
        } else if (c == '\'') {
            end = charLiteral(text, i);
        } else if (c == '{') {
            scopes.push(nextScope++);
        } else if (c == '}') {
            scopes.poll();
        }
        previous = text.charAt(end - 1);
        return end;
    }

    // r"...", r#"..."#, br"...": returns where the literal's body starts, or
    // just past the first character if this is only an identifier.
    private int rawStringStart(CharSequence text, int i) {
        int j = i;
        if (charAt(text, j) == 'b') {
            j++;
        }
        if (charAt(text, j) != 'r') {
            return i + 1;
        }
        j++;
        int hashes = 0;
        while (charAt(text, j) == '#') {
            hashes++;
            j++;
        }
        if (charAt(text, j) != '"') {
            return i + 1;
        }
        mode = Mode.RAW_STRING;
        rawHashes = hashes;
        return j + 1;
    }

    // Distinguishes 'x', '\n', and Unicode escapes ('\\u{..}') from lifetimes and labels like 'a.
    private int charLiteral(CharSequence text, int i) {
        char first = charAt(text, i + 1);
        if (first == '\\') {
            int j = i + 3;
            while (j < text.length() && text.charAt(j) != '\'' && text.charAt(j) != '\n') {
                j++;
            }
            return charAt(text, j) == '\'' ? j + 1 : i + 1;
        }
        if (first != '\n' && charAt(text, i + 2) == '\'') {
            return i + 3;
        }
        if (Character.isHighSurrogate(first) && charAt(text, i + 3) == '\'') {
            return i + 4;
        }
        return i + 1;
    }

    private int lineComment(CharSequence text, int i) {
        if (text.charAt(i) == '\n') {
            mode = Mode.CODE;
            previous = '\n';
        }
        return i + 1;
    }

    private int blockComment(CharSequence text, int i) {
        char c = text.charAt(i);
        char next = charAt(text, i + 1);
        if (c == '/' && next == '*') {
            commentDepth++;
            return i + 2;
        } else if (c == '*' && next == '/') {
            if (--commentDepth == 0) {
                mode = Mode.CODE;
                previous = ' ';
            }
            return i + 2;
        }
        return i + 1;
    }

    private int string(CharSequence text, int i) {
        char c = text.charAt(i);
        if (c == '\\') {
            return i + 2;
        } else if (c == '"') {
            mode = Mode.CODE;
            previous = '"';
        }
        return i + 1;
    }

    private int rawString(CharSequence text, int i) {
        if (text.charAt(i) != '"') {
            return i + 1;
        }
        for (int h = 1; h <= rawHashes; h++) {
            if (charAt(text, i + h) != '#') {
                return i + 1;
            }
        }
        mode = Mode.CODE;
        previous = '"';
        return i + 1 + rawHashes;
    }

    private static char charAt(CharSequence text, int i) {
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
