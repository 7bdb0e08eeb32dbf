/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

/**
 * Thrown when text that starts like an import declaration isn't one.
 */
public final class ImportParseException extends RuntimeException {
    private final int line;
    private final int column;
    private final String reason;

    ImportParseException(String reason, int line, int column) {
        super("Syntax error at line " + line + ", column " + column + ": " + reason);
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    /**
     * @return The 1-based line of the error, relative to the start of the
     *  parsed text
     */
    public int line() {
        return line;
    }

    /**
     * @return The 1-based column of the error
     */
    public int column() {
        return column;
    }

    /**
     * @return What was wrong, without the location
     */
    public String reason() {
        return reason;
    }
}
