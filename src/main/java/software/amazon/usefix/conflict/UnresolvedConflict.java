/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.conflict;

import java.util.Locale;

/**
 * Why a conflict was left in place. Line numbers are 1-based.
 *
 * @param markerLine The line of the conflict's start marker
 * @param side The side that isn't import-only
 * @param line The offending line
 * @param reason A description of the problem
 */
public record UnresolvedConflict(int markerLine, ConflictSide side, int line, String reason) {
    /**
     * @return A one-line description suitable for showing to users
     */
    public String describe() {
        String prefix = "Conflict at line " + markerLine + " left unresolved: ";
        if (side == ConflictSide.NEITHER) {
            return prefix + reason;
        }
        return prefix + side.name().toLowerCase(Locale.ROOT) + " side, line " + line + ": " + reason;
    }
}
