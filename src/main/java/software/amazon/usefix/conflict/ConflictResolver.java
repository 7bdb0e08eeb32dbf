/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.conflict;

import java.util.logging.Logger;
import software.amazon.usefix.syntax.Segment;
import software.amazon.usefix.syntax.Segmenter;
import software.amazon.usefix.tree.ImportForest;
import software.amazon.usefix.util.Result;

/**
 * Resolves conflicts whose sides contain nothing but imports and blank lines,
 * by taking the union of both sides. The base section of a diff3-style
 * conflict doesn't take part in the union.
 */
public final class ConflictResolver {
    private static final Logger LOGGER = Logger.getLogger(ConflictResolver.class.getName());

    private ConflictResolver() {
    }

    /**
     * @param block The conflict to resolve
     * @return The union of both sides' imports, or why the conflict can't be
     *  resolved
     */
    public static Result<ImportForest, UnresolvedConflict> resolve(Segment.ConflictBlock block) {
        int markerLine = block.line() + 1;
        if (block.nested()) {
            return Result.err(new UnresolvedConflict(markerLine, ConflictSide.NEITHER, markerLine,
                    "contains another conflict"));
        }
        if (!block.scopeKnown()) {
            return Result.err(new UnresolvedConflict(markerLine, ConflictSide.NEITHER, markerLine,
                    "follows a conflict whose sides disagree about the enclosing scope"));
        }

        Result<ImportForest, UnresolvedConflict> ours = side(markerLine, ConflictSide.OURS,
                block.ours(), block.oursLine());
        if (ours.isErr()) {
            return ours;
        }
        Result<ImportForest, UnresolvedConflict> theirs = side(markerLine, ConflictSide.THEIRS,
                block.theirs(), block.theirsLine());
        if (theirs.isErr()) {
            return theirs;
        }

        LOGGER.fine(() -> "Resolved conflict at line " + markerLine);
        return Result.ok(ImportForest.merge(ours.unwrap(), theirs.unwrap()));
    }

    private static Result<ImportForest, UnresolvedConflict> side(
            int markerLine,
            ConflictSide side,
            String text,
            int firstLine
    ) {
        ImportForest forest = ImportForest.empty();
        for (Segment segment : Segmenter.segment(text)) {
            if (segment instanceof Segment.ImportBlock imports) {
                forest.mergeFrom(imports.forest());
            } else if (segment instanceof Segment.Code code) {
                if (!code.isBlank()) {
                    int line = firstLine + firstNonBlank(code) + 1;
                    String reason = code.parseFailure() != null
                            ? "not an import (" + code.parseFailure() + ")"
                            : "not an import";
                    return Result.err(new UnresolvedConflict(markerLine, side, line, reason));
                }
            } else {
                return Result.err(new UnresolvedConflict(markerLine, side, firstLine + segment.line() + 1,
                        "contains another conflict"));
            }
        }
        return Result.ok(forest);
    }

    // The side-relative, 0-based line of the first non-blank line of `code`.
    private static int firstNonBlank(Segment.Code code) {
        int line = code.line();
        for (String text : code.text().split("\n", -1)) {
            if (!text.isBlank()) {
                return line;
            }
            line++;
        }
        return code.line();
    }
}
