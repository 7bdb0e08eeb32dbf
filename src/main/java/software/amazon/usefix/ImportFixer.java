/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import software.amazon.usefix.conflict.ConflictResolver;
import software.amazon.usefix.conflict.UnresolvedConflict;
import software.amazon.usefix.render.ImportRenderer;
import software.amazon.usefix.syntax.Segment;
import software.amazon.usefix.syntax.Segmenter;
import software.amazon.usefix.tree.ImportForest;
import software.amazon.usefix.util.Result;

/**
 * Rewrites the imports of a file into canonical form, resolving conflicts
 * whose sides are import-only along the way.
 *
 * <p>Every scope (the file itself, and each block with imports in it) is
 * handled on its own: all of the scope's imports, standalone or from resolved
 * conflicts, are unioned and written once, where the scope's first import
 * was. The rest of the scope's import declarations are removed. Code and
 * unresolved conflicts are copied as is.
 */
public final class ImportFixer {
    private static final Logger LOGGER = Logger.getLogger(ImportFixer.class.getName());

    private final UsefixOptions options;

    public ImportFixer(UsefixOptions options) {
        this.options = options;
    }

    /**
     * @param text The text of the file
     * @return The transformed text and the conflicts left in place
     * @throws software.amazon.usefix.render.BackendException If the
     *  formatting backend fails
     */
    public FixResult fix(String text) {
        String lineEnding = lineEnding(text);
        List<Segment> segments = Segmenter.segment(text);

        Map<Integer, Scope> scopes = new LinkedHashMap<>();
        Scope[] owners = new Scope[segments.size()];
        List<UnresolvedConflict> unresolved = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (segment instanceof Segment.ImportBlock block) {
                owners[i] = scopeFor(scopes, block.scope(), i, block.indentation());
                owners[i].forest.mergeFrom(block.forest());
            } else if (segment instanceof Segment.ConflictBlock block) {
                Result<ImportForest, UnresolvedConflict> result = ConflictResolver.resolve(block);
                if (result.isOk()) {
                    owners[i] = scopeFor(scopes, block.scope(), i, block.indentation());
                    owners[i].forest.mergeFrom(result.unwrap());
                } else {
                    UnresolvedConflict conflict = result.unwrapErr();
                    LOGGER.fine(conflict::describe);
                    unresolved.add(conflict);
                }
            }
        }

        ImportRenderer renderer = new ImportRenderer(options.getStyle(), lineEnding);
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            Scope owner = owners[i];
            if (owner == null) {
                builder.append(segment.text());
            } else if (owner.firstSegment == i) {
                String rendered = render(renderer, owner, lineEnding);
                if (!segment.text().endsWith("\n") && rendered.endsWith(lineEnding)) {
                    rendered = rendered.substring(0, rendered.length() - lineEnding.length());
                }
                builder.append(rendered);
            }
        }

        LOGGER.fine(() -> "Rewrote imports in " + scopes.size() + " scope(s) with the "
                          + options.getBackend() + " backend, "
                          + unresolved.size() + " conflict(s) left unresolved");
        return new FixResult(builder.toString(), unresolved);
    }

    private static Scope scopeFor(Map<Integer, Scope> scopes, int scope, int segment, String indentation) {
        return scopes.computeIfAbsent(scope, id -> new Scope(segment, indentation));
    }

    private String render(ImportRenderer renderer, Scope scope, String lineEnding) {
        if (scope.forest.isEmpty()) {
            return "";
        }
        String formatted = options.getBackend().format(renderer.render(scope.forest)).stripTrailing();
        StringBuilder builder = new StringBuilder();
        for (String line : formatted.split("\r?\n", -1)) {
            if (!line.isBlank()) {
                builder.append(scope.indentation).append(line.stripTrailing());
            }
            builder.append(lineEnding);
        }
        return builder.toString();
    }

    static String lineEnding(String text) {
        int newline = text.indexOf('\n');
        if (newline > 0 && text.charAt(newline - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }

    private static final class Scope {
        private final int firstSegment;
        private final String indentation;
        private final ImportForest forest = ImportForest.empty();

        Scope(int firstSegment, String indentation) {
            this.firstSegment = firstSegment;
            this.indentation = indentation;
        }
    }
}
