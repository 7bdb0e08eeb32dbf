/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import software.amazon.usefix.tree.ImportForest;
import software.amazon.usefix.tree.ImportPath;
import software.amazon.usefix.tree.ImportRoot;
import software.amazon.usefix.tree.PathNode;
import software.amazon.usefix.tree.Qualifiers;

/**
 * Turns an {@link ImportForest} back into declarations, in canonical order.
 *
 * <p>Paths are grouped into declarations by root and qualifiers. Declarations
 * are ordered by root category, then unconditional before conditional, then
 * by root and qualifiers, with a blank line wherever the category or the
 * attributes change. Every declaration, including the last, is followed by
 * the line ending. Parsing the output yields the same forest that was
 * rendered.
 */
public final class ImportRenderer {
    private final RenderStyle style;
    private final String lineEnding;

    /**
     * @param style The layout to use
     * @param lineEnding The line ending to use
     */
    public ImportRenderer(RenderStyle style, String lineEnding) {
        this.style = style;
        this.lineEnding = lineEnding;
    }

    /**
     * @param forest The forest to render
     * @return The rendered declarations, or an empty string if the forest is empty
     */
    public String render(ImportForest forest) {
        SortedMap<Declaration, ImportForest> declarations = new TreeMap<>();
        for (ImportPath path : forest.paths()) {
            declarations.computeIfAbsent(new Declaration(path.root(), path.qualifiers()), key -> ImportForest.empty())
                    .insert(path);
        }

        StringBuilder builder = new StringBuilder();
        Declaration previous = null;
        for (Map.Entry<Declaration, ImportForest> entry : declarations.entrySet()) {
            Declaration declaration = entry.getKey();
            if (previous != null && declaration.isSpacedFrom(previous)) {
                builder.append(lineEnding);
            }
            if (style == RenderStyle.GROUPED) {
                grouped(builder, declaration, entry.getValue().roots().get(declaration.root()));
            } else {
                for (ImportPath path : entry.getValue().paths()) {
                    declaration(builder, declaration.qualifiers(), path.pathText());
                }
            }
            previous = declaration;
        }
        return builder.toString();
    }

    private void grouped(StringBuilder builder, Declaration declaration, PathNode node) {
        Qualifiers qualifiers = declaration.qualifiers();
        String prefix = declaration.root().text();
        if (node.isImported()) {
            declaration(builder, qualifiers, prefix);
        }
        for (String alias : node.aliases()) {
            declaration(builder, qualifiers, prefix + " as " + alias);
        }
        List<String> entries = entries(node);
        if (!entries.isEmpty()) {
            declaration(builder, qualifiers, prefix + "::" + group(entries));
        }
    }

    // The entries of a brace group under `node`: each child's own imports,
    // then its nested group, in child order, then the glob.
    private static List<String> entries(PathNode node) {
        List<String> entries = new ArrayList<>();
        for (PathNode child : node.children()) {
            String name = child.segment().name();
            if (child.isImported()) {
                entries.add(name);
            }
            for (String alias : child.aliases()) {
                entries.add(name + " as " + alias);
            }
            List<String> nested = entries(child);
            if (!nested.isEmpty()) {
                entries.add(name + "::" + group(nested));
            }
        }
        if (node.isGlob()) {
            entries.add("*");
        }
        return entries;
    }

    // A single entry is joined onto its prefix, which collapses chains of
    // single-child nodes into one path.
    private static String group(List<String> entries) {
        if (entries.size() == 1) {
            return entries.get(0);
        }
        return "{" + String.join(", ", entries) + "}";
    }

    private void declaration(StringBuilder builder, Qualifiers qualifiers, String path) {
        for (String doc : qualifiers.docs()) {
            for (String line : doc.split("\n", -1)) {
                builder.append(line).append(lineEnding);
            }
        }
        for (String attribute : qualifiers.attributes()) {
            builder.append(attribute).append(lineEnding);
        }
        if (!qualifiers.isPrivate()) {
            builder.append(qualifiers.visibility()).append(' ');
        }
        builder.append("use ").append(path).append(';').append(lineEnding);
    }

    // The declarations a forest is rendered as: one root under one set of
    // qualifiers.
    private record Declaration(ImportRoot root, Qualifiers qualifiers) implements Comparable<Declaration> {
        private static final Comparator<Declaration> ORDER = Comparator
                .comparing((Declaration declaration) -> declaration.root().category())
                .thenComparing(declaration -> declaration.qualifiers().attributes(), Qualifiers::compareLists)
                .thenComparing(Declaration::root)
                .thenComparing(Declaration::qualifiers);

        boolean isSpacedFrom(Declaration other) {
            return root.category() != other.root.category()
                   || !qualifiers.attributes().equals(other.qualifiers.attributes());
        }

        @Override
        public int compareTo(Declaration other) {
            return ORDER.compare(this, other);
        }
    }
}
