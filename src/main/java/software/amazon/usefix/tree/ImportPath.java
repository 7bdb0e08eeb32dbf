/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A single, fully-qualified imported item: the flat form of one leaf, alias,
 * or glob of an {@link ImportForest}, together with the qualifiers of the
 * declaration it comes from.
 *
 * @param root The root the path starts at
 * @param segments The segments following the root segment, possibly empty
 * @param leaf How the path ends
 * @param qualifiers The docs, attributes, and visibility of the declaration
 */
public record ImportPath(ImportRoot root, List<PathSegment> segments, ImportLeaf leaf, Qualifiers qualifiers) {
    public ImportPath {
        segments = List.copyOf(segments);
    }

    public ImportPath(ImportRoot root, List<PathSegment> segments, ImportLeaf leaf) {
        this(root, segments, leaf, Qualifiers.NONE);
    }

    /**
     * Convenience for building unqualified paths, mostly in tests.
     *
     * @param path The path, like {@code std::io::Read}
     * @param leaf How the path ends
     * @return The import path
     */
    public static ImportPath of(String path, ImportLeaf leaf) {
        String[] parts = path.split("::");
        List<PathSegment> segments = new ArrayList<>(parts.length - 1);
        for (int i = 1; i < parts.length; i++) {
            segments.add(PathSegment.of(parts[i]));
        }
        return new ImportPath(ImportRoot.of(parts[0]), segments, leaf);
    }

    /**
     * @return The path text, without the {@code use} keyword, qualifiers, or
     *  terminator, like {@code ::a::b as c}
     */
    public String pathText() {
        StringBuilder builder = new StringBuilder(root.text());
        for (PathSegment segment : segments) {
            builder.append("::").append(segment.name());
        }
        switch (leaf.kind()) {
            case GLOB -> builder.append("::*");
            case ALIAS -> builder.append(" as ").append(leaf.alias());
            default -> {
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return pathText();
    }
}
