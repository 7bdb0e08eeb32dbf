/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.Comparator;

/**
 * Identifies one root of an {@link ImportForest}: the first segment of a
 * path, and whether it was written with a leading {@code ::}. Qualifiers are
 * not part of a root, so every import of {@code a::...} shares the root
 * {@code a} however it is declared.
 *
 * <p>The natural order of roots is by {@link RootCategory}, then unrooted
 * before rooted, then by name.
 *
 * @param rooted Whether the path was written with a leading {@code ::}
 * @param segment The first segment of the path
 */
public record ImportRoot(boolean rooted, PathSegment segment) implements Comparable<ImportRoot> {
    private static final Comparator<ImportRoot> CANONICAL_ORDER = Comparator
            .comparing(ImportRoot::category)
            .thenComparing(ImportRoot::rooted)
            .thenComparing(ImportRoot::segment);

    /**
     * @param segment The first segment of the path
     * @return An unrooted root
     */
    public static ImportRoot of(String segment) {
        return new ImportRoot(false, PathSegment.of(segment));
    }

    /**
     * @return The category this root is grouped into
     */
    public RootCategory category() {
        return RootCategory.of(segment);
    }

    /**
     * @return The root as written, like {@code ::std}
     */
    public String text() {
        return rooted ? "::" + segment.name() : segment.name();
    }

    @Override
    public int compareTo(ImportRoot other) {
        return CANONICAL_ORDER.compare(this, other);
    }
}
