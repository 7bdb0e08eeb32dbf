/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.Comparator;

/**
 * A single {@code ::}-separated component of an import path, either an
 * identifier (possibly raw, like {@code r#type}) or one of the reserved path
 * keywords.
 *
 * @param name The segment exactly as written
 */
public record PathSegment(String name) implements Comparable<PathSegment> {
    public static final PathSegment CRATE = new PathSegment("crate");
    public static final PathSegment SELF = new PathSegment("self");
    public static final PathSegment SUPER = new PathSegment("super");
    public static final PathSegment SELF_TYPE = new PathSegment("Self");

    private static final String RAW_PREFIX = "r#";
    private static final Comparator<PathSegment> ORDER = Comparator
            .comparing(PathSegment::sortKey)
            .thenComparing(PathSegment::name);

    /**
     * @param name The segment text
     * @return The segment
     */
    public static PathSegment of(String name) {
        return new PathSegment(name);
    }

    /**
     * @return The key used to order sibling segments, which ignores any raw
     *  identifier prefix
     */
    public String sortKey() {
        return name.startsWith(RAW_PREFIX) ? name.substring(RAW_PREFIX.length()) : name;
    }

    @Override
    public int compareTo(PathSegment other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name;
    }
}
