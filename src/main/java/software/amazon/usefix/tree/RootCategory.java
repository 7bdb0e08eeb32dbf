/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.Set;

/**
 * The groups top-level import roots are sorted into, in canonical order.
 */
public enum RootCategory {
    /**
     * {@code std}, {@code core}, and {@code alloc}.
     */
    STANDARD_LIBRARY,

    /**
     * Any other crate name.
     */
    EXTERNAL,

    /**
     * {@code crate::...}.
     */
    CRATE,

    /**
     * {@code self::...}.
     */
    CURRENT_MODULE,

    /**
     * {@code super::...}.
     */
    PARENT_MODULE,

    /**
     * {@code Self::...}.
     */
    SELF_TYPE;

    private static final Set<String> STANDARD_LIBRARY_ROOTS = Set.of("std", "core", "alloc");

    /**
     * @param segment The first segment of an import path
     * @return The category the segment's root belongs to
     */
    public static RootCategory of(PathSegment segment) {
        if (STANDARD_LIBRARY_ROOTS.contains(segment.name())) {
            return STANDARD_LIBRARY;
        } else if (segment.equals(PathSegment.CRATE)) {
            return CRATE;
        } else if (segment.equals(PathSegment.SELF)) {
            return CURRENT_MODULE;
        } else if (segment.equals(PathSegment.SUPER)) {
            return PARENT_MODULE;
        } else if (segment.equals(PathSegment.SELF_TYPE)) {
            return SELF_TYPE;
        }
        return EXTERNAL;
    }
}
