/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.Comparator;

/**
 * How an {@link ImportPath} ends. Leaves are ordered plain import first,
 * then aliases by name, then the glob.
 *
 * @param kind Whether the path is imported as is, renamed, or globbed
 * @param alias The local name for {@link Kind#ALIAS}, otherwise {@code null}
 */
public record ImportLeaf(Kind kind, String alias) implements Comparable<ImportLeaf> {
    private static final Comparator<ImportLeaf> ORDER = Comparator
            .comparing(ImportLeaf::kind)
            .thenComparing(ImportLeaf::alias, Comparator.nullsFirst(Comparator.naturalOrder()));
    private static final ImportLeaf PLAIN = new ImportLeaf(Kind.PLAIN, null);
    private static final ImportLeaf GLOB = new ImportLeaf(Kind.GLOB, null);

    public enum Kind {
        /**
         * {@code use a::b;}
         */
        PLAIN,

        /**
         * {@code use a::b as c;}
         */
        ALIAS,

        /**
         * {@code use a::b::*;}
         */
        GLOB
    }

    public static ImportLeaf plain() {
        return PLAIN;
    }

    public static ImportLeaf glob() {
        return GLOB;
    }

    public static ImportLeaf alias(String alias) {
        return new ImportLeaf(Kind.ALIAS, alias);
    }

    @Override
    public int compareTo(ImportLeaf other) {
        return ORDER.compare(this, other);
    }
}
