/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Everything written before the {@code use} keyword of a declaration: its
 * documentation, its outer attributes, and its visibility.
 *
 * <p>Docs are kept as a sorted set of blocks, one block per documented
 * declaration, so merging the docs of two declarations doesn't depend on the
 * order they are merged in.
 *
 * <p>The natural order puts unconditional declarations first, then orders by
 * attributes, visibility, and docs.
 *
 * @param attributes The non-doc attributes, verbatim, in source order
 * @param visibility The visibility, like {@code pub(crate)}, or the empty
 *  string for a private import
 * @param docs The doc blocks, each the verbatim doc comments and
 *  {@code #[doc]} attributes of one declaration joined by {@code \n}
 */
public record Qualifiers(List<String> attributes, String visibility, List<String> docs)
        implements Comparable<Qualifiers> {
    public static final Qualifiers NONE = new Qualifiers(List.of(), "");

    private static final Comparator<Qualifiers> ORDER = Comparator
            .comparing(Qualifiers::attributes, Qualifiers::compareLists)
            .thenComparing(Qualifiers::visibility)
            .thenComparing(Qualifiers::docs, Qualifiers::compareLists);

    public Qualifiers {
        attributes = List.copyOf(attributes);
        docs = List.copyOf(new TreeSet<>(docs));
    }

    public Qualifiers(List<String> attributes, String visibility) {
        this(attributes, visibility, List.of());
    }

    /**
     * @return Whether this declaration is private
     */
    public boolean isPrivate() {
        return visibility.isEmpty();
    }

    /**
     * @return Whether this declaration is unconditional, i.e. has no
     *  attributes other than docs
     */
    public boolean isUnconditional() {
        return attributes.isEmpty();
    }

    /**
     * Combines the visibility and docs of two declarations of the same item.
     * The more public visibility wins, and docs are unioned. The attributes
     * of {@code this} are kept.
     *
     * @param other The qualifiers to merge in
     * @return The merged qualifiers
     */
    public Qualifiers mergeProperties(Qualifiers other) {
        List<String> mergedDocs = new ArrayList<>(docs);
        mergedDocs.addAll(other.docs);
        return new Qualifiers(attributes, mergeVisibilities(visibility, other.visibility), mergedDocs);
    }

    /**
     * Picks the more public of two visibilities: private, {@code pub(self)},
     * {@code pub(super)}, {@code pub(in ...)} (shorter paths are more
     * public), {@code pub(crate)}, then {@code pub}.
     *
     * @param left A visibility
     * @param right Another visibility
     * @return Whichever of the two is more public
     */
    public static String mergeVisibilities(String left, String right) {
        int result = Integer.compare(publicity(left), publicity(right));
        if (result == 0 && isInPath(left)) {
            result = Integer.compare(segmentCount(right), segmentCount(left));
        }
        if (result == 0) {
            // Equally public but spelled differently; pick one deterministically.
            result = right.compareTo(left);
        }
        return result >= 0 ? left : right;
    }

    private static int publicity(String visibility) {
        if (visibility.isEmpty()) {
            return 0;
        }
        String restriction = restriction(visibility);
        if (restriction == null) {
            return 5;
        }
        return switch (restriction) {
            case "self" -> 1;
            case "super" -> 2;
            case "crate" -> 4;
            default -> 3;
        };
    }

    private static boolean isInPath(String visibility) {
        String restriction = restriction(visibility);
        return restriction != null && restriction.startsWith("in ");
    }

    private static int segmentCount(String visibility) {
        return restriction(visibility).split("::").length;
    }

    // The text inside `pub(...)`, or null for a plain `pub`.
    private static String restriction(String visibility) {
        int open = visibility.indexOf('(');
        if (open < 0) {
            return null;
        }
        return visibility.substring(open + 1, visibility.length() - 1).trim();
    }

    @Override
    public int compareTo(Qualifiers other) {
        return ORDER.compare(this, other);
    }

    /**
     * Compares string lists element by element, with a shorter prefix first,
     * so the unconditional (empty) attribute list sorts first.
     *
     * @param left The first list
     * @param right The second list
     * @return The comparison result
     */
    public static int compareLists(List<String> left, List<String> right) {
        Iterator<String> l = left.iterator();
        Iterator<String> r = right.iterator();
        while (l.hasNext() && r.hasNext()) {
            int result = l.next().compareTo(r.next());
            if (result != 0) {
                return result;
            }
        }
        return Boolean.compare(l.hasNext(), r.hasNext());
    }
}
