/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The qualifiers one imported item is declared with, normalized so the item
 * is never declared twice under the same conditions:
 *
 * <ul>
 *     <li>Declarations with identical attributes are merged into one, keeping
 *     the more public visibility and the union of their docs.</li>
 *     <li>If any declaration is unconditional, every declaration is merged
 *     into a single unconditional one, since an item imported both
 *     unconditionally and under a condition would be imported twice.</li>
 * </ul>
 *
 * <p>The result of adding qualifiers doesn't depend on the order they are
 * added in.
 */
final class QualifierSet {
    private final SortedMap<List<String>, Qualifiers> byAttributes = new TreeMap<>(Qualifiers::compareLists);

    void add(Qualifiers qualifiers) {
        Qualifiers unconditional = byAttributes.get(List.<String>of());
        if (unconditional != null) {
            byAttributes.put(List.of(), unconditional.mergeProperties(qualifiers));
        } else if (qualifiers.isUnconditional()) {
            Qualifiers merged = qualifiers;
            for (Qualifiers existing : byAttributes.values()) {
                merged = merged.mergeProperties(existing);
            }
            byAttributes.clear();
            byAttributes.put(List.of(), merged);
        } else {
            byAttributes.merge(qualifiers.attributes(), qualifiers, Qualifiers::mergeProperties);
        }
    }

    void addAll(QualifierSet other) {
        for (Qualifiers qualifiers : other.byAttributes.values()) {
            add(qualifiers);
        }
    }

    /**
     * @return Every declaration of the item, in attribute order
     */
    List<Qualifiers> qualifiers() {
        return new ArrayList<>(byAttributes.values());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof QualifierSet other && byAttributes.equals(other.byAttributes));
    }

    @Override
    public int hashCode() {
        return byAttributes.hashCode();
    }

    @Override
    public String toString() {
        return byAttributes.values().toString();
    }
}
