/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One node of the import prefix tree. A node exclusively owns its children,
 * which are keyed by segment and kept in canonical order.
 *
 * <p>Whether the node's own prefix is imported (plainly, under aliases, or as
 * a glob) is independent of whether it has children: {@code a} and
 * {@code a::b} can both be imported at once. Each such leaf records the
 * declarations it is imported with, merged so the same leaf is never
 * declared twice under the same conditions.
 */
public final class PathNode {
    private final PathSegment segment;
    private final SortedMap<PathSegment, PathNode> children = new TreeMap<>();
    private final SortedMap<ImportLeaf, QualifierSet> leaves = new TreeMap<>();

    PathNode(PathSegment segment) {
        this.segment = segment;
    }

    /**
     * @return The segment this node is keyed by
     */
    public PathSegment segment() {
        return segment;
    }

    /**
     * @return Whether this exact prefix is imported under its own name
     */
    public boolean isImported() {
        return leaves.containsKey(ImportLeaf.plain());
    }

    /**
     * @return The local names this exact prefix is imported under, in
     *  canonical order
     */
    public SortedSet<String> aliases() {
        SortedSet<String> aliases = new TreeSet<>();
        for (ImportLeaf leaf : leaves.keySet()) {
            if (leaf.kind() == ImportLeaf.Kind.ALIAS) {
                aliases.add(leaf.alias());
            }
        }
        return aliases;
    }

    /**
     * @return Whether everything under this prefix is glob imported
     */
    public boolean isGlob() {
        return leaves.containsKey(ImportLeaf.glob());
    }

    /**
     * @return The ways this exact prefix is imported, in canonical order
     */
    public Set<ImportLeaf> leaves() {
        return Collections.unmodifiableSet(leaves.keySet());
    }

    /**
     * @param leaf One of this node's {@link #leaves()}
     * @return Every declaration {@code leaf} is imported with, or an empty
     *  list if it isn't imported here
     */
    public List<Qualifiers> qualifiers(ImportLeaf leaf) {
        QualifierSet set = leaves.get(leaf);
        return set == null ? List.of() : set.qualifiers();
    }

    /**
     * @return Whether this node has any children
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * @return The children of this node, in canonical order
     */
    public Collection<PathNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * @param childSegment The segment of the child to get
     * @return The child, or {@code null} if there is none
     */
    public PathNode child(PathSegment childSegment) {
        return children.get(childSegment);
    }

    PathNode childOrCreate(PathSegment childSegment) {
        return children.computeIfAbsent(childSegment, PathNode::new);
    }

    void apply(ImportLeaf leaf, Qualifiers qualifiers) {
        leaves.computeIfAbsent(leaf, key -> new QualifierSet()).add(qualifiers);
    }

    // Only this node's own leaves, not its children.
    void absorb(PathNode other) {
        for (Map.Entry<ImportLeaf, QualifierSet> entry : other.leaves.entrySet()) {
            leaves.computeIfAbsent(entry.getKey(), key -> new QualifierSet()).addAll(entry.getValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathNode other)) {
            return false;
        }
        return segment.equals(other.segment)
               && leaves.equals(other.leaves)
               && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segment, leaves, children);
    }

    @Override
    public String toString() {
        return "PathNode{"
               + "segment=" + segment
               + ", leaves=" + leaves
               + ", children=" + children.values()
               + '}';
    }
}
