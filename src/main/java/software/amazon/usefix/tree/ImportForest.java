/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The canonical structural representation of a set of imports: a prefix tree
 * per {@link ImportRoot}, with at most one tree for any given root.
 *
 * <p>Building a forest never loses an import. Inserting a path that is
 * already present only merges its qualifiers (see {@link QualifierSet}), and
 * inserting the same path under a different alias records both aliases.
 * {@link #merge(ImportForest, ImportForest)} is the union of two forests, so
 * it is commutative and idempotent.
 */
public final class ImportForest {
    private final SortedMap<ImportRoot, PathNode> roots = new TreeMap<>();

    /**
     * @return A new, empty forest
     */
    public static ImportForest empty() {
        return new ImportForest();
    }

    /**
     * @param paths The paths to insert
     * @return A new forest containing exactly {@code paths}
     */
    public static ImportForest of(Iterable<ImportPath> paths) {
        ImportForest forest = new ImportForest();
        for (ImportPath path : paths) {
            forest.insert(path);
        }
        return forest;
    }

    /**
     * Computes the union of two forests, without modifying either.
     *
     * @param left The first forest
     * @param right The second forest
     * @return A new forest containing every import of {@code left} and {@code right}
     */
    public static ImportForest merge(ImportForest left, ImportForest right) {
        ImportForest merged = new ImportForest();
        merged.mergeFrom(left);
        merged.mergeFrom(right);
        return merged;
    }

    /**
     * Walks from the path's root, creating missing nodes along the way, and
     * marks the last node with the path's leaf and qualifiers.
     *
     * @param path The path to insert
     */
    public void insert(ImportPath path) {
        ImportRoot key = path.root();
        PathNode node = roots.computeIfAbsent(key, root -> new PathNode(root.segment()));
        for (PathSegment segment : path.segments()) {
            node = node.childOrCreate(segment);
        }
        node.apply(path.leaf(), path.qualifiers());
    }

    /**
     * Adds every import of {@code other} to this forest. {@code other} is left
     * untouched and no nodes are shared between the two forests afterwards.
     *
     * @param other The forest to union into this one
     */
    public void mergeFrom(ImportForest other) {
        // Explicit work stack of (target, source) pairs, so deeply nested
        // paths can't overflow the call stack.
        Deque<PathNode[]> work = new ArrayDeque<>();
        for (Map.Entry<ImportRoot, PathNode> entry : other.roots.entrySet()) {
            PathNode target = roots.computeIfAbsent(entry.getKey(), root -> new PathNode(root.segment()));
            work.push(new PathNode[] {target, entry.getValue()});
        }

        while (!work.isEmpty()) {
            PathNode[] pair = work.pop();
            PathNode target = pair[0];
            PathNode source = pair[1];
            target.absorb(source);
            for (PathNode sourceChild : source.children()) {
                work.push(new PathNode[] {target.childOrCreate(sourceChild.segment()), sourceChild});
            }
        }
    }

    /**
     * @return Whether this forest contains no imports
     */
    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /**
     * @return The roots of this forest and their trees, in canonical order
     */
    public SortedMap<ImportRoot, PathNode> roots() {
        return Collections.unmodifiableSortedMap(roots);
    }

    /**
     * Flattens this forest into one path per declaration of each plain
     * import, alias, and glob, in canonical order: roots in
     * {@link ImportRoot} order; within a node, its own plain import, then its
     * aliases, then its children depth-first, then its glob.
     *
     * @return All the imported paths of this forest
     */
    public List<ImportPath> paths() {
        List<ImportPath> paths = new ArrayList<>();
        for (Map.Entry<ImportRoot, PathNode> entry : roots.entrySet()) {
            collect(entry.getKey(), new ArrayList<>(), entry.getValue(), paths);
        }
        return paths;
    }

    private static void collect(ImportRoot root, List<PathSegment> prefix, PathNode node, List<ImportPath> out) {
        ImportLeaf glob = ImportLeaf.glob();
        for (ImportLeaf leaf : node.leaves()) {
            if (!leaf.equals(glob)) {
                addLeaf(root, prefix, node, leaf, out);
            }
        }
        for (PathNode child : node.children()) {
            prefix.add(child.segment());
            collect(root, prefix, child, out);
            prefix.remove(prefix.size() - 1);
        }
        if (node.isGlob()) {
            addLeaf(root, prefix, node, glob, out);
        }
    }

    private static void addLeaf(
            ImportRoot root,
            List<PathSegment> prefix,
            PathNode node,
            ImportLeaf leaf,
            List<ImportPath> out
    ) {
        for (Qualifiers qualifiers : node.qualifiers(leaf)) {
            out.add(new ImportPath(root, prefix, leaf, qualifiers));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ImportForest other && roots.equals(other.roots);
    }

    @Override
    public int hashCode() {
        return roots.hashCode();
    }

    @Override
    public String toString() {
        return "ImportForest" + paths();
    }
}
