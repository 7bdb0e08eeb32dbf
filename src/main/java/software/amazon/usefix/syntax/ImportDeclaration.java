/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import java.util.List;
import software.amazon.usefix.tree.ImportPath;

/**
 * A single parsed {@code use} declaration.
 *
 * @param paths Every path the declaration imports, flattened, each carrying
 *  the declaration's qualifiers
 * @param length The number of characters the declaration spans in the
 *  parsed text, from its first doc comment or attribute up to and including
 *  its {@code ;}
 */
public record ImportDeclaration(List<ImportPath> paths, int length) {
    public ImportDeclaration {
        paths = List.copyOf(paths);
    }
}
