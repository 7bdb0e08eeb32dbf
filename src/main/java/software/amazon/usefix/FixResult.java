/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import java.util.List;
import software.amazon.usefix.conflict.UnresolvedConflict;

/**
 * The outcome of fixing one file.
 *
 * @param text The transformed text
 * @param unresolved Conflicts that were left in place, in file order
 */
public record FixResult(String text, List<UnresolvedConflict> unresolved) {
    public FixResult {
        unresolved = List.copyOf(unresolved);
    }
}
