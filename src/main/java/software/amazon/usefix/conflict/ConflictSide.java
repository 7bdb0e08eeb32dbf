/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.conflict;

/**
 * Which part of a conflict kept it from being resolved.
 */
public enum ConflictSide {
    /**
     * The side between the start marker and the separator.
     */
    OURS,

    /**
     * The side between the separator and the end marker.
     */
    THEIRS,

    /**
     * The conflict as a whole, for problems that aren't specific to one side.
     */
    NEITHER
}
