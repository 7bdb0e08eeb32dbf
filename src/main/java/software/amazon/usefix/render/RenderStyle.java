/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.render;

/**
 * How an {@link ImportRenderer} lays out declarations.
 */
public enum RenderStyle {
    /**
     * One fully-qualified declaration per import, alias, and glob.
     */
    FLAT,

    /**
     * One declaration per root, with nested brace groups.
     */
    GROUPED
}
