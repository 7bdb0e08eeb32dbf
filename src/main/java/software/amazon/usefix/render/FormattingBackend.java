/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.render;

/**
 * Lays out rendered declarations before they're written back into a file.
 */
public interface FormattingBackend {
    /**
     * @param text Declarations in canonical form
     * @return The formatted declarations
     * @throws BackendException If the text couldn't be formatted
     */
    String format(String text);

    /**
     * @return A backend that leaves the canonical form as is
     */
    static FormattingBackend builtin() {
        return BuiltinBackend.INSTANCE;
    }
}
