/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.render;

final class BuiltinBackend implements FormattingBackend {
    static final BuiltinBackend INSTANCE = new BuiltinBackend();

    private BuiltinBackend() {
    }

    @Override
    public String format(String text) {
        return text;
    }

    @Override
    public String toString() {
        return "builtin";
    }
}
