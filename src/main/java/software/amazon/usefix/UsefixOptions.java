/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import software.amazon.usefix.render.FormattingBackend;
import software.amazon.usefix.render.RenderStyle;

/**
 * Read-only configuration for an {@link ImportFixer}.
 */
public final class UsefixOptions {
    private final RenderStyle style;
    private final FormattingBackend backend;

    private UsefixOptions(Builder builder) {
        this.style = builder.style;
        this.backend = builder.backend;
    }

    public RenderStyle getStyle() {
        return this.style;
    }

    public FormattingBackend getBackend() {
        return this.backend;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return Options with the flat style and the builtin backend
     */
    public static UsefixOptions defaults() {
        return builder().build();
    }

    public static final class Builder {
        private RenderStyle style = RenderStyle.FLAT;
        private FormattingBackend backend = FormattingBackend.builtin();

        private Builder() {
        }

        public Builder setStyle(RenderStyle style) {
            this.style = style;
            return this;
        }

        public Builder setBackend(FormattingBackend backend) {
            this.backend = backend;
            return this;
        }

        public UsefixOptions build() {
            return new UsefixOptions(this);
        }
    }
}
