package io.lighting.rsx.diff;

import java.util.Objects;

/**
 * Differ settings. Immutable once built.
 */
public final class DiffOptions {
    private static final DiffOptions DEFAULTS = builder().build();

    private final LiteralPolicy literalPolicy;

    private DiffOptions(Builder builder) {
        this.literalPolicy = builder.literalPolicy;
    }

    public static DiffOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public LiteralPolicy literalPolicy() {
        return literalPolicy;
    }

    public static final class Builder {
        private LiteralPolicy literalPolicy = LiteralPolicy.PATCH_IN_PLACE;

        public Builder literalPolicy(LiteralPolicy literalPolicy) {
            this.literalPolicy = Objects.requireNonNull(literalPolicy, "literalPolicy");
            return this;
        }

        public DiffOptions build() {
            return new DiffOptions(this);
        }
    }
}
