package io.lighting.rsx.markup;

/**
 * Parser settings. Immutable once built.
 */
public final class ParserOptions {
    /**
     * Upper bound for {@link Builder#maxDepth(int)}; keeps the recursive descent well
     * inside a default thread stack.
     */
    public static final int MAX_DEPTH_LIMIT = 1024;

    private static final ParserOptions DEFAULTS = builder().build();

    /**
     * Maximum nesting of elements, components and control bodies.
     */
    private final int maxDepth;
    /**
     * Whether {@code ns:name} tags and attributes are accepted.
     */
    private final boolean allowNamespaces;

    private ParserOptions(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.allowNamespaces = builder.allowNamespaces;
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean allowNamespaces() {
        return allowNamespaces;
    }

    public static final class Builder {
        private int maxDepth = 256;
        private boolean allowNamespaces = true;

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1 || maxDepth > MAX_DEPTH_LIMIT) {
                throw new IllegalArgumentException(
                    "maxDepth must be between 1 and " + MAX_DEPTH_LIMIT + ": " + maxDepth
                );
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder allowNamespaces(boolean allowNamespaces) {
            this.allowNamespaces = allowNamespaces;
            return this;
        }

        public ParserOptions build() {
            return new ParserOptions(this);
        }
    }
}
