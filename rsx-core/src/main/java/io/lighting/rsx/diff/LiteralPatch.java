package io.lighting.rsx.diff;

import io.lighting.rsx.markup.SourceSpan;
import java.util.Objects;

/**
 * A static text change promoted to a patchable value.
 * <p>
 * {@code location} addresses the literal by node path: child indices from the
 * root separated by {@code /}, then {@code #text[n]} for the n-th text segment
 * or {@code @name} for an attribute. Conditional branches appear as
 * {@code if[n]} and loop bodies as {@code for}, e.g. {@code /0/if[1]/2/@class}.
 */
public record LiteralPatch(String location, String oldText, String newText, SourceSpan span) {
    public LiteralPatch {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(oldText, "oldText");
        Objects.requireNonNull(newText, "newText");
        Objects.requireNonNull(span, "span");
    }
}
