package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * A {@code for pattern in iterable} block. The iterator slot carries the whole
 * header, so renaming the loop variable is an expression edit.
 */
public record Loop(String pattern, DynamicSlot iterator, TemplateBody body, SourceSpan span)
    implements TemplateNode {
    public Loop {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(iterator, "iterator");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(span, "span");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }
}
