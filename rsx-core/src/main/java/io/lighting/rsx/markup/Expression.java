package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * A child placeholder like {@code {items.len()}} that renders whatever the
 * expression evaluates to.
 */
public record Expression(DynamicSlot slot, SourceSpan span) implements TemplateNode {
    public Expression {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(span, "span");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION;
    }
}
