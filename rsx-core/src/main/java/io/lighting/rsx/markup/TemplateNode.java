package io.lighting.rsx.markup;

/**
 * A node of the markup tree. Consumers dispatch over the permitted variants;
 * the set is closed.
 */
public sealed interface TemplateNode permits Element, Text, Expression, Component, Conditional, Loop {
    NodeKind kind();

    SourceSpan span();
}
