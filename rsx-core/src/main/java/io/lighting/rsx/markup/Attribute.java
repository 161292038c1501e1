package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * An element attribute or component prop.
 *
 * @param namespace namespace prefix ({@code xlink} in {@code xlink:href}), or {@code null}
 */
public record Attribute(String name, String namespace, AttributeValue value, SourceSpan span) {
    public Attribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(span, "span");
    }

    public String qualifiedName() {
        return namespace == null ? name : namespace + ":" + name;
    }

    public boolean isDynamic() {
        return value instanceof AttributeValue.Dynamic;
    }
}
