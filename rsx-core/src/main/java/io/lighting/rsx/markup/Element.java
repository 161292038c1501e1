package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * A plain markup element such as {@code <div class="x">...</div>}.
 *
 * @param namespace namespace prefix ({@code svg} in {@code <svg:rect/>}), or {@code null}
 */
public record Element(
    String tag,
    String namespace,
    List<Attribute> attributes,
    List<TemplateNode> children,
    SourceSpan span
) implements TemplateNode {
    public Element {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(span, "span");
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }

    public String qualifiedTag() {
        return namespace == null ? tag : namespace + ":" + tag;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELEMENT;
    }
}
