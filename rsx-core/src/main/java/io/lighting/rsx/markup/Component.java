package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * A component invocation such as {@code <ui::Button label={text}/>}. Props are
 * parsed exactly like element attributes.
 */
public record Component(
    List<String> path,
    List<Attribute> props,
    List<TemplateNode> children,
    SourceSpan span
) implements TemplateNode {
    public Component {
        path = List.copyOf(path);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Component path must not be empty");
        }
        Objects.requireNonNull(span, "span");
        props = List.copyOf(props);
        children = List.copyOf(children);
    }

    public String name() {
        return String.join("::", path);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPONENT;
    }
}
