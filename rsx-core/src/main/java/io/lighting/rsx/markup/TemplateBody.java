package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * Nested template forming the body of a conditional branch or a loop. Its
 * slots live in the index space of the enclosing {@link Template}.
 */
public record TemplateBody(List<TemplateNode> nodes, SourceSpan span) {
    public TemplateBody {
        nodes = List.copyOf(nodes);
        Objects.requireNonNull(span, "span");
    }
}
