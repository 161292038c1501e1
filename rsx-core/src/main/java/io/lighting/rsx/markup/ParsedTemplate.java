package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * Parser output: the markup tree before slot indices are assigned.
 */
public record ParsedTemplate(TemplateKey key, List<TemplateNode> roots, SourceSpan span) {
    public ParsedTemplate {
        Objects.requireNonNull(key, "key");
        roots = List.copyOf(roots);
        Objects.requireNonNull(span, "span");
    }
}
