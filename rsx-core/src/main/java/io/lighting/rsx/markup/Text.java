package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * A run of text mixing literal segments and interpolated expressions.
 */
public record Text(List<TextSegment> segments, SourceSpan span) implements TemplateNode {
    public Text {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Text must have at least one segment");
        }
        Objects.requireNonNull(span, "span");
    }

    public boolean isStatic() {
        return segments.stream().allMatch(segment -> segment instanceof TextSegment.Literal);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }
}
