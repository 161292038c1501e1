package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Source range of a node, attribute or slot. {@code end} is exclusive.
 */
public record SourceSpan(String file, SourcePosition start, SourcePosition end) {
    public SourceSpan {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span end precedes start: " + start + " > " + end);
        }
    }

    @Override
    public String toString() {
        return file + ":" + start;
    }
}
