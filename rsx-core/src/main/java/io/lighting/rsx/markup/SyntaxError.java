package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Why and where a markup invocation failed to parse.
 */
public record SyntaxError(SyntaxErrorKind kind, String message, SourceSpan span) {
    public SyntaxError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(span, "span");
    }

    public String describe() {
        return kind + " at " + span + ": " + message;
    }
}
