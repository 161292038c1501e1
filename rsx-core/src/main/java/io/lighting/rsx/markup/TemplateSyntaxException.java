package io.lighting.rsx.markup;

/**
 * Thrown when markup cannot be parsed. Fatal only for the invocation being
 * parsed; the {@link SyntaxError} carries the precise location.
 */
public final class TemplateSyntaxException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final transient SyntaxError error;

    public TemplateSyntaxException(SyntaxError error) {
        super(error.describe());
        this.error = error;
    }

    public SyntaxError error() {
        return error;
    }

    public SyntaxErrorKind kind() {
        return error.kind();
    }
}
