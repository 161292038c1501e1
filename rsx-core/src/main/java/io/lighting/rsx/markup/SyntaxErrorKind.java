package io.lighting.rsx.markup;

public enum SyntaxErrorKind {
    UNEXPECTED_TOKEN,
    UNCLOSED_ELEMENT,
    INVALID_ATTRIBUTE_SYNTAX,
    UNSUPPORTED_CONSTRUCT
}
