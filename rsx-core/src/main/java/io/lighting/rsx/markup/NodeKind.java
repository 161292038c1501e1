package io.lighting.rsx.markup;

public enum NodeKind {
    ELEMENT,
    TEXT,
    EXPRESSION,
    COMPONENT,
    CONDITIONAL,
    LOOP
}
