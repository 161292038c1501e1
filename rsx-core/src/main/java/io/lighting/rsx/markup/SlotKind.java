package io.lighting.rsx.markup;

/**
 * Where a dynamic value sits in the markup.
 */
public enum SlotKind {
    ATTRIBUTE_VALUE,
    TEXT_INTERPOLATION,
    NODE_EXPRESSION,
    COMPONENT_PROP,
    CONDITIONAL_GUARD,
    LOOP_ITERATOR
}
