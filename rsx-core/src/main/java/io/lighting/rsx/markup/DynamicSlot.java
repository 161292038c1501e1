package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * A position holding a runtime-evaluated expression.
 * <p>
 * The parser creates slots with {@link #UNASSIGNED} indices; {@link SlotAssigner}
 * hands out the final, sequential indices. {@code expression} is the normalised
 * source text and is what the differ compares.
 */
public record DynamicSlot(int index, SlotKind kind, String expression, SourceSpan span) {
    public static final int UNASSIGNED = -1;

    public DynamicSlot {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(span, "span");
        if (index < UNASSIGNED) {
            throw new IllegalArgumentException("Invalid slot index: " + index);
        }
    }

    static DynamicSlot unassigned(SlotKind kind, String expression, SourceSpan span) {
        return new DynamicSlot(UNASSIGNED, kind, expression, span);
    }

    public boolean isAssigned() {
        return index != UNASSIGNED;
    }

    DynamicSlot withIndex(int newIndex) {
        return new DynamicSlot(newIndex, kind, expression, span);
    }
}
