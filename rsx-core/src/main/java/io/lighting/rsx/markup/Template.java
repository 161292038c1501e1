package io.lighting.rsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * A parsed markup invocation with its dynamic slot table.
 * <p>
 * The roots form a fragment and need not be a single element. {@code slots}
 * lists every dynamic position in pre-order; {@code slots.get(i).index() == i}.
 * Instances are immutable and are produced by {@link SlotAssigner}.
 */
public record Template(TemplateKey key, List<TemplateNode> roots, List<DynamicSlot> slots, SourceSpan span) {
    public Template {
        Objects.requireNonNull(key, "key");
        roots = List.copyOf(roots);
        slots = List.copyOf(slots);
        Objects.requireNonNull(span, "span");
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).index() != i) {
                throw new IllegalArgumentException(
                    "Slot table out of order at " + i + ": index " + slots.get(i).index()
                );
            }
        }
    }

    public DynamicSlot slot(int index) {
        return slots.get(index);
    }

    public boolean isStatic() {
        return slots.isEmpty();
    }
}
