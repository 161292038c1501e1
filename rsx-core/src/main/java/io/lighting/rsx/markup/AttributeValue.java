package io.lighting.rsx.markup;

import java.util.Objects;

public sealed interface AttributeValue {

    record Literal(String text) implements AttributeValue {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    record Dynamic(DynamicSlot slot) implements AttributeValue {
        public Dynamic {
            Objects.requireNonNull(slot, "slot");
        }
    }
}
