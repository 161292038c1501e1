package io.lighting.rsx.markup;

import java.util.Objects;

public sealed interface TextSegment {
    SourceSpan span();

    record Literal(String text, SourceSpan span) implements TextSegment {
        public Literal {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(span, "span");
        }
    }

    record Dynamic(DynamicSlot slot) implements TextSegment {
        public Dynamic {
            Objects.requireNonNull(slot, "slot");
        }

        @Override
        public SourceSpan span() {
            return slot.span();
        }
    }
}
