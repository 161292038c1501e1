package io.lighting.rsx.diff;

import io.lighting.rsx.markup.SourceSpan;
import java.util.List;
import java.util.Objects;

/**
 * Result of comparing two parses of the same template.
 */
public sealed interface Verdict {

    boolean isHotReloadable();

    /**
     * The edit only touched dynamic expressions (and, depending on the
     * {@link LiteralPolicy}, literal text); the running program can be patched.
     *
     * @param slotMapping one entry per slot of the new template, ordered by new index
     */
    record HotReloadable(List<SlotMapping> slotMapping, List<LiteralPatch> literalPatches) implements Verdict {
        public HotReloadable {
            slotMapping = List.copyOf(slotMapping);
            literalPatches = List.copyOf(literalPatches);
        }

        /**
         * True when every slot maps onto itself and nothing changed.
         */
        public boolean isIdentity() {
            if (!literalPatches.isEmpty()) {
                return false;
            }
            for (SlotMapping mapping : slotMapping) {
                if (mapping.newIndex() != mapping.oldIndex() || mapping.isUpdated()) {
                    return false;
                }
            }
            return true;
        }

        public boolean hasChanges() {
            return !isIdentity();
        }

        @Override
        public boolean isHotReloadable() {
            return true;
        }
    }

    /**
     * The template's shape changed; fall back to a regular build.
     *
     * @param mismatchSpan where the first difference was found
     */
    record NeedsFullRebuild(String reason, SourceSpan mismatchSpan) implements Verdict {
        public NeedsFullRebuild {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(mismatchSpan, "mismatchSpan");
        }

        @Override
        public boolean isHotReloadable() {
            return false;
        }
    }
}
