package io.lighting.rsx.reload;

import io.lighting.rsx.diff.LiteralPatch;
import io.lighting.rsx.diff.SlotMapping;
import io.lighting.rsx.diff.Verdict;
import io.lighting.rsx.markup.SourceSpan;
import io.lighting.rsx.markup.TemplateKey;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of reconciling one template after an edit, ready to be handed to
 * a transport.
 */
public record ReconciliationRecord(TemplateKey templateKey, Verdict verdict) {
    public ReconciliationRecord {
        Objects.requireNonNull(templateKey, "templateKey");
        Objects.requireNonNull(verdict, "verdict");
    }

    public static ReconciliationRecord rebuild(TemplateKey templateKey, String reason, SourceSpan span) {
        return new ReconciliationRecord(templateKey, new Verdict.NeedsFullRebuild(reason, span));
    }

    public boolean hotReloadable() {
        return verdict.isHotReloadable();
    }

    /**
     * Slot remapping of a hot-reloadable edit; empty when a rebuild is needed.
     */
    public List<SlotMapping> slotMapping() {
        if (verdict instanceof Verdict.HotReloadable reloadable) {
            return reloadable.slotMapping();
        }
        return List.of();
    }

    public List<LiteralPatch> literalPatches() {
        if (verdict instanceof Verdict.HotReloadable reloadable) {
            return reloadable.literalPatches();
        }
        return List.of();
    }

    public Optional<SourceSpan> mismatchSpan() {
        if (verdict instanceof Verdict.NeedsFullRebuild rebuild) {
            return Optional.of(rebuild.mismatchSpan());
        }
        return Optional.empty();
    }

    public Optional<String> rebuildReason() {
        if (verdict instanceof Verdict.NeedsFullRebuild rebuild) {
            return Optional.of(rebuild.reason());
        }
        return Optional.empty();
    }
}
