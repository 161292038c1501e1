package io.lighting.rsx.reload;

import io.lighting.rsx.diff.SlotMapping;
import io.lighting.rsx.markup.SyntaxError;
import io.lighting.rsx.markup.TemplateKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.LoggerFactory;

/**
 * Readable trace of hot-reload decisions.
 * <p>
 * Each event becomes one line such as
 * {@code RSX: [HOT_RELOAD] src/View.java:12:9 slots=2 patches=0} or
 * {@code RSX: [REBUILD] src/View.java:12:9 Child count at /0 changed from 1 to 2 (src/View.java:13:5)}.
 * Configured through {@link Builder}; immutable and thread-safe once built.
 * Lines go to the {@code io.lighting.rsx.reload.ReloadLog} SLF4J logger at
 * INFO unless another sink is given.
 */
public final class ReloadLog implements ReloadObserver {
    private final boolean enabled;
    private final boolean logSeeds;
    private final boolean includeElapsed;
    /**
     * Whether to list the remapped and updated slots of a hot-reloadable edit.
     */
    private final boolean includeSlotMapping;
    private final String prefix;
    private final Consumer<String> sink;

    private ReloadLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logSeeds = builder.logSeeds;
        this.includeElapsed = builder.includeElapsed;
        this.includeSlotMapping = builder.includeSlotMapping;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void onSeeded(TemplateKey key) {
        if (!enabled || !logSeeds) {
            return;
        }
        sink.accept(prefix + " [SEEDED] " + key);
    }

    @Override
    public void onReconciled(ReconciliationRecord record, long elapsedNanos) {
        if (!enabled) {
            return;
        }
        StringBuilder line = new StringBuilder(prefix);
        if (record.hotReloadable()) {
            line.append(" [HOT_RELOAD] ").append(record.templateKey())
                .append(" slots=").append(record.slotMapping().size())
                .append(" patches=").append(record.literalPatches().size());
            if (includeSlotMapping) {
                line.append(" mapping=").append(formatMapping(record.slotMapping()));
            }
        } else {
            line.append(" [REBUILD] ").append(record.templateKey())
                .append(' ').append(record.rebuildReason().orElse(""))
                .append(" (").append(record.mismatchSpan().map(Object::toString).orElse("?")).append(')');
        }
        if (includeElapsed) {
            line.append(" elapsed=").append(elapsedNanos).append("ns");
        }
        sink.accept(line.toString());
    }

    @Override
    public void onSyntaxError(TemplateKey key, SyntaxError error) {
        if (!enabled) {
            return;
        }
        sink.accept(prefix + " [SYNTAX_ERROR] " + key + " " + error.describe());
    }

    @Override
    public void onEvicted(TemplateKey key) {
        if (!enabled) {
            return;
        }
        sink.accept(prefix + " [EVICTED] " + key);
    }

    /**
     * Renders changed entries only, e.g. {@code [0<-1, 2<-2 "count + 1"]}.
     */
    private String formatMapping(List<SlotMapping> mapping) {
        List<String> parts = new ArrayList<>();
        for (SlotMapping entry : mapping) {
            if (entry.newIndex() == entry.oldIndex() && !entry.isUpdated()) {
                continue;
            }
            String part = entry.newIndex() + "<-" + entry.oldIndex();
            if (entry.isUpdated()) {
                part += " \"" + entry.updatedExpression() + "\"";
            }
            parts.add(part);
        }
        return "[" + String.join(", ", parts) + "]";
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logSeeds = false;
        private boolean includeElapsed = false;
        private boolean includeSlotMapping = false;
        private String prefix = "RSX:";
        private Consumer<String> sink = LoggerFactory.getLogger(ReloadLog.class)::info;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logSeeds(boolean enabled) {
            this.logSeeds = enabled;
            return this;
        }

        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder includeSlotMapping(boolean enabled) {
            this.includeSlotMapping = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public ReloadLog build() {
            return new ReloadLog(this);
        }
    }
}
