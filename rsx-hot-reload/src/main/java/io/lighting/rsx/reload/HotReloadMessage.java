package io.lighting.rsx.reload;

import java.util.Objects;

/**
 * What a development server tells a running program after a source change.
 */
public sealed interface HotReloadMessage {

    /**
     * Maps a reconciliation outcome onto the message a client understands. An
     * edit that cannot be patched ends the running program so it can be rebuilt.
     */
    static HotReloadMessage forRecord(ReconciliationRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.hotReloadable()) {
            return new UpdateTemplate(record);
        }
        return new Shutdown();
    }

    /**
     * Patch a live template with new expressions and literal text.
     */
    record UpdateTemplate(ReconciliationRecord record) implements HotReloadMessage {
        public UpdateTemplate {
            Objects.requireNonNull(record, "record");
            if (!record.hotReloadable()) {
                throw new IllegalArgumentException("Template " + record.templateKey() + " is not hot-reloadable");
            }
        }
    }

    /**
     * A static asset changed and should be reloaded by the client.
     */
    record UpdateAsset(String path) implements HotReloadMessage {
        public UpdateAsset {
            Objects.requireNonNull(path, "path");
            if (path.isBlank()) {
                throw new IllegalArgumentException("path must not be blank");
            }
        }
    }

    record Shutdown() implements HotReloadMessage {
    }
}
