package io.lighting.rsx.reload;

import io.lighting.rsx.markup.SyntaxError;
import io.lighting.rsx.markup.TemplateKey;

/**
 * Listens to the lifecycle of a {@link HotReloadSession}.
 * <p>
 * All callbacks default to no-ops; override what is needed. They run on the
 * thread that drives the session, while its write lock is held, so they should
 * return quickly.
 */
public interface ReloadObserver {
    /**
     * A template was parsed and cached by {@link HotReloadSession#seed}.
     */
    default void onSeeded(TemplateKey key) {
    }

    /**
     * An edited template was compared against its cached version.
     *
     * @param elapsedNanos time spent parsing and diffing
     */
    default void onReconciled(ReconciliationRecord record, long elapsedNanos) {
    }

    /**
     * The edited markup failed to parse; the cached version was kept.
     */
    default void onSyntaxError(TemplateKey key, SyntaxError error) {
    }

    /**
     * A cached template disappeared from its file.
     */
    default void onEvicted(TemplateKey key) {
    }

    default void onClose() {
    }
}
