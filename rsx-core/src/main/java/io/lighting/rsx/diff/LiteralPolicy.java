package io.lighting.rsx.diff;

/**
 * How the differ treats edits to static text and literal attribute values.
 */
public enum LiteralPolicy {
    /**
     * Report the change as a {@link LiteralPatch}; the template stays hot-reloadable.
     */
    PATCH_IN_PLACE,
    /**
     * Literal text is baked into the compiled template; any change needs a rebuild.
     */
    FORCE_REBUILD
}
