package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Raw markup of one invocation together with the place it was taken from.
 * <p>
 * {@code origin} is the position of the first character of {@code text} in
 * {@code file}; every span the parser produces is relative to it.
 */
public record TemplateSource(String file, SourcePosition origin, String text) {
    public static final String INLINE_FILE = "<inline>";

    public TemplateSource {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(text, "text");
    }

    public static TemplateSource of(String text) {
        return new TemplateSource(INLINE_FILE, SourcePosition.START, text);
    }

    /**
     * Source whose origin offset is unknown; span offsets then count from the
     * start of {@code text}. Use the canonical constructor to supply the file
     * offset of the origin.
     */
    public static TemplateSource of(String file, int line, int column, String text) {
        return new TemplateSource(file, new SourcePosition(line, column, 0), text);
    }

    public TemplateKey key() {
        return TemplateKey.of(file, origin);
    }
}
