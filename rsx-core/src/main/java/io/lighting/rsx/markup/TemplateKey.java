package io.lighting.rsx.markup;

import java.util.Objects;

/**
 * Identity of one markup invocation: the source file plus the position where
 * the invocation starts.
 * <p>
 * Edits inside the invocation move its end but not its start, so the key stays
 * the same across reparses of the same location. It is the join key between an
 * old and a new {@link Template}.
 */
public record TemplateKey(String file, int line, int column) {
    public TemplateKey {
        Objects.requireNonNull(file, "file");
        if (file.isBlank()) {
            throw new IllegalArgumentException("file must not be blank");
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Invalid template position " + line + ":" + column);
        }
    }

    public static TemplateKey of(String file, SourcePosition start) {
        Objects.requireNonNull(start, "start");
        return new TemplateKey(file, start.line(), start.column());
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
