package io.lighting.rsx.markup;

/**
 * A point in a source file. Lines and columns are 1-based. The offset is
 * 0-based and counts characters from the offset of the invocation's origin:
 * from the start of the file when the origin carries its file offset, from the
 * start of the invocation when the origin offset is 0.
 */
public record SourcePosition(int line, int column, int offset) {
    public static final SourcePosition START = new SourcePosition(1, 1, 0);

    public SourcePosition {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException(
                "Invalid source position " + line + ":" + column + " (offset " + offset + ")"
            );
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
