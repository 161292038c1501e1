package io.lighting.rsx.diff;

/**
 * Pairs a slot of the new template with the slot at the same structural
 * position in the old one.
 *
 * @param updatedExpression the new expression text when it differs from the old one, otherwise {@code null}
 */
public record SlotMapping(int newIndex, int oldIndex, String updatedExpression) {
    public SlotMapping {
        if (newIndex < 0 || oldIndex < 0) {
            throw new IllegalArgumentException("Slot indices must not be negative: " + newIndex + " -> " + oldIndex);
        }
    }

    public static SlotMapping unchanged(int newIndex, int oldIndex) {
        return new SlotMapping(newIndex, oldIndex, null);
    }

    public boolean isUpdated() {
        return updatedExpression != null;
    }
}
