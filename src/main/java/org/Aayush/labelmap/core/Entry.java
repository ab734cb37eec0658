package org.Aayush.labelmap.core;

import lombok.Getter;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Immutable label record placed at integer map coordinates.
 * <p>
 * Two entries describe the same logical record when their {@code (x, y)} match.
 * Storages replace the label of an existing record in place rather than appending a second one.
 * </p>
 * <p>
 * Coordinates are not range-checked here; range is a property of the storage
 * ({@link CoordinateBounds}), not of the record.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class Entry {

    /** Horizontal coordinate. */
    private final int x;
    /** Vertical coordinate. */
    private final int y;
    /** Non-null label text. */
    private final String label;

    private Entry(int x, int y, String label) {
        this.x = x;
        this.y = y;
        this.label = Objects.requireNonNull(label, "label");
    }

    /**
     * Creates an immutable entry.
     *
     * @param x horizontal coordinate.
     * @param y vertical coordinate.
     * @param label non-null label.
     * @return new entry.
     */
    public static Entry of(int x, int y, String label) {
        return new Entry(x, y, label);
    }

    /**
     * Returns a copy of this entry carrying a different label.
     */
    public Entry withLabel(String newLabel) {
        return new Entry(x, y, newLabel);
    }

    /**
     * Checks whether this entry sits at the given coordinates.
     */
    public boolean isAt(int px, int py) {
        return x == px && y == py;
    }
}
