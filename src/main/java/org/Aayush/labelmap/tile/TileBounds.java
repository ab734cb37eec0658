package org.Aayush.labelmap.tile;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Immutable snapshot of one adaptive tile: its inclusive rectangle and entry count.
 */
@Getter
@ToString
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class TileBounds {
    private final int minX;
    private final int minY;
    private final int maxX;
    private final int maxY;
    private final int entryCount;

    public long width() {
        return (long) maxX - minX + 1;
    }

    public long height() {
        return (long) maxY - minY + 1;
    }

    public boolean contains(int x, int y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
}
