package org.Aayush.labelmap.tile;

import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.Collection;
import java.util.List;

/**
 * Query shape evaluated against tiles.
 * <p>
 * Every shape is convex, so a tile whose four corners all satisfy the predicate lies wholly
 * inside it and can be accepted in bulk (fast path). Tiles outside the shape's clamped bounding
 * box are skipped; the rest are filtered entry by entry (boundary path).
 * </p>
 */
abstract class TileQuery {

    /** Bounding box of the shape, clamped to the map. Inclusive. */
    final int boxMinX;
    final int boxMinY;
    final int boxMaxX;
    final int boxMaxY;

    private TileQuery(long boxMinX, long boxMinY, long boxMaxX, long boxMaxY) {
        this.boxMinX = (int) boxMinX;
        this.boxMinY = (int) boxMinY;
        this.boxMaxX = (int) boxMaxX;
        this.boxMaxY = (int) boxMaxY;
    }

    /**
     * Exact per-point predicate.
     */
    abstract boolean matches(int x, int y);

    /**
     * Checks whether the inclusive rectangle overlaps the bounding box.
     */
    final boolean overlapsBox(int minX, int minY, int maxX, int maxY) {
        return maxX >= boxMinX && minX <= boxMaxX && maxY >= boxMinY && minY <= boxMaxY;
    }

    /**
     * Corner-containment test for the fast path.
     */
    final boolean containsTile(int minX, int minY, int maxX, int maxY) {
        return matches(minX, minY)
                && matches(maxX, minY)
                && matches(minX, maxY)
                && matches(maxX, maxY);
    }

    /**
     * Appends the matching entries of one tile that overlaps the bounding box.
     */
    final void collect(int minX, int minY, int maxX, int maxY, Collection<Entry> tileEntries, List<Entry> result) {
        if (containsTile(minX, minY, maxX, maxY)) {
            result.addAll(tileEntries);
            return;
        }
        for (Entry entry : tileEntries) {
            if (matches(entry.x(), entry.y())) {
                result.add(entry);
            }
        }
    }

    /**
     * Inclusive rectangle. Arguments must already be validated.
     */
    static TileQuery region(int minX, int minY, int maxX, int maxY) {
        return new TileQuery(minX, minY, maxX, maxY) {
            @Override
            boolean matches(int x, int y) {
                return x >= minX && x <= maxX && y >= minY && y <= maxY;
            }
        };
    }

    /**
     * Circle around the origin with a strict boundary: {@code x*x + y*y < radius^2}.
     */
    static TileQuery originCircle(int radius, int maxValid) {
        long radiusSquared = (long) radius * radius;
        long extent = Math.min(maxValid, radius);
        return new TileQuery(0, 0, extent, extent) {
            @Override
            boolean matches(int x, int y) {
                return SpatialKey.distanceKey(x, y) < radiusSquared;
            }
        };
    }

    /**
     * Circle around a center with an inclusive boundary. Arguments must already be validated.
     */
    static TileQuery circle(int centerX, int centerY, int radius, int maxValid) {
        long radiusSquared = (long) radius * radius;
        return new TileQuery(
                Math.max(0L, (long) centerX - radius),
                Math.max(0L, (long) centerY - radius),
                Math.min(maxValid, (long) centerX + radius),
                Math.min(maxValid, (long) centerY + radius)
        ) {
            @Override
            boolean matches(int x, int y) {
                return SpatialKey.squaredDistance(x, y, centerX, centerY) <= radiusSquared;
            }
        };
    }
}
