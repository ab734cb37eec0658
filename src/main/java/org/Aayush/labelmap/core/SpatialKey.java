package org.Aayush.labelmap.core;

import lombok.experimental.UtilityClass;

/**
 * Key arithmetic shared by the storages.
 * <p>
 * Two kinds of keys are used:
 * </p>
 * <ul>
 * <li>{@link #distanceKey(int, int)}: {@code x*x + y*y} in 64-bit arithmetic. Ordered by
 * distance from the origin but not injective: {@code (3,4)}, {@code (4,3)} and {@code (5,0)}
 * all map to 25, so key-ordered storages keep a collision bucket per key.</li>
 * <li>{@link #pack(int, int)}: {@code (x << 32) | y}. Injective, used as a primitive
 * composite key for hash maps to avoid allocating tuple objects.</li>
 * </ul>
 */
@UtilityClass
public final class SpatialKey {

    /**
     * Squared distance from the origin.
     */
    public static long distanceKey(int x, int y) {
        return (long) x * x + (long) y * y;
    }

    /**
     * Squared distance between two points.
     */
    public static long squaredDistance(int x, int y, int centerX, int centerY) {
        long dx = (long) x - centerX;
        long dy = (long) y - centerY;
        return dx * dx + dy * dy;
    }

    /**
     * Packs a coordinate pair into one long.
     */
    public static long pack(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }

    public static int unpackX(long packed) {
        return (int) (packed >>> 32);
    }

    public static int unpackY(long packed) {
        return (int) packed;
    }
}
