package org.Aayush.labelmap.core;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for labels on a sparse 2D integer map.
 *
 * <p>Every implementation holds at most one {@link Entry} per {@code (x, y)} pair and accepts
 * coordinates in {@code [0, maxCoordinate)}. Implementations are single-threaded: no method
 * blocks or locks, and concurrent mutation requires external synchronization.</p>
 *
 * <p>All returned lists are fresh and owned by the caller. Their order is unspecified unless
 * an implementation documents one.</p>
 */
public interface MapStorage {

    /**
     * Adds or updates the label at the entry's coordinates.
     *
     * @param entry entry to store.
     * @return true when the coordinates were not present before, false when an existing label was replaced.
     * @throws CoordinateOutOfRangeException if the entry coordinates are outside the map.
     */
    boolean add(Entry entry);

    /**
     * Returns the entry at the coordinates, or null when absent.
     *
     * @throws CoordinateOutOfRangeException if coordinates are outside the map.
     */
    Entry get(int x, int y);

    /**
     * Optional-returning variant of {@link #get(int, int)}.
     *
     * @throws CoordinateOutOfRangeException if coordinates are outside the map.
     */
    default Optional<Entry> tryGet(int x, int y) {
        return Optional.ofNullable(get(x, y));
    }

    /**
     * Removes the entry at the coordinates.
     *
     * @return true when an entry existed and was removed.
     * @throws CoordinateOutOfRangeException if coordinates are outside the map.
     */
    boolean remove(int x, int y);

    /**
     * @throws CoordinateOutOfRangeException if coordinates are outside the map.
     */
    default boolean contains(int x, int y) {
        return get(x, y) != null;
    }

    /**
     * Returns every stored entry.
     */
    List<Entry> listAll();

    /**
     * Returns entries with {@code minX <= x <= maxX} and {@code minY <= y <= maxY}.
     *
     * @throws CoordinateOutOfRangeException if any bound is outside the map.
     * @throws InvalidQueryException if {@code minX > maxX} or {@code minY > maxY}.
     */
    List<Entry> getInRegion(int minX, int minY, int maxX, int maxY);

    /**
     * Returns entries strictly inside the circle around the origin: {@code x*x + y*y < radius*radius}.
     *
     * @throws InvalidQueryException if radius is negative.
     */
    List<Entry> getWithinRadius(int radius);

    /**
     * Returns entries inside or on the circle around a center:
     * {@code (x - centerX)^2 + (y - centerY)^2 <= radius^2}.
     * <p>
     * The boundary is inclusive here, unlike the origin-based overload.
     * </p>
     *
     * @throws CoordinateOutOfRangeException if the center is outside the map.
     * @throws InvalidQueryException if radius is negative.
     */
    List<Entry> getWithinRadius(int centerX, int centerY, int radius);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Number of distinct coordinate pairs stored.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Exclusive upper bound of both coordinate axes.
     */
    int maxCoordinate();
}
