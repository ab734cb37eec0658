package org.Aayush.labelmap.array;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.labelmap.core.CollisionStatistics;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sorted-array storage ordered by {@code x*x + y*y}.
 * <p>
 * Records live in two parallel arrays (SoA): a primitive key array searched by binary search
 * and an entry array. Keys are non-decreasing at all times; entries sharing a key form one
 * contiguous run in insertion order.
 * </p>
 * <p>
 * PERFORMANCE CHARACTERISTICS:
 * - get: O(log n + k), k = run length of the key.
 * - add / remove: O(n) worst case due to shifting.
 * - getWithinRadius(radius): O(log n + m), bulk copy of the prefix below {@code radius^2}.
 * - getInRegion and center-based radius: full scan.
 */
public final class SortedArrayStorage implements MapStorage {

    // ========================================================================
    // INTERNAL DATA STRUCTURES (SoA)
    // ========================================================================

    private final LongArrayList keys;
    private final ObjectArrayList<Entry> entries;
    private final CoordinateBounds bounds;

    public SortedArrayStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     */
    public SortedArrayStorage(int maxCoordinate) {
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.keys = new LongArrayList();
        this.entries = new ObjectArrayList<>();
    }

    // ========================================================================
    // PUBLIC INTERFACE
    // ========================================================================

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());

        long key = SpatialKey.distanceKey(entry.x(), entry.y());
        int first = searchFirst(keys, key);

        if (first >= 0) {
            int i = first;
            int size = keys.size();
            for (; i < size && keys.getLong(i) == key; i++) {
                if (entries.get(i).isAt(entry.x(), entry.y())) {
                    entries.set(i, entry);
                    return false;
                }
            }
            // i is now one past the end of the run
            insertAt(i, key, entry);
            return true;
        }

        insertAt(~searchAny(keys, key), key, entry);
        return true;
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        int index = indexOf(x, y);
        return index < 0 ? null : entries.get(index);
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        int index = indexOf(x, y);
        if (index < 0) {
            return false;
        }
        keys.removeLong(index);
        entries.remove(index);
        return true;
    }

    @Override
    public boolean contains(int x, int y) {
        return get(x, y) != null;
    }

    /**
     * Returns entries in ascending key order; entries sharing a key keep insertion order.
     */
    @Override
    public List<Entry> listAll() {
        return new ArrayList<>(entries);
    }

    @Override
    public List<Entry> getInRegion(int minX, int minY, int maxX, int maxY) {
        bounds.validateRegion(minX, minY, maxX, maxY);
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.x() >= minX && entry.x() <= maxX && entry.y() >= minY && entry.y() <= maxY) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public List<Entry> getWithinRadius(int radius) {
        CoordinateBounds.requireNonNegativeRadius(radius);
        int end = firstIndexAtOrAbove(keys, (long) radius * radius);
        return new ArrayList<>(entries.subList(0, end));
    }

    @Override
    public List<Entry> getWithinRadius(int centerX, int centerY, int radius) {
        bounds.validateCircle(centerX, centerY, radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (SpatialKey.squaredDistance(entry.x(), entry.y(), centerX, centerY) <= radiusSquared) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public void clear() {
        keys.clear();
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int maxCoordinate() {
        return bounds.maxCoordinate();
    }

    /**
     * Collision statistics over all key runs.
     */
    public CollisionStatistics statistics() {
        IntArrayList runLengths = new IntArrayList();
        int size = keys.size();
        int runStart = 0;
        for (int i = 1; i <= size; i++) {
            if (i == size || keys.getLong(i) != keys.getLong(runStart)) {
                runLengths.add(i - runStart);
                runStart = i;
            }
        }
        return CollisionStatistics.ofBucketSizes(runLengths.toIntArray());
    }

    /**
     * Key stored at array position {@code index}. Package-private for ordering checks.
     */
    long keyAt(int index) {
        return keys.getLong(index);
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private void insertAt(int index, long key, Entry entry) {
        keys.add(index, key);
        entries.add(index, entry);
    }

    private int indexOf(int x, int y) {
        long key = SpatialKey.distanceKey(x, y);
        int first = searchFirst(keys, key);
        if (first < 0) {
            return -1;
        }
        int size = keys.size();
        for (int i = first; i < size && keys.getLong(i) == key; i++) {
            if (entries.get(i).isAt(x, y)) {
                return i;
            }
        }
        return -1;
    }

    // ========================================================================
    // BINARY SEARCH
    // ========================================================================

    /**
     * Finds any index holding {@code key}.
     *
     * @return a matching index, or {@code ~insertionPoint} when absent.
     */
    static int searchAny(LongArrayList keys, long key) {
        int left = 0;
        int right = keys.size() - 1;
        while (left <= right) {
            int mid = (left + right) >>> 1;
            long midKey = keys.getLong(mid);
            if (midKey == key) {
                return mid;
            }
            if (midKey < key) {
                left = mid + 1;
            } else {
                right = mid - 1;
            }
        }
        return ~left;
    }

    /**
     * Finds the leftmost index holding {@code key}.
     *
     * @return leftmost matching index, or -1 when absent.
     */
    static int searchFirst(LongArrayList keys, long key) {
        int left = 0;
        int right = keys.size() - 1;
        int result = -1;
        while (left <= right) {
            int mid = (left + right) >>> 1;
            long midKey = keys.getLong(mid);
            if (midKey == key) {
                result = mid;
                right = mid - 1;
            } else if (midKey < key) {
                left = mid + 1;
            } else {
                right = mid - 1;
            }
        }
        return result;
    }

    /**
     * Finds the first index whose key is {@code >= target}; {@code size} when none is.
     */
    static int firstIndexAtOrAbove(LongArrayList keys, long target) {
        int left = 0;
        int right = keys.size();
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (keys.getLong(mid) < target) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        return left;
    }
}
