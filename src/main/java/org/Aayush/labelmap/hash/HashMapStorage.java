package org.Aayush.labelmap.hash;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hash-map storage keyed by the packed {@code (x, y)} pair.
 * <p>
 * PERFORMANCE CHARACTERISTICS:
 * - add / get / remove / contains: O(1) average, no key allocation (primitive long key).
 * - listAll: O(n).
 * - region and radius queries: O(n) linear scan; no spatial index is used.
 * <p>
 * This is the correctness baseline the other storages are compared against.
 */
public final class HashMapStorage implements MapStorage {

    private final Long2ObjectOpenHashMap<Entry> labels;
    private final CoordinateBounds bounds;

    public HashMapStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     */
    public HashMapStorage(int maxCoordinate) {
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.labels = new Long2ObjectOpenHashMap<>();
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());
        return labels.put(SpatialKey.pack(entry.x(), entry.y()), entry) == null;
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.get(SpatialKey.pack(x, y));
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.remove(SpatialKey.pack(x, y)) != null;
    }

    @Override
    public boolean contains(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.containsKey(SpatialKey.pack(x, y));
    }

    @Override
    public List<Entry> listAll() {
        return new ArrayList<>(labels.values());
    }

    @Override
    public List<Entry> getInRegion(int minX, int minY, int maxX, int maxY) {
        bounds.validateRegion(minX, minY, maxX, maxY);
        List<Entry> result = new ArrayList<>();
        for (Entry entry : labels.values()) {
            if (entry.x() >= minX && entry.x() <= maxX && entry.y() >= minY && entry.y() <= maxY) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public List<Entry> getWithinRadius(int radius) {
        CoordinateBounds.requireNonNegativeRadius(radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry entry : labels.values()) {
            if (SpatialKey.distanceKey(entry.x(), entry.y()) < radiusSquared) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public List<Entry> getWithinRadius(int centerX, int centerY, int radius) {
        bounds.validateCircle(centerX, centerY, radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry entry : labels.values()) {
            if (SpatialKey.squaredDistance(entry.x(), entry.y(), centerX, centerY) <= radiusSquared) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public void clear() {
        labels.clear();
    }

    @Override
    public int size() {
        return labels.size();
    }

    @Override
    public int maxCoordinate() {
        return bounds.maxCoordinate();
    }
}
