package org.Aayush.labelmap.hash;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Same algorithm as {@link HashMapStorage}, keyed by the string {@code "x,y"}.
 * <p>
 * Exists to measure what a string composite key costs over a primitive one: every
 * operation builds and hashes a key string.
 * </p>
 */
public final class StringKeyMapStorage implements MapStorage {

    private final Object2ObjectOpenHashMap<String, Entry> labels;
    private final CoordinateBounds bounds;

    public StringKeyMapStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     */
    public StringKeyMapStorage(int maxCoordinate) {
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.labels = new Object2ObjectOpenHashMap<>();
    }

    static String keyOf(int x, int y) {
        return x + "," + y;
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());
        return labels.put(keyOf(entry.x(), entry.y()), entry) == null;
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.get(keyOf(x, y));
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.remove(keyOf(x, y)) != null;
    }

    @Override
    public boolean contains(int x, int y) {
        bounds.validatePoint(x, y);
        return labels.containsKey(keyOf(x, y));
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
