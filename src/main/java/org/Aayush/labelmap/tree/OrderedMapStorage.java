package org.Aayush.labelmap.tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectRBTreeMap;
import org.Aayush.labelmap.core.CollisionStatistics;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Balanced ordered map keyed by {@code x*x + y*y}, one linked collision list per key.
 * <p>
 * Backed by a red-black tree, so key operations stay O(log n) whatever the insertion order.
 * Collision lists are linked so a located entry is unlinked in O(1).
 * </p>
 * <p>
 * PERFORMANCE CHARACTERISTICS:
 * - add / get / remove: O(log n + k), k = collision list length.
 * - listAll: ascending key order.
 * - getWithinRadius(radius): head-map iteration, O(log n + m).
 * - getInRegion: iterates only the key range {@code [minKey, maxKey]} reachable from the
 *   rectangle, filtering each candidate by exact bounds.
 * - center-based radius: full scan.
 */
public final class OrderedMapStorage implements MapStorage {

    private final Long2ObjectRBTreeMap<LinkedList<Entry>> buckets;
    private final CoordinateBounds bounds;
    private int count;

    public OrderedMapStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     */
    public OrderedMapStorage(int maxCoordinate) {
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.buckets = new Long2ObjectRBTreeMap<>();
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());

        long key = SpatialKey.distanceKey(entry.x(), entry.y());
        LinkedList<Entry> bucket = buckets.get(key);
        if (bucket == null) {
            bucket = new LinkedList<>();
            buckets.put(key, bucket);
        } else {
            ListIterator<Entry> it = bucket.listIterator();
            while (it.hasNext()) {
                if (it.next().isAt(entry.x(), entry.y())) {
                    it.set(entry);
                    return false;
                }
            }
        }
        bucket.addLast(entry);
        count++;
        return true;
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        LinkedList<Entry> bucket = buckets.get(SpatialKey.distanceKey(x, y));
        if (bucket == null) {
            return null;
        }
        for (Entry entry : bucket) {
            if (entry.isAt(x, y)) {
                return entry;
            }
        }
        return null;
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        long key = SpatialKey.distanceKey(x, y);
        LinkedList<Entry> bucket = buckets.get(key);
        if (bucket == null) {
            return false;
        }
        ListIterator<Entry> it = bucket.listIterator();
        while (it.hasNext()) {
            if (it.next().isAt(x, y)) {
                it.remove();
                count--;
                if (bucket.isEmpty()) {
                    buckets.remove(key);
                }
                return true;
            }
        }
        return false;
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
        List<Entry> result = new ArrayList<>(count);
        for (LinkedList<Entry> bucket : buckets.values()) {
            result.addAll(bucket);
        }
        return result;
    }

    @Override
    public List<Entry> getInRegion(int minX, int minY, int maxX, int maxY) {
        bounds.validateRegion(minX, minY, maxX, maxY);

        long minKey = minKeyInRegion(minX, minY, maxX, maxY);
        long maxKey = Math.max((long) minX * minX, (long) maxX * maxX)
                + Math.max((long) minY * minY, (long) maxY * maxY);

        List<Entry> result = new ArrayList<>();
        // subMap upper bound is exclusive
        for (LinkedList<Entry> bucket : buckets.subMap(minKey, maxKey + 1).values()) {
            for (Entry entry : bucket) {
                if (entry.x() >= minX && entry.x() <= maxX && entry.y() >= minY && entry.y() <= maxY) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    /**
     * Smallest {@code x*x + y*y} over the rectangle: 0 when it contains the origin, otherwise
     * the squared distance to its nearest point.
     */
    static long minKeyInRegion(int minX, int minY, int maxX, int maxY) {
        if (minX <= 0 && maxX >= 0 && minY <= 0 && maxY >= 0) {
            return 0L;
        }
        int closestX = Math.max(minX, Math.min(0, maxX));
        int closestY = Math.max(minY, Math.min(0, maxY));
        return SpatialKey.distanceKey(closestX, closestY);
    }

    @Override
    public List<Entry> getWithinRadius(int radius) {
        CoordinateBounds.requireNonNegativeRadius(radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (LinkedList<Entry> bucket : buckets.headMap(radiusSquared).values()) {
            result.addAll(bucket);
        }
        return result;
    }

    @Override
    public List<Entry> getWithinRadius(int centerX, int centerY, int radius) {
        bounds.validateCircle(centerX, centerY, radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (LinkedList<Entry> bucket : buckets.values()) {
            for (Entry entry : bucket) {
                if (SpatialKey.squaredDistance(entry.x(), entry.y(), centerX, centerY) <= radiusSquared) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    @Override
    public void clear() {
        buckets.clear();
        count = 0;
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public int maxCoordinate() {
        return bounds.maxCoordinate();
    }

    /**
     * Collision statistics over all keys.
     */
    public CollisionStatistics statistics() {
        IntArrayList bucketSizes = new IntArrayList(buckets.size());
        for (LinkedList<Entry> bucket : buckets.values()) {
            bucketSizes.add(bucket.size());
        }
        return CollisionStatistics.ofBucketSizes(bucketSizes.toIntArray());
    }
}
