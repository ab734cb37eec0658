package org.Aayush.labelmap.core;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of collision behavior of a storage keyed by {@link SpatialKey#distanceKey(int, int)}.
 */
@Value
@Builder
public class CollisionStatistics {

    /** Number of distinct derived keys (tree nodes, map keys or array runs). */
    int keyCount;

    /** Number of stored entries. */
    int entryCount;

    /** Size of the largest collision bucket, 0 when empty. */
    int maxBucketSize;

    /** Sum over all buckets of {@code bucketSize - 1}. */
    int totalCollisions;

    /**
     * Returns statistics for an empty storage.
     */
    public static CollisionStatistics empty() {
        return CollisionStatistics.builder().build();
    }

    /**
     * Folds bucket sizes into statistics.
     */
    public static CollisionStatistics ofBucketSizes(int[] bucketSizes) {
        int entries = 0;
        int max = 0;
        int collisions = 0;
        for (int size : bucketSizes) {
            entries += size;
            max = Math.max(max, size);
            collisions += size - 1;
        }
        return CollisionStatistics.builder()
                .keyCount(bucketSizes.length)
                .entryCount(entries)
                .maxBucketSize(max)
                .totalCollisions(collisions)
                .build();
    }
}
