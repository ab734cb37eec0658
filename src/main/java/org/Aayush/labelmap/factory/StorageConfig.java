package org.Aayush.labelmap.factory;

import lombok.Builder;
import lombok.Value;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.tile.AdaptiveTiledStorage;
import org.Aayush.labelmap.tile.FixedGridTiledStorage;

/**
 * Construction parameters shared by all storage types.
 *
 * <p>Types ignore parameters they do not use. Values are validated by the storage constructors.</p>
 */
@Value
@Builder(toBuilder = true)
public class StorageConfig {

    /**
     * Exclusive upper bound of both coordinate axes.
     */
    @Builder.Default
    int maxCoordinate = CoordinateBounds.DEFAULT_MAX_COORDINATE;

    /**
     * Fixed-grid tile edge exponent; tiles are {@code 2^tileShift} units square.
     */
    @Builder.Default
    int tileShift = FixedGridTiledStorage.DEFAULT_TILE_SHIFT;

    /**
     * Adaptive tile capacity before a split.
     */
    @Builder.Default
    int tileCapacity = AdaptiveTiledStorage.DEFAULT_TILE_CAPACITY;

    /**
     * Returns the default configuration: 1,000,000-unit map, 32,768-unit grid tiles,
     * 64 entries per adaptive tile.
     */
    public static StorageConfig defaults() {
        return StorageConfig.builder().build();
    }
}
