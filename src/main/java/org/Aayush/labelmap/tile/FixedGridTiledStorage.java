package org.Aayush.labelmap.tile;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;
import org.Aayush.labelmap.core.StorageConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed power-of-two grid of lazily created tiles, each a hash map of its entries.
 * <p>
 * Tile coordinates are {@code (x >> tileShift, y >> tileShift)}, packed into one long key of a
 * sparse outer map. Tiles are created on first insert and dropped when their last entry is
 * removed.
 * </p>
 * <p>
 * Spatial queries walk only the tiles that exist, never the full tile-coordinate range of the
 * query's bounding box: on sparse data that range can span hundreds of thousands of empty slots.
 * </p>
 */
@Accessors(fluent = true)
public final class FixedGridTiledStorage implements MapStorage {
    public static final int DEFAULT_TILE_SHIFT = 15;
    public static final int MAX_TILE_SHIFT = 30;

    private final Long2ObjectOpenHashMap<Long2ObjectOpenHashMap<Entry>> tiles;
    private final CoordinateBounds bounds;
    /** Tile edge length is {@code 1 << tileShift}. */
    @Getter
    private final int tileShift;
    @Getter
    private final int tileSize;
    private int count;

    public FixedGridTiledStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE, DEFAULT_TILE_SHIFT);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     * @param tileShift tile edge length exponent, in {@code [0, 30]}.
     */
    public FixedGridTiledStorage(int maxCoordinate, int tileShift) {
        validateTileShift(tileShift);
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.tileShift = tileShift;
        this.tileSize = 1 << tileShift;
        this.tiles = new Long2ObjectOpenHashMap<>();
    }

    /**
     * Checks a tile shift without building a storage.
     *
     * @throws StorageConfigurationException if {@code tileShift} is outside {@code [0, 30]}.
     */
    public static void validateTileShift(int tileShift) {
        if (tileShift < 0 || tileShift > MAX_TILE_SHIFT) {
            throw new StorageConfigurationException(
                    StorageConfigurationException.REASON_TILE_SHIFT_INVALID,
                    "tileShift must be within [0, " + MAX_TILE_SHIFT + "], got " + tileShift
            );
        }
    }

    private long tileKeyOf(int x, int y) {
        return SpatialKey.pack(x >> tileShift, y >> tileShift);
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());

        long tileKey = tileKeyOf(entry.x(), entry.y());
        Long2ObjectOpenHashMap<Entry> tile = tiles.get(tileKey);
        if (tile == null) {
            tile = new Long2ObjectOpenHashMap<>();
            tiles.put(tileKey, tile);
        }
        boolean isNew = tile.put(SpatialKey.pack(entry.x(), entry.y()), entry) == null;
        if (isNew) {
            count++;
        }
        return isNew;
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        Long2ObjectOpenHashMap<Entry> tile = tiles.get(tileKeyOf(x, y));
        return tile == null ? null : tile.get(SpatialKey.pack(x, y));
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        long tileKey = tileKeyOf(x, y);
        Long2ObjectOpenHashMap<Entry> tile = tiles.get(tileKey);
        if (tile == null || tile.remove(SpatialKey.pack(x, y)) == null) {
            return false;
        }
        count--;
        if (tile.isEmpty()) {
            tiles.remove(tileKey);
        }
        return true;
    }

    @Override
    public boolean contains(int x, int y) {
        bounds.validatePoint(x, y);
        Long2ObjectOpenHashMap<Entry> tile = tiles.get(tileKeyOf(x, y));
        return tile != null && tile.containsKey(SpatialKey.pack(x, y));
    }

    @Override
    public List<Entry> listAll() {
        List<Entry> result = new ArrayList<>(count);
        for (Long2ObjectOpenHashMap<Entry> tile : tiles.values()) {
            result.addAll(tile.values());
        }
        return result;
    }

    @Override
    public List<Entry> getInRegion(int minX, int minY, int maxX, int maxY) {
        bounds.validateRegion(minX, minY, maxX, maxY);
        return query(TileQuery.region(minX, minY, maxX, maxY));
    }

    @Override
    public List<Entry> getWithinRadius(int radius) {
        CoordinateBounds.requireNonNegativeRadius(radius);
        return query(TileQuery.originCircle(radius, bounds.maxValid()));
    }

    @Override
    public List<Entry> getWithinRadius(int centerX, int centerY, int radius) {
        bounds.validateCircle(centerX, centerY, radius);
        return query(TileQuery.circle(centerX, centerY, radius, bounds.maxValid()));
    }

    private List<Entry> query(TileQuery query) {
        int minTileX = query.boxMinX >> tileShift;
        int minTileY = query.boxMinY >> tileShift;
        int maxTileX = query.boxMaxX >> tileShift;
        int maxTileY = query.boxMaxY >> tileShift;
        int maxValid = bounds.maxValid();

        List<Entry> result = new ArrayList<>();
        for (Long2ObjectMap.Entry<Long2ObjectOpenHashMap<Entry>> tile : tiles.long2ObjectEntrySet()) {
            int tileX = SpatialKey.unpackX(tile.getLongKey());
            int tileY = SpatialKey.unpackY(tile.getLongKey());
            if (tileX < minTileX || tileX > maxTileX || tileY < minTileY || tileY > maxTileY) {
                continue;
            }
            int tileMinX = tileX << tileShift;
            int tileMinY = tileY << tileShift;
            // Edge tiles are clipped to the map; nothing is stored past it.
            int tileMaxX = (int) Math.min(maxValid, (long) tileMinX + tileSize - 1);
            int tileMaxY = (int) Math.min(maxValid, (long) tileMinY + tileSize - 1);
            query.collect(tileMinX, tileMinY, tileMaxX, tileMaxY, tile.getValue().values(), result);
        }
        return result;
    }

    @Override
    public void clear() {
        tiles.clear();
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
     * Number of non-empty tiles currently allocated.
     */
    public int tileCount() {
        return tiles.size();
    }
}
