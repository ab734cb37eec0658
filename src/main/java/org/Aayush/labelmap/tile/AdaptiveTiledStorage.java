package org.Aayush.labelmap.tile;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;
import org.Aayush.labelmap.core.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Adaptive tiling: explicit non-overlapping rectangles that split when they overflow.
 * <p>
 * The storage starts as one tile covering the whole map. When an insert pushes a tile past
 * {@code tileCapacity}, the tile is split at the midpoint of its longer side (X on ties) into two
 * children that exactly partition it, entries are redistributed, and any child still over
 * capacity is split again. A 1x1 tile is never split; overflow is tolerated there.
 * </p>
 * <p>
 * Tiles are never merged: removing entries leaves the tile count unchanged.
 * </p>
 * <p>
 * Point operations find their tile by linear search over the tile list, which stays short
 * (tens to low hundreds of tiles) for normal workloads.
 * </p>
 */
@Accessors(fluent = true)
public final class AdaptiveTiledStorage implements MapStorage {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveTiledStorage.class);

    public static final int DEFAULT_TILE_CAPACITY = 64;

    private static final class Tile {
        final int minX;
        final int minY;
        final int maxX;
        final int maxY;
        final Long2ObjectOpenHashMap<Entry> entries = new Long2ObjectOpenHashMap<>();

        Tile(int minX, int minY, int maxX, int maxY) {
            this.minX = minX;
            this.minY = minY;
            this.maxX = maxX;
            this.maxY = maxY;
        }

        boolean contains(int x, int y) {
            return x >= minX && x <= maxX && y >= minY && y <= maxY;
        }

        int width() {
            return maxX - minX + 1;
        }

        int height() {
            return maxY - minY + 1;
        }

        void put(Entry entry) {
            entries.put(SpatialKey.pack(entry.x(), entry.y()), entry);
        }

        @Override
        public String toString() {
            return "[" + minX + ".." + maxX + "]x[" + minY + ".." + maxY + "]";
        }
    }

    private final ObjectArrayList<Tile> tiles;
    private final CoordinateBounds bounds;
    /** Entry count above which a tile splits. */
    @Getter
    private final int tileCapacity;
    /** Number of splits performed since construction or the last {@link #clear()}. */
    @Getter
    private int splitCount;
    private int count;

    public AdaptiveTiledStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE, DEFAULT_TILE_CAPACITY);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     * @param tileCapacity maximum entries per tile before it splits; must be {@code >= 1}.
     */
    public AdaptiveTiledStorage(int maxCoordinate, int tileCapacity) {
        validateTileCapacity(tileCapacity);
        this.bounds = CoordinateBounds.of(maxCoordinate);
        this.tileCapacity = tileCapacity;
        this.tiles = new ObjectArrayList<>();
        resetToRootTile();
    }

    /**
     * Checks a tile capacity without building a storage.
     *
     * @throws StorageConfigurationException if {@code tileCapacity < 1}.
     */
    public static void validateTileCapacity(int tileCapacity) {
        if (tileCapacity < 1) {
            throw new StorageConfigurationException(
                    StorageConfigurationException.REASON_TILE_CAPACITY_INVALID,
                    "tileCapacity must be >= 1, got " + tileCapacity
            );
        }
    }

    private void resetToRootTile() {
        tiles.clear();
        tiles.add(new Tile(0, 0, bounds.maxValid(), bounds.maxValid()));
        splitCount = 0;
        count = 0;
    }

    private int findTileIndex(int x, int y) {
        for (int i = 0; i < tiles.size(); i++) {
            if (tiles.get(i).contains(x, y)) {
                return i;
            }
        }
        // Tiles always partition the map; validated coordinates always land in one.
        throw new IllegalStateException("no tile covers (" + x + ", " + y + ")");
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());

        int index = findTileIndex(entry.x(), entry.y());
        Tile tile = tiles.get(index);
        boolean isNew = tile.entries.put(SpatialKey.pack(entry.x(), entry.y()), entry) == null;
        if (isNew) {
            count++;
            if (tile.entries.size() > tileCapacity) {
                split(index);
            }
        }
        return isNew;
    }

    /**
     * Splits the tile at {@code index} along its longer side. The low child takes the parent's
     * slot, the high child is appended, and overfull children split recursively.
     */
    private void split(int index) {
        Tile parent = tiles.get(index);
        int width = parent.width();
        int height = parent.height();
        if (width == 1 && height == 1) {
            log.debug("Tile {} holds {} entries over capacity {} but cannot split further",
                    parent, parent.entries.size(), tileCapacity);
            return;
        }

        Tile low;
        Tile high;
        if (width >= height) {
            int midX = parent.minX + width / 2;
            low = new Tile(parent.minX, parent.minY, midX - 1, parent.maxY);
            high = new Tile(midX, parent.minY, parent.maxX, parent.maxY);
        } else {
            int midY = parent.minY + height / 2;
            low = new Tile(parent.minX, parent.minY, parent.maxX, midY - 1);
            high = new Tile(parent.minX, midY, parent.maxX, parent.maxY);
        }

        for (Entry entry : parent.entries.values()) {
            if (low.contains(entry.x(), entry.y())) {
                low.put(entry);
            } else {
                high.put(entry);
            }
        }

        tiles.set(index, low);
        int highIndex = tiles.size();
        tiles.add(high);
        splitCount++;
        log.debug("Split tile {} into {} ({} entries) and {} ({} entries)",
                parent, low, low.entries.size(), high, high.entries.size());

        if (low.entries.size() > tileCapacity) {
            split(index);
        }
        if (high.entries.size() > tileCapacity) {
            split(highIndex);
        }
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        return tiles.get(findTileIndex(x, y)).entries.get(SpatialKey.pack(x, y));
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        Tile tile = tiles.get(findTileIndex(x, y));
        if (tile.entries.remove(SpatialKey.pack(x, y)) == null) {
            return false;
        }
        count--;
        return true;
    }

    @Override
    public boolean contains(int x, int y) {
        bounds.validatePoint(x, y);
        return tiles.get(findTileIndex(x, y)).entries.containsKey(SpatialKey.pack(x, y));
    }

    @Override
    public List<Entry> listAll() {
        List<Entry> result = new ArrayList<>(count);
        for (Tile tile : tiles) {
            result.addAll(tile.entries.values());
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
        List<Entry> result = new ArrayList<>();
        for (Tile tile : tiles) {
            if (tile.entries.isEmpty() || !query.overlapsBox(tile.minX, tile.minY, tile.maxX, tile.maxY)) {
                continue;
            }
            query.collect(tile.minX, tile.minY, tile.maxX, tile.maxY, tile.entries.values(), result);
        }
        return result;
    }

    /**
     * Removes all entries and collapses back to the single root tile.
     */
    @Override
    public void clear() {
        resetToRootTile();
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
     * Current number of tiles, empty ones included.
     */
    public int tileCount() {
        return tiles.size();
    }

    /**
     * Snapshot of every tile rectangle with its entry count, in internal tile order.
     */
    public List<TileBounds> tileBounds() {
        List<TileBounds> result = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            result.add(new TileBounds(tile.minX, tile.minY, tile.maxX, tile.maxY, tile.entries.size()));
        }
        return result;
    }
}
