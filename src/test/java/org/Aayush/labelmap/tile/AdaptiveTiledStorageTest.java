package org.Aayush.labelmap.tile;

import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.StorageConfigurationException;
import org.Aayush.labelmap.testutil.LabelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AdaptiveTiledStorage Tests")
class AdaptiveTiledStorageTest {

    /**
     * Checks that tiles cover the map exactly once: areas sum to the map area, no two overlap,
     * and entry counts add up.
     */
    private static void assertPartition(AdaptiveTiledStorage storage) {
        List<TileBounds> tiles = storage.tileBounds();
        long side = storage.maxCoordinate();
        long area = 0;
        int entries = 0;
        for (int i = 0; i < tiles.size(); i++) {
            TileBounds a = tiles.get(i);
            assertTrue(a.minX() >= 0 && a.minY() >= 0, "tile below map: " + a);
            assertTrue(a.maxX() < side && a.maxY() < side, "tile past map: " + a);
            area += a.width() * a.height();
            entries += a.entryCount();
            for (int j = i + 1; j < tiles.size(); j++) {
                TileBounds b = tiles.get(j);
                boolean overlaps = a.minX() <= b.maxX() && b.minX() <= a.maxX()
                        && a.minY() <= b.maxY() && b.minY() <= a.maxY();
                assertTrue(!overlaps, a + " overlaps " + b);
            }
        }
        assertEquals(side * side, area);
        assertEquals(storage.size(), entries);
    }

    @Test
    @DisplayName("Starts as one root tile covering the map")
    void testRootTile() {
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage();
        assertEquals(1, storage.tileCount());
        assertEquals(64, storage.tileCapacity());
        TileBounds root = storage.tileBounds().get(0);
        assertEquals(0, root.minX());
        assertEquals(999_999, root.maxX());
        assertEquals(999_999, root.maxY());
    }

    @Test
    @DisplayName("A single split adds exactly one tile and keeps entries retrievable")
    void testSingleSplit() {
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage(1_000, 4);
        storage.add(Entry.of(10, 10, "a"));
        storage.add(Entry.of(900, 10, "b"));
        storage.add(Entry.of(20, 900, "c"));
        storage.add(Entry.of(910, 910, "d"));
        assertEquals(1, storage.tileCount());

        storage.add(Entry.of(30, 30, "e"));
        assertEquals(2, storage.tileCount());
        assertEquals(1, storage.splitCount());

        // Square root tile splits on X at 500.
        List<TileBounds> tiles = storage.tileBounds();
        assertEquals(499, tiles.get(0).maxX());
        assertEquals(500, tiles.get(1).minX());
        assertEquals(3, tiles.get(0).entryCount());
        assertEquals(2, tiles.get(1).entryCount());

        for (String label : List.of("a", "b", "c", "d", "e")) {
            assertTrue(storage.listAll().stream().anyMatch(e -> e.label().equals(label)));
        }
        assertEquals("e", storage.get(30, 30).label());
        assertEquals("d", storage.get(910, 910).label());
        assertPartition(storage);
    }

    @Test
    @DisplayName("Updates never trigger a split")
    void testUpdateDoesNotSplit() {
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage(1_000, 2);
        storage.add(Entry.of(1, 1, "a"));
        storage.add(Entry.of(2, 2, "b"));
        storage.add(Entry.of(2, 2, "b2"));
        assertEquals(1, storage.tileCount());
        assertEquals(0, storage.splitCount());
    }

    @Test
    @DisplayName("Clustered inserts split recursively until children fit")
    void testRecursiveSplit() {
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage(1_024, 2);
        // Three points packed in one corner force repeated halving on one insert.
        storage.add(Entry.of(0, 0, "a"));
        storage.add(Entry.of(1, 0, "b"));
        storage.add(Entry.of(0, 1, "c"));

        assertTrue(storage.splitCount() > 1);
        assertEquals(storage.splitCount() + 1, storage.tileCount());
        for (TileBounds tile : storage.tileBounds()) {
            assertTrue(tile.entryCount() <= 2, "overfull tile " + tile);
        }
        assertPartition(storage);
    }

    @Test
    @DisplayName("Splitting bottoms out at 1x1 tiles")
    void testUnitTiles() {
        // Capacity 1 on a 2x2 map: four points end in four 1x1 tiles.
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage(2, 1);
        storage.add(Entry.of(0, 0, "a"));
        storage.add(Entry.of(1, 0, "b"));
        storage.add(Entry.of(0, 1, "c"));
        storage.add(Entry.of(1, 1, "d"));
        assertEquals(4, storage.tileCount());
        assertPartition(storage);

        AdaptiveTiledStorage single = new AdaptiveTiledStorage(1, 1);
        single.add(Entry.of(0, 0, "only"));
        single.add(Entry.of(0, 0, "again"));
        assertEquals(1, single.tileCount());
        assertEquals(0, single.splitCount());
    }

    @Test
    @DisplayName("Removals never merge tiles; clear collapses to the root")
    void testNoMergeAndClear() {
        AdaptiveTiledStorage storage = new AdaptiveTiledStorage(10_000, 8);
        List<Entry> entries = LabelFixtures.uniform(500, 10_000, 2026L);
        entries.forEach(storage::add);
        int tilesAfterInsert = storage.tileCount();
        assertTrue(tilesAfterInsert > 1);
        assertPartition(storage);

        for (Entry entry : entries) {
            storage.remove(entry.x(), entry.y());
        }
        assertEquals(0, storage.size());
        assertEquals(tilesAfterInsert, storage.tileCount());
        assertPartition(storage);

        storage.clear();
        assertEquals(1, storage.tileCount());
        assertEquals(0, storage.splitCount());
    }

    @Test
    @DisplayName("Rejects non-positive tile capacity")
    void testInvalidCapacity() {
        StorageConfigurationException ex = assertThrows(
                StorageConfigurationException.class,
                () -> new AdaptiveTiledStorage(1_000, 0)
        );
        assertEquals(StorageConfigurationException.REASON_TILE_CAPACITY_INVALID, ex.reasonCode());

        assertDoesNotThrow(() -> AdaptiveTiledStorage.validateTileCapacity(1));
        ex = assertThrows(StorageConfigurationException.class, () -> AdaptiveTiledStorage.validateTileCapacity(-3));
        assertEquals(StorageConfigurationException.REASON_TILE_CAPACITY_INVALID, ex.reasonCode());
    }
}
