package org.Aayush.labelmap.factory;

import org.Aayush.labelmap.array.SortedArrayStorage;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.StorageConfigurationException;
import org.Aayush.labelmap.hash.HashMapStorage;
import org.Aayush.labelmap.hash.StringKeyMapStorage;
import org.Aayush.labelmap.tile.AdaptiveTiledStorage;
import org.Aayush.labelmap.tile.FixedGridTiledStorage;
import org.Aayush.labelmap.tree.BstMapStorage;
import org.Aayush.labelmap.tree.OrderedMapStorage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MapStorageFactories Tests")
class MapStorageFactoriesTest {

    @Test
    @DisplayName("Rejects unspecified storage type (no implicit default)")
    void testRejectsNullType() {
        StorageConfigurationException ex = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.create(null)
        );
        assertEquals(StorageConfigurationException.REASON_STORAGE_TYPE_REQUIRED, ex.reasonCode());
        assertTrue(ex.getMessage().contains("[" + StorageConfigurationException.REASON_STORAGE_TYPE_REQUIRED + "]"));
        assertThrows(NullPointerException.class, () -> MapStorageFactories.forType(StorageType.BST, null));
    }

    @Test
    @DisplayName("Each type maps to its implementation")
    void testTypeMapping() {
        assertInstanceOf(HashMapStorage.class, MapStorageFactories.create(StorageType.HASH_MAP));
        assertInstanceOf(StringKeyMapStorage.class, MapStorageFactories.create(StorageType.STRING_KEY));
        assertInstanceOf(BstMapStorage.class, MapStorageFactories.create(StorageType.BST));
        assertInstanceOf(SortedArrayStorage.class, MapStorageFactories.create(StorageType.SORTED_ARRAY));
        assertInstanceOf(OrderedMapStorage.class, MapStorageFactories.create(StorageType.ORDERED_MAP));
        assertInstanceOf(FixedGridTiledStorage.class, MapStorageFactories.create(StorageType.FIXED_GRID_TILED));
        assertInstanceOf(AdaptiveTiledStorage.class, MapStorageFactories.create(StorageType.ADAPTIVE_TILED));
    }

    @Test
    @DisplayName("Factories produce distinct empty instances under stable names")
    void testFactoriesProduceFreshInstances() {
        List<MapStorageFactory> factories = MapStorageFactories.all(StorageConfig.defaults());
        assertEquals(StorageType.values().length, factories.size());

        for (int i = 0; i < factories.size(); i++) {
            MapStorageFactory factory = factories.get(i);
            assertEquals(StorageType.values()[i], factory.type());
            assertEquals(factory.type().displayName(), factory.name());
            assertEquals(factory.name(), factory.name());

            MapStorage first = factory.create();
            MapStorage second = factory.create();
            assertNotSame(first, second);
            assertEquals(0, first.size());
            assertEquals(1_000_000, first.maxCoordinate());
        }
    }

    @Test
    @DisplayName("Configuration reaches the storages")
    void testConfigurationApplied() {
        StorageConfig config = StorageConfig.builder()
                .maxCoordinate(4_096)
                .tileShift(8)
                .tileCapacity(16)
                .build();

        FixedGridTiledStorage grid = (FixedGridTiledStorage) MapStorageFactories.create(StorageType.FIXED_GRID_TILED, config);
        assertEquals(256, grid.tileSize());
        assertEquals(4_096, grid.maxCoordinate());

        AdaptiveTiledStorage adaptive = (AdaptiveTiledStorage) MapStorageFactories.create(StorageType.ADAPTIVE_TILED, config);
        assertEquals(16, adaptive.tileCapacity());

        assertEquals(4_096, MapStorageFactories.create(StorageType.SORTED_ARRAY, config).maxCoordinate());
    }

    @Test
    @DisplayName("Invalid configuration fails when the factory is obtained")
    void testInvalidConfigurationFailsEagerly() {
        StorageConfig badShift = StorageConfig.defaults().toBuilder().tileShift(40).build();
        StorageConfigurationException ex = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.forType(StorageType.FIXED_GRID_TILED, badShift)
        );
        assertEquals(StorageConfigurationException.REASON_TILE_SHIFT_INVALID, ex.reasonCode());

        StorageConfig badCapacity = StorageConfig.defaults().toBuilder().tileCapacity(0).build();
        ex = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.forType(StorageType.ADAPTIVE_TILED, badCapacity)
        );
        assertEquals(StorageConfigurationException.REASON_TILE_CAPACITY_INVALID, ex.reasonCode());

        StorageConfig badMax = StorageConfig.defaults().toBuilder().maxCoordinate(0).build();
        for (StorageType type : StorageType.values()) {
            ex = assertThrows(StorageConfigurationException.class, () -> MapStorageFactories.forType(type, badMax));
            assertEquals(StorageConfigurationException.REASON_MAX_COORDINATE_INVALID, ex.reasonCode());
        }

        // Parameters a type does not use are ignored.
        assertEquals(0, MapStorageFactories.create(StorageType.HASH_MAP, badShift).size());
    }

    @Test
    @DisplayName("Factory validation reports the same first error as the constructor")
    void testValidationMatchesConstructorOrder() {
        StorageConfig bothBad = StorageConfig.builder()
                .maxCoordinate(0)
                .tileShift(-1)
                .tileCapacity(0)
                .build();

        StorageConfigurationException fromFactory = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.forType(StorageType.FIXED_GRID_TILED, bothBad)
        );
        StorageConfigurationException fromConstructor = assertThrows(
                StorageConfigurationException.class,
                () -> new FixedGridTiledStorage(0, -1)
        );
        assertEquals(fromConstructor.reasonCode(), fromFactory.reasonCode());
        assertEquals(StorageConfigurationException.REASON_TILE_SHIFT_INVALID, fromFactory.reasonCode());

        fromFactory = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.forType(StorageType.ADAPTIVE_TILED, bothBad)
        );
        assertEquals(StorageConfigurationException.REASON_TILE_CAPACITY_INVALID, fromFactory.reasonCode());

        fromFactory = assertThrows(
                StorageConfigurationException.class,
                () -> MapStorageFactories.forType(StorageType.BST, bothBad)
        );
        assertEquals(StorageConfigurationException.REASON_MAX_COORDINATE_INVALID, fromFactory.reasonCode());
    }

    @Test
    @DisplayName("A validated factory creates storages without configuration errors")
    void testValidatedFactoryCreates() {
        StorageConfig edge = StorageConfig.builder()
                .maxCoordinate(1)
                .tileShift(FixedGridTiledStorage.MAX_TILE_SHIFT)
                .tileCapacity(1)
                .build();
        for (MapStorageFactory factory : MapStorageFactories.all(edge)) {
            MapStorage storage = factory.create();
            assertEquals(1, storage.maxCoordinate(), factory.name());
        }
    }

    @Test
    @DisplayName("Default configuration values")
    void testDefaultConfig() {
        StorageConfig config = StorageConfig.defaults();
        assertEquals(1_000_000, config.getMaxCoordinate());
        assertEquals(15, config.getTileShift());
        assertEquals(64, config.getTileCapacity());
    }
}
