package org.Aayush.labelmap.factory;

import lombok.experimental.UtilityClass;
import org.Aayush.labelmap.array.SortedArrayStorage;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.StorageConfigurationException;
import org.Aayush.labelmap.hash.HashMapStorage;
import org.Aayush.labelmap.hash.StringKeyMapStorage;
import org.Aayush.labelmap.tile.AdaptiveTiledStorage;
import org.Aayush.labelmap.tile.FixedGridTiledStorage;
import org.Aayush.labelmap.tree.BstMapStorage;
import org.Aayush.labelmap.tree.OrderedMapStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Uniform construction of every storage type.
 *
 * <p>Factories validate their configuration eagerly, so a bad {@link StorageConfig} fails when
 * the factory is obtained rather than on the first {@link MapStorageFactory#create()}.</p>
 */
@UtilityClass
public final class MapStorageFactories {
    private static final Logger log = LoggerFactory.getLogger(MapStorageFactories.class);

    /**
     * Creates a storage of the given type with default configuration.
     */
    public static MapStorage create(StorageType type) {
        return forType(type, StorageConfig.defaults()).create();
    }

    /**
     * Creates a storage of the given type.
     */
    public static MapStorage create(StorageType type, StorageConfig config) {
        return forType(type, config).create();
    }

    /**
     * Returns a factory for the given type.
     *
     * @param type storage type; required.
     * @param config construction parameters; required.
     * @return named factory producing fresh storages.
     */
    public static MapStorageFactory forType(StorageType type, StorageConfig config) {
        if (type == null) {
            throw new StorageConfigurationException(
                    StorageConfigurationException.REASON_STORAGE_TYPE_REQUIRED,
                    "storage type must be explicitly specified"
            );
        }
        Objects.requireNonNull(config, "config");

        validate(type, config);
        MapStorageFactory factory = new ConfiguredFactory(type, config);
        log.debug("Created factory {} with {}", factory.name(), config);
        return factory;
    }

    /**
     * Returns one factory per storage type, in {@link StorageType} declaration order.
     */
    public static List<MapStorageFactory> all(StorageConfig config) {
        List<MapStorageFactory> factories = new ArrayList<>(StorageType.values().length);
        for (StorageType type : StorageType.values()) {
            factories.add(forType(type, config));
        }
        return factories;
    }

    /**
     * Checks the parameters the given type uses, in the order its constructor checks them.
     */
    private static void validate(StorageType type, StorageConfig config) {
        switch (type) {
            case FIXED_GRID_TILED -> FixedGridTiledStorage.validateTileShift(config.getTileShift());
            case ADAPTIVE_TILED -> AdaptiveTiledStorage.validateTileCapacity(config.getTileCapacity());
            default -> {
                // maxCoordinate only
            }
        }
        CoordinateBounds.of(config.getMaxCoordinate());
    }

    private static MapStorage instantiate(StorageType type, StorageConfig config) {
        int maxCoordinate = config.getMaxCoordinate();
        return switch (type) {
            case HASH_MAP -> new HashMapStorage(maxCoordinate);
            case STRING_KEY -> new StringKeyMapStorage(maxCoordinate);
            case BST -> new BstMapStorage(maxCoordinate);
            case SORTED_ARRAY -> new SortedArrayStorage(maxCoordinate);
            case ORDERED_MAP -> new OrderedMapStorage(maxCoordinate);
            case FIXED_GRID_TILED -> new FixedGridTiledStorage(maxCoordinate, config.getTileShift());
            case ADAPTIVE_TILED -> new AdaptiveTiledStorage(maxCoordinate, config.getTileCapacity());
        };
    }

    private static final class ConfiguredFactory implements MapStorageFactory {
        private final StorageType type;
        private final StorageConfig config;

        private ConfiguredFactory(StorageType type, StorageConfig config) {
            this.type = type;
            this.config = config;
        }

        @Override
        public String name() {
            return type.displayName();
        }

        @Override
        public StorageType type() {
            return type;
        }

        @Override
        public MapStorage create() {
            return instantiate(type, config);
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
