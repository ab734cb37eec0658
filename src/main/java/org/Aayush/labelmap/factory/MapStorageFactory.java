package org.Aayush.labelmap.factory;

import org.Aayush.labelmap.core.MapStorage;

/**
 * Named producer of fresh, empty storages.
 */
public interface MapStorageFactory {

    /**
     * @return factory name, stable across calls.
     */
    String name();

    /**
     * @return storage type produced by this factory.
     */
    StorageType type();

    /**
     * Builds a new empty storage. Each call returns a distinct instance.
     */
    MapStorage create();
}
