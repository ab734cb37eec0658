package org.Aayush.labelmap.core;

/**
 * Thrown when a storage cannot be constructed from the supplied parameters.
 */
public final class StorageConfigurationException extends MapStorageException {
    public static final String REASON_MAX_COORDINATE_INVALID = "LM_MAX_COORDINATE_INVALID";
    public static final String REASON_TILE_SHIFT_INVALID = "LM_TILE_SHIFT_INVALID";
    public static final String REASON_TILE_CAPACITY_INVALID = "LM_TILE_CAPACITY_INVALID";
    public static final String REASON_STORAGE_TYPE_REQUIRED = "LM_STORAGE_TYPE_REQUIRED";

    public StorageConfigurationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
