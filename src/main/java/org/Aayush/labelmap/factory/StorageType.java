package org.Aayush.labelmap.factory;

/**
 * Supported storage strategies.
 *
 * <p>{@code HASH_MAP} and {@code STRING_KEY} are linear-scan baselines for spatial queries.</p>
 * <p>{@code BST}, {@code SORTED_ARRAY} and {@code ORDERED_MAP} order entries by distance from the origin.</p>
 * <p>{@code FIXED_GRID_TILED} and {@code ADAPTIVE_TILED} partition the map into tiles.</p>
 */
public enum StorageType {
    HASH_MAP("HashMap"),
    STRING_KEY("StringKey"),
    BST("BST"),
    SORTED_ARRAY("SortedArray"),
    ORDERED_MAP("OrderedMap"),
    FIXED_GRID_TILED("FixedGridTiled"),
    ADAPTIVE_TILED("AdaptiveTiled");

    private final String displayName;

    StorageType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Short human-readable name used for factory names and reports.
     */
    public String displayName() {
        return displayName;
    }
}
