package org.Aayush.labelmap.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Valid coordinate range {@code [0, maxCoordinate)} shared by both axes, plus the
 * argument checks every storage runs before touching its state.
 *
 * <p>Checks never clamp or correct input; they either pass or throw.</p>
 */
@Getter
@Accessors(fluent = true)
public final class CoordinateBounds {
    public static final int DEFAULT_MAX_COORDINATE = 1_000_000;

    private static final CoordinateBounds DEFAULT = new CoordinateBounds(DEFAULT_MAX_COORDINATE);

    /** Exclusive upper bound of both axes. */
    private final int maxCoordinate;

    private CoordinateBounds(int maxCoordinate) {
        this.maxCoordinate = maxCoordinate;
    }

    /**
     * Creates bounds for {@code [0, maxCoordinate)}.
     *
     * @param maxCoordinate exclusive upper bound; must be {@code >= 1}.
     * @return immutable bounds.
     */
    public static CoordinateBounds of(int maxCoordinate) {
        if (maxCoordinate < 1) {
            throw new StorageConfigurationException(
                    StorageConfigurationException.REASON_MAX_COORDINATE_INVALID,
                    "maxCoordinate must be >= 1, got " + maxCoordinate
            );
        }
        if (maxCoordinate == DEFAULT_MAX_COORDINATE) {
            return DEFAULT;
        }
        return new CoordinateBounds(maxCoordinate);
    }

    /**
     * Returns bounds for the default 1,000,000 x 1,000,000 map.
     */
    public static CoordinateBounds defaults() {
        return DEFAULT;
    }

    /**
     * Largest valid coordinate value.
     */
    public int maxValid() {
        return maxCoordinate - 1;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < maxCoordinate && y >= 0 && y < maxCoordinate;
    }

    /**
     * Validates a point argument named {@code x}/{@code y}.
     */
    public void validatePoint(int x, int y) {
        requireInRange("x", x);
        requireInRange("y", y);
    }

    /**
     * Validates region bounds: both corners in range first, then orientation.
     */
    public void validateRegion(int minX, int minY, int maxX, int maxY) {
        requireInRange("minX", minX);
        requireInRange("minY", minY);
        requireInRange("maxX", maxX);
        requireInRange("maxY", maxY);
        if (minX > maxX || minY > maxY) {
            throw new InvalidQueryException(
                    InvalidQueryException.REASON_INVERTED_REGION,
                    "region bounds are inverted: [" + minX + ".." + maxX + "] x [" + minY + ".." + maxY + "]"
            );
        }
    }

    /**
     * Validates a center-based radius query: center first, then radius.
     */
    public void validateCircle(int centerX, int centerY, int radius) {
        requireInRange("centerX", centerX);
        requireInRange("centerY", centerY);
        requireNonNegativeRadius(radius);
    }

    /**
     * Validates an origin-based radius query. There are no coordinates to check.
     */
    public static void requireNonNegativeRadius(int radius) {
        if (radius < 0) {
            throw new InvalidQueryException(
                    InvalidQueryException.REASON_NEGATIVE_RADIUS,
                    "radius must be non-negative, got " + radius
            );
        }
    }

    private void requireInRange(String argumentName, int value) {
        if (value < 0 || value >= maxCoordinate) {
            throw new CoordinateOutOfRangeException(argumentName, value, maxCoordinate);
        }
    }
}
