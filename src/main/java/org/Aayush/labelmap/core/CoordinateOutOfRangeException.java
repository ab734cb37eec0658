package org.Aayush.labelmap.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a coordinate argument falls outside {@code [0, maxCoordinate)}.
 */
@Getter
@Accessors(fluent = true)
public final class CoordinateOutOfRangeException extends MapStorageException {
    public static final String REASON_COORDINATE_OUT_OF_RANGE = "LM_COORDINATE_OUT_OF_RANGE";

    /** Name of the rejected argument, for example {@code x} or {@code centerY}. */
    private final String argumentName;
    /** Rejected value. */
    private final int value;

    /**
     * @param argumentName name of the rejected argument.
     * @param value rejected value.
     * @param maxCoordinate exclusive upper bound of the valid range.
     */
    public CoordinateOutOfRangeException(String argumentName, int value, int maxCoordinate) {
        super(
                REASON_COORDINATE_OUT_OF_RANGE,
                argumentName + " must be between 0 and " + (maxCoordinate - 1) + ", got " + value
        );
        this.argumentName = argumentName;
        this.value = value;
    }
}
