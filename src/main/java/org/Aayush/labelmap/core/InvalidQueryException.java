package org.Aayush.labelmap.core;

/**
 * Thrown when query arguments are well-formed coordinates but describe an invalid shape:
 * a negative radius or an inverted region.
 */
public final class InvalidQueryException extends MapStorageException {
    public static final String REASON_NEGATIVE_RADIUS = "LM_NEGATIVE_RADIUS";
    public static final String REASON_INVERTED_REGION = "LM_INVERTED_REGION";

    public InvalidQueryException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
