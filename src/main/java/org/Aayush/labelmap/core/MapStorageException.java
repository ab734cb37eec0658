package org.Aayush.labelmap.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base failure raised by map storages, carrying a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [reasonCode]} so callers and logs can match on the
 * code without parsing free text.</p>
 */
@Getter
@Accessors(fluent = true)
public class MapStorageException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded storage failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MapStorageException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded storage failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public MapStorageException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
