package org.Aayush.npuzzle.state;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a caller-supplied grid cannot describe a square N-puzzle.
 *
 * <p>Messages are prefixed with deterministic reason-code text.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvalidGridException extends RuntimeException {
    public static final String REASON_GRID_REQUIRED = "GRID_REQUIRED";
    public static final String REASON_GRID_NOT_SQUARE = "GRID_NOT_SQUARE";
    public static final String REASON_GRID_BLANK_COUNT = "GRID_BLANK_COUNT";
    public static final String REASON_GRID_NOT_PERMUTATION = "GRID_NOT_PERMUTATION";
    public static final String REASON_GRID_PARSE_FAILED = "GRID_PARSE_FAILED";

    private final String reasonCode;

    /**
     * Creates a reason-coded grid failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public InvalidGridException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded grid failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public InvalidGridException(String reasonCode, String message, Throwable cause) {
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
