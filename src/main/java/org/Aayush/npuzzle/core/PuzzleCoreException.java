package org.Aayush.npuzzle.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Solver facade contract exception with deterministic reason codes.
 */
@Getter
public final class PuzzleCoreException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded solver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PuzzleCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded solver failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public PuzzleCoreException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Formats exception message with deterministic reason-code prefix.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates reason-code contract.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
