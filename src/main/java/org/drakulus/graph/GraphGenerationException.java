package org.drakulus.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Rejected graph generation request (invalid argument) with a deterministic reason code.
 */
@Getter
public final class GraphGenerationException extends IllegalArgumentException {
    private final String reasonCode;

    /**
     * Creates a reason-coded generation failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GraphGenerationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
