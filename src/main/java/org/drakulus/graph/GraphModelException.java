package org.drakulus.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Graph model contract violation with deterministic reason codes.
 */
@Getter
public final class GraphModelException extends IllegalArgumentException {
    private final String reasonCode;

    /**
     * Creates a reason-coded graph model failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GraphModelException(String reasonCode, String message) {
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
