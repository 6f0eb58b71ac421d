package org.drakulus.metrics;

import lombok.Getter;

import java.util.Objects;

/**
 * Graph-metrics contract failure with deterministic reason codes.
 */
@Getter
public final class MetricsException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded metrics failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MetricsException(String reasonCode, String message) {
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
