package com.largomodo.pathsanitizer.core;

/**
 * Base class for the fatal sanitization failures.
 * <p>
 * Unchecked: every other irregular input is corrected rather than rejected, so these only
 * surface for excluded features, caller bugs or an over-long node without truncation.
 */
public class PathSanitizationException extends RuntimeException {

    private final String value;

    /**
     * @param message description of the failure
     * @param value   offending path or node
     */
    public PathSanitizationException(String message, String value) {
        super(message);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
