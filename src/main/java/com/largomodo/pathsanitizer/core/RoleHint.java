package com.largomodo.pathsanitizer.core;

/**
 * Caller knowledge about a node's role: known to hold, known not to hold, or unknown.
 */
public enum RoleHint {
    UNKNOWN,
    ASSERTED_TRUE,
    ASSERTED_FALSE;

    /**
     * Bridge from a nullable boolean (null meaning unknown).
     */
    public static RoleHint of(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? ASSERTED_TRUE : ASSERTED_FALSE;
    }

    public boolean isAsserted() {
        return this != UNKNOWN;
    }
}
