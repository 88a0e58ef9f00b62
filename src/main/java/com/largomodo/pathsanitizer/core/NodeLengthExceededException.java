package com.largomodo.pathsanitizer.core;

/**
 * Thrown when a node is longer than the limit and truncation was not requested.
 * <p>
 * Recoverable: retry with {@link SanitizationPolicy#withTrimToLimit(boolean)} or reject the input.
 */
public class NodeLengthExceededException extends PathSanitizationException {

    private final int length;
    private final int limit;

    /**
     * @param node   node as supplied by the caller
     * @param length length after sanitization
     * @param limit  maximum allowed length
     */
    public NodeLengthExceededException(String node, int length, int limit) {
        super("Node '" + node + "' has more than " + limit + " characters (" + length + ")", node);
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
