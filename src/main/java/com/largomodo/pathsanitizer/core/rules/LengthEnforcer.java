package com.largomodo.pathsanitizer.core.rules;

import com.largomodo.pathsanitizer.core.NodeLengthExceededException;

/**
 * Caps a node at {@value #MAX_NODE_LENGTH} UTF-16 code units, as NTFS counts name length.
 * <p>
 * Truncation changes the identity of a node, so it only happens when the caller opts in.
 * Otherwise an over-long node fails with {@link NodeLengthExceededException}.
 */
public final class LengthEnforcer {

    public static final int MAX_NODE_LENGTH = 254;

    private LengthEnforcer() {
        // Static utility class - prevent instantiation
    }

    public static boolean exceedsLimit(String segment) {
        return segment.length() > MAX_NODE_LENGTH;
    }

    /**
     * Enforce the length limit on a sanitized node.
     *
     * @param segment     sanitized node
     * @param original    node as the caller supplied it (reported on failure)
     * @param trimToLimit truncate instead of failing
     * @return segment, or its first {@value #MAX_NODE_LENGTH} characters
     * @throws NodeLengthExceededException if segment is too long and trimToLimit is false
     */
    public static String enforce(String segment, String original, boolean trimToLimit) {
        if (!exceedsLimit(segment)) {
            return segment;
        }
        if (!trimToLimit) {
            throw new NodeLengthExceededException(original, segment.length(), MAX_NODE_LENGTH);
        }
        return truncate(segment);
    }

    /**
     * Truncate to the limit without splitting a surrogate pair.
     */
    public static String truncate(String segment) {
        if (!exceedsLimit(segment)) {
            return segment;
        }
        int end = MAX_NODE_LENGTH;
        if (Character.isHighSurrogate(segment.charAt(end - 1))) {
            end--;
        }
        return segment.substring(0, end);
    }
}
