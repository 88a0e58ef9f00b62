package com.largomodo.pathsanitizer.core.rules;

/**
 * Removes trailing dots and whitespace from a node.
 * <p>
 * NTFS silently drops a trailing dot or space, so "abc." and "abc" would name the same file.
 * The two directory literals "." and ".." are the only nodes allowed to end in a dot, and
 * only when the node is not a file; callers decide that via {@link #isDotLiteral(String)}.
 */
public final class TrailingTrimmer {

    private TrailingTrimmer() {
        // Static utility class - prevent instantiation
    }

    public static boolean isDotLiteral(String segment) {
        return ".".equals(segment) || "..".equals(segment);
    }

    /**
     * Strip all trailing dots and whitespace.
     * <p>
     * If nothing is left, the original segment is wrapped in underscores instead ("." → "_._"),
     * since an empty node is illegal.
     *
     * @param segment node text
     * @return segment without trailing dots or whitespace, never empty
     */
    public static String trim(String segment) {
        int end = segment.length();
        while (end > 0 && isTrailingJunk(segment.charAt(end - 1))) {
            end--;
        }
        if (end == 0) {
            return ReservedNameGuard.wrap(segment);
        }
        return segment.substring(0, end);
    }

    private static boolean isTrailingJunk(char c) {
        return c == '.' || c == ' ' || Character.isWhitespace(c);
    }
}
