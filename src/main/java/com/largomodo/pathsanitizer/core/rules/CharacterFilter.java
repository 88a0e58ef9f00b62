package com.largomodo.pathsanitizer.core.rules;

/**
 * Replaces characters that are illegal in a Windows/NTFS or POSIX path node.
 * <p>
 * Blacklist: {@code < > : " | ? * \ /}, the C0 controls (0-31), DEL and the C1 range
 * up to NO-BREAK SPACE (127-160). Every blacklisted char becomes {@link #REPLACEMENT}.
 * <p>
 * Total and deterministic. Safe for concurrent use.
 */
public final class CharacterFilter {

    public static final char REPLACEMENT = '_';

    private static final char FIRST_HIGH_CONTROL = 127;
    private static final char LAST_HIGH_CONTROL = 160;

    private CharacterFilter() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check whether a character may not appear in a sanitized node.
     *
     * @param c character to test
     * @return true if c is blacklisted
     */
    public static boolean isBlacklisted(char c) {
        if (c < ' ' || (c >= FIRST_HIGH_CONTROL && c <= LAST_HIGH_CONTROL)) {
            return true;
        }
        return switch (c) {
            case '<', '>', ':', '"', '|', '?', '*', '\\', '/' -> true;
            default -> false;
        };
    }

    /**
     * Replace every blacklisted character with {@link #REPLACEMENT}.
     *
     * @param segment path node text
     * @return segment with all blacklisted characters replaced (same instance if none found)
     */
    public static String filter(String segment) {
        StringBuilder filtered = null;
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (isBlacklisted(c)) {
                if (filtered == null) {
                    filtered = new StringBuilder(segment);
                }
                filtered.setCharAt(i, REPLACEMENT);
            }
        }
        return filtered == null ? segment : filtered.toString();
    }
}
