package com.largomodo.pathsanitizer.core;

/**
 * Position-derived role of a node within a split path.
 * <p>
 * Computed once per sanitization call by {@link PathAssembler}; never stored on a node.
 */
public enum NodeRole {
    // First node that is empty, "." or "..": becomes a root or relative marker
    ROOT,
    // First node otherwise: may be "/" or a drive letter
    DRIVE_LETTER,
    // Everything between first and last is a directory
    INTERMEDIATE,
    // Last node: file or directory, as the caller says
    TERMINAL;

    /**
     * Role of the node at {@code index} in a path whose last kept segment is at {@code count - 1}.
     *
     * @param index          zero-based segment position
     * @param count          number of segments up to and including the last kept one
     * @param trimmedSegment segment stripped of whitespace
     * @param driveAfterRoot segment 1 is a drive letter directly after an absolute root ("/C:")
     */
    public static NodeRole of(int index, int count, String trimmedSegment, boolean driveAfterRoot) {
        if (index == 0) {
            return PathAssembler.isRelativeMarker(trimmedSegment) ? ROOT : DRIVE_LETTER;
        }
        if (index == 1 && driveAfterRoot) {
            return DRIVE_LETTER;
        }
        return index == count - 1 ? TERMINAL : INTERMEDIATE;
    }

    /**
     * Root/drive hint passed to {@link NodeSanitizer}.
     */
    public RoleHint rootHint() {
        return switch (this) {
            case ROOT, DRIVE_LETTER -> RoleHint.UNKNOWN;
            case INTERMEDIATE, TERMINAL -> RoleHint.ASSERTED_FALSE;
        };
    }

    /**
     * File hint passed to {@link NodeSanitizer}. Only the last node carries the caller's hint.
     *
     * @param terminalHint caller's hint for the last node
     * @param last         node is the last kept segment
     */
    public RoleHint fileHint(RoleHint terminalHint, boolean last) {
        return switch (this) {
            case ROOT, DRIVE_LETTER, TERMINAL -> last ? terminalHint : RoleHint.ASSERTED_FALSE;
            case INTERMEDIATE -> RoleHint.ASSERTED_FALSE;
        };
    }
}
