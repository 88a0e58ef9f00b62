package com.largomodo.pathsanitizer.core;

import com.largomodo.pathsanitizer.core.rules.DriveRootDetector;

import java.io.File;

/**
 * Separator convention used when a sanitized path is reassembled.
 * <p>
 * The flavor is part of the policy, never read from the host, so the same input always gives
 * the same output. Callers who want host-dependent output pass {@link #host()} explicitly.
 */
public enum PathFlavor {
    POSIX('/'),
    WINDOWS('\\');

    private final char separator;

    PathFlavor(char separator) {
        this.separator = separator;
    }

    /**
     * Flavor matching the running JVM's file separator.
     */
    public static PathFlavor host() {
        return File.separatorChar == '\\' ? WINDOWS : POSIX;
    }

    public String separator() {
        return String.valueOf(separator);
    }

    /**
     * Absolute root marker in this flavor.
     */
    public String root() {
        return switch (this) {
            case POSIX -> DriveRootDetector.POSIX_ROOT;
            case WINDOWS -> DriveRootDetector.WINDOWS_ROOT;
        };
    }

    /**
     * Render a normalized drive node ("C:\") as the leading part of a path.
     * <p>
     * POSIX has no drives, so "C:\" followed by "x" would join to "C:\/x". There the drive is
     * written below the root instead: "/C:".
     */
    public String drivePrefix(String normalizedDrive) {
        return switch (this) {
            case POSIX -> DriveRootDetector.POSIX_ROOT + normalizedDrive.substring(0, 2);
            case WINDOWS -> normalizedDrive;
        };
    }
}
