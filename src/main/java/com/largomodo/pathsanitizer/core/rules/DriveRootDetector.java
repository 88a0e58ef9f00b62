package com.largomodo.pathsanitizer.core.rules;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the POSIX root and Windows drive roots.
 * <p>
 * These are the only nodes whose correct form keeps a ':' or a separator. A drive is always
 * normalized to upper case with a trailing backslash ("c:" → "C:\"): "C:\x" is absolute on
 * Windows while "C:x" is relative to the drive's working directory.
 */
public final class DriveRootDetector {

    public static final String POSIX_ROOT = "/";
    public static final String WINDOWS_ROOT = "\\";

    private static final Pattern DRIVE = Pattern.compile("^([A-Za-z]):\\\\?$");
    private static final Pattern NORMALIZED_DRIVE = Pattern.compile("^[A-Z]:\\\\$");
    private static final Pattern BARE_DRIVE = Pattern.compile("^[A-Za-z]:$");

    private DriveRootDetector() {
        // Static utility class - prevent instantiation
    }

    /**
     * Detect a root or drive node.
     *
     * @param node node text, already stripped of surrounding whitespace
     * @return the root verbatim, the normalized drive, or empty if node is neither
     */
    public static Optional<String> detect(String node) {
        if (isRoot(node)) {
            return Optional.of(node);
        }
        Matcher m = DRIVE.matcher(node);
        if (m.matches()) {
            return Optional.of(m.group(1).toUpperCase(Locale.ROOT) + ":\\");
        }
        return Optional.empty();
    }

    public static boolean isRoot(String node) {
        return POSIX_ROOT.equals(node) || WINDOWS_ROOT.equals(node);
    }

    /**
     * @return true for output of {@link #detect(String)} on a drive, e.g. "C:\"
     */
    public static boolean isNormalizedDrive(String node) {
        return NORMALIZED_DRIVE.matcher(node).matches();
    }

    /**
     * @return true for a drive letter without separator, e.g. "c:"
     */
    public static boolean isBareDrive(String node) {
        return BARE_DRIVE.matcher(node).matches();
    }
}
