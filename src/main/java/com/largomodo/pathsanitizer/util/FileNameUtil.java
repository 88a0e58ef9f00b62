package com.largomodo.pathsanitizer.util;

/**
 * Splits a file name into stem and extension.
 * <p>
 * Strategy: split on the LAST dot ("archive.tar.gz" → stem "archive.tar", extension ".gz"),
 * but only when at least one non-dot character precedes it. Leading dots belong to the stem,
 * so ".bashrc" and "..." have no extension.
 * <p>
 * Pure function with no state or dependencies. Safe for concurrent use.
 */
public class FileNameUtil {

    private FileNameUtil() {
        // Static utility class - prevent instantiation
    }

    /**
     * Split a file name into stem and extension.
     *
     * @param filename Single path node (no separators expected)
     * @return stem and extension; extension keeps its dot and is empty when there is none
     * @throws IllegalArgumentException if filename is null
     */
    public static NameParts split(String filename) {
        if (filename == null) {
            throw new IllegalArgumentException("Filename cannot be null");
        }

        int lastDot = filename.lastIndexOf('.');
        if (lastDot <= 0) {
            return new NameParts(filename, "");
        }

        // "..hidden" has no extension: every char before the last dot is itself a dot
        for (int i = 0; i < lastDot; i++) {
            if (filename.charAt(i) != '.') {
                return new NameParts(filename.substring(0, lastDot), filename.substring(lastDot));
            }
        }
        return new NameParts(filename, "");
    }

    /**
     * Stem and extension of a file name.
     *
     * @param stem      everything before the extension
     * @param extension the extension including its leading dot, or empty
     */
    public record NameParts(String stem, String extension) {

        public boolean hasExtension() {
            return !extension.isEmpty();
        }
    }
}
