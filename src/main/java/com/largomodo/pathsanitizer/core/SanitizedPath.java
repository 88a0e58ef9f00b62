package com.largomodo.pathsanitizer.core;

import java.util.List;
import java.util.Objects;

/**
 * Result of sanitizing a whole path.
 *
 * @param original path as supplied by the caller
 * @param nodes    sanitized nodes in order; a leading root or relative marker ends in the separator
 * @param path     nodes reassembled with the policy's separator
 */
public record SanitizedPath(String original, List<String> nodes, String path) {

    public SanitizedPath {
        Objects.requireNonNull(original, "original cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        nodes = List.copyOf(nodes);
    }

    /**
     * @return true if the reassembled path differs from the input string
     */
    public boolean changed() {
        return !path.equals(original);
    }

    @Override
    public String toString() {
        return path;
    }
}
