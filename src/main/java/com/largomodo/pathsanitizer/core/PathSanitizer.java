package com.largomodo.pathsanitizer.core;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for sanitizing paths and path nodes with a fixed policy.
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * PathSanitizer sanitizer = new PathSanitizer(SanitizationPolicy.defaults().withFatCompatible(true));
 * sanitizer.sanitizePath("reports\\nul.txt");   // "reports/_nul_.txt"
 * sanitizer.sanitizeNode("abc. ");              // "abc"
 * }</pre>
 * <p>
 * Immutable and safe for concurrent use.
 *
 * @see NodeSanitizer
 * @see PathAssembler
 */
public class PathSanitizer {

    private final SanitizationPolicy policy;
    private final NodeSanitizer nodeSanitizer;
    private final PathAssembler assembler;

    public PathSanitizer() {
        this(SanitizationPolicy.defaults());
    }

    public PathSanitizer(SanitizationPolicy policy) {
        this(policy, new NodeSanitizer());
    }

    PathSanitizer(SanitizationPolicy policy, NodeSanitizer nodeSanitizer) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.nodeSanitizer = Objects.requireNonNull(nodeSanitizer, "nodeSanitizer cannot be null");
        this.assembler = new PathAssembler(nodeSanitizer);
    }

    public SanitizationPolicy policy() {
        return policy;
    }

    /**
     * Sanitize a node whose role is unknown.
     */
    public String sanitizeNode(String node) {
        return sanitizeNode(node, RoleHint.UNKNOWN, RoleHint.UNKNOWN);
    }

    /**
     * Sanitize a node with caller-supplied role hints.
     *
     * @throws ContradictoryHintsException if the hints contradict each other or the text
     * @throws NodeLengthExceededException if the node is too long and truncation is disabled
     */
    public String sanitizeNode(String node, RoleHint isFile, RoleHint isRootOrDrive) {
        return nodeSanitizer.sanitizeNode(node, isFile, isRootOrDrive, policy);
    }

    /**
     * Sanitize a path whose last node may be a file or a directory.
     */
    public String sanitizePath(String path) {
        return sanitize(path, RoleHint.UNKNOWN).path();
    }

    public String sanitizePath(String path, RoleHint isFile) {
        return sanitize(path, isFile).path();
    }

    /**
     * Sanitize a path, keeping the individual nodes.
     *
     * @throws UnsupportedPathException    if path is a long UNC path
     * @throws ContradictoryHintsException if the hints contradict a node
     * @throws NodeLengthExceededException if a node is too long and truncation is disabled
     */
    public SanitizedPath sanitize(String path, RoleHint isFile) {
        return assembler.sanitizePath(path, isFile, policy);
    }

    /**
     * Sanitize an already split path; see {@link PathAssembler#sanitizeNodes(List, RoleHint, SanitizationPolicy)}.
     */
    public SanitizedPath sanitizeNodes(List<String> nodes, RoleHint isFile) {
        return assembler.sanitizeNodes(nodes, isFile, policy);
    }
}
