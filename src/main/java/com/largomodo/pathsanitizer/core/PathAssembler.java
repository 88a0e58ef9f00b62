package com.largomodo.pathsanitizer.core;

import com.largomodo.pathsanitizer.core.rules.DriveRootDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sanitizes a whole path by splitting it into nodes, sanitizing each, and reassembling.
 * <p>
 * Splitting happens on both '/' and '\' regardless of the host, so the result does not depend
 * on where the code runs. Roles come from position only:
 * - first node: absolute root (empty), relative marker ("." or ".."), or drive/root candidate
 * - last node: file or directory according to the caller's hint
 * - everything else: directory
 * <p>
 * Empty and "." nodes after the first are dropped ("a//./b" → "a/b"). ".." is kept as is.
 * The last kept node is the terminal, so "a/b/" and "a/b" sanitize alike.
 * <p>
 * Safe for concurrent use; the only side effect is the policy's warning sink.
 */
public class PathAssembler {

    private static final Logger log = LoggerFactory.getLogger(PathAssembler.class);

    static final String LONG_UNC_PREFIX = "\\\\?";

    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");
    private static final Set<String> RELATIVE_MARKERS = Set.of("", ".", "..");

    private final NodeSanitizer nodeSanitizer;

    public PathAssembler(NodeSanitizer nodeSanitizer) {
        if (nodeSanitizer == null) {
            throw new IllegalArgumentException("NodeSanitizer cannot be null");
        }
        this.nodeSanitizer = nodeSanitizer;
    }

    static boolean isRelativeMarker(String trimmedSegment) {
        return RELATIVE_MARKERS.contains(trimmedSegment);
    }

    /**
     * Sanitize a path string and notify the warning sink if it changed.
     *
     * @param path   path in POSIX or Windows notation (mixed separators allowed)
     * @param isFile whether the last node is a file
     * @param policy sanitization settings
     * @return sanitized nodes and reassembled path
     * @throws UnsupportedPathException    if path is a long UNC path ("\\?\...")
     * @throws ContradictoryHintsException if the hints contradict a node
     * @throws NodeLengthExceededException if a node is too long and truncation is disabled
     */
    public SanitizedPath sanitizePath(String path, RoleHint isFile, SanitizationPolicy policy) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        String trimmed = path.strip();
        if (trimmed.startsWith(LONG_UNC_PREFIX)) {
            throw new UnsupportedPathException(
                    "Long UNC Windows paths (\\\\? prefix) are not supported (path '" + path + "')", path);
        }

        List<String> segments = Arrays.asList(SEPARATORS.split(trimmed, -1));
        SanitizedPath result = assemble(path, segments, isFile, policy);

        if (result.changed()) {
            policy.warningSink().accept("Sanitized filename " + path + " → " + result.path());
        }
        return result;
    }

    /**
     * Sanitize a path that the caller has already split into nodes.
     * <p>
     * Nodes are not split further; a separator inside a node is replaced like any other
     * blacklisted character. No warning is emitted.
     *
     * @param segments path nodes in order
     * @param isFile   whether the last node is a file
     * @param policy   sanitization settings
     * @return sanitized nodes and reassembled path
     */
    public SanitizedPath sanitizeNodes(List<String> segments, RoleHint isFile, SanitizationPolicy policy) {
        Objects.requireNonNull(segments, "segments cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        return assemble(String.join(policy.flavor().separator(), segments), segments, isFile, policy);
    }

    private SanitizedPath assemble(String original, List<String> segments, RoleHint isFile,
                                   SanitizationPolicy policy) {
        Objects.requireNonNull(isFile, "isFile cannot be null (use RoleHint.UNKNOWN)");
        PathFlavor flavor = policy.flavor();
        int count = segments.size();

        // "/C:/x" is how a drive path renders on POSIX; read it back as a drive
        boolean driveAfterRoot = count > 1
                && segments.get(0).isBlank()
                && DriveRootDetector.isBareDrive(segments.get(1).strip());

        // Trailing empty and "." segments are dropped, so they do not decide which node is last
        int lastKept = lastKeptIndex(segments);

        List<String> nodes = new ArrayList<>(count);
        for (int i = 0; i <= lastKept; i++) {
            String segment = segments.get(i);
            String trimmedSegment = segment.strip();
            if (isDropped(i, trimmedSegment)) {
                continue;
            }

            boolean last = i == lastKept;
            NodeRole role = NodeRole.of(i, lastKept + 1, trimmedSegment, driveAfterRoot);
            String sanitized = switch (role) {
                case ROOT -> trimmedSegment.isEmpty() ? flavor.root() : trimmedSegment + flavor.separator();
                case DRIVE_LETTER, INTERMEDIATE, TERMINAL -> nodeSanitizer.sanitizeNode(
                        segment, role.fileHint(isFile, last), role.rootHint(), policy);
            };

            if (i == 1 && driveAfterRoot && DriveRootDetector.isNormalizedDrive(sanitized)) {
                nodes.remove(0);
            }
            nodes.add(sanitized);
        }

        String assembled = render(nodes, flavor);
        log.debug("Assembled {} node(s) from '{}' → '{}'", nodes.size(), original, assembled);
        return new SanitizedPath(original, nodes, assembled);
    }

    private static boolean isDropped(int index, String trimmedSegment) {
        return index > 0 && (trimmedSegment.isEmpty() || ".".equals(trimmedSegment));
    }

    private static int lastKeptIndex(List<String> segments) {
        int i = segments.size() - 1;
        while (i > 0 && isDropped(i, segments.get(i).strip())) {
            i--;
        }
        return i;
    }

    /**
     * Join sanitized nodes with the flavor's separator, handling the leading marker.
     */
    static String render(List<String> nodes, PathFlavor flavor) {
        if (nodes.isEmpty()) {
            return "";
        }
        String separator = flavor.separator();
        String first = nodes.get(0);
        List<String> rest = nodes.subList(1, nodes.size());
        String joinedRest = String.join(separator, rest);

        if (DriveRootDetector.isRoot(first)) {
            return flavor.root() + joinedRest;
        }
        if (first.equals("." + separator)) {
            return rest.isEmpty() ? "." : joinedRest;
        }
        if (first.equals(".." + separator)) {
            return rest.isEmpty() ? ".." : first + joinedRest;
        }
        if (DriveRootDetector.isNormalizedDrive(first)) {
            String prefix = flavor.drivePrefix(first);
            if (rest.isEmpty()) {
                return prefix;
            }
            return prefix.endsWith(separator) ? prefix + joinedRest : prefix + separator + joinedRest;
        }
        return String.join(separator, nodes);
    }
}
