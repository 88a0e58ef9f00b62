package com.largomodo.pathsanitizer.core;

import com.largomodo.pathsanitizer.core.rules.CharacterFilter;
import com.largomodo.pathsanitizer.core.rules.DriveRootDetector;
import com.largomodo.pathsanitizer.core.rules.LengthEnforcer;
import com.largomodo.pathsanitizer.core.rules.ReservedNameGuard;
import com.largomodo.pathsanitizer.core.rules.TrailingTrimmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Sanitizes a single path node so it is legal on both POSIX and Windows/NTFS (optionally FAT).
 * <p>
 * Pipeline, each step may short-circuit:
 * 1. Root or drive detection, unless the node is known not to be one
 * 2. All-dots guard ("..." → "_..._")
 * 3. Blacklisted characters → '_'
 * 4. Reserved device names wrapped ("nul.txt" → "_nul_.txt")
 * 5. Blank → "_ _"
 * 6. Trailing dots and spaces stripped ("." and ".." survive for directories)
 * 7. Length limit
 * <p>
 * Examples: "plums;and/or;apples" → "plums;and_or;apples", "abc. " → "abc", "c:" → "C:\".
 * <p>
 * Stateless and platform-independent: no filesystem access, no host inspection.
 * Safe for concurrent use.
 */
public class NodeSanitizer {

    private static final Logger log = LoggerFactory.getLogger(NodeSanitizer.class);

    /**
     * Sanitize one node.
     *
     * @param node          node text as supplied by the caller
     * @param isFile        whether the node is a file (as opposed to a directory)
     * @param isRootOrDrive whether the node is "/" or a drive such as "C:\"
     * @param policy        FAT compatibility and truncation settings
     * @return sanitized node
     * @throws ContradictoryHintsException if the hints contradict each other or the text
     * @throws NodeLengthExceededException if the node is too long and truncation is disabled
     */
    public String sanitizeNode(String node, RoleHint isFile, RoleHint isRootOrDrive, SanitizationPolicy policy) {
        Objects.requireNonNull(node, "node cannot be null");
        Objects.requireNonNull(isFile, "isFile cannot be null (use RoleHint.UNKNOWN)");
        Objects.requireNonNull(isRootOrDrive, "isRootOrDrive cannot be null (use RoleHint.UNKNOWN)");
        Objects.requireNonNull(policy, "policy cannot be null");

        if (isFile == RoleHint.ASSERTED_TRUE && isRootOrDrive == RoleHint.ASSERTED_TRUE) {
            throw new ContradictoryHintsException(
                    "Node '" + node + "' cannot be both a file and the root or a drive", node);
        }
        // A file is never a root; a root is never a file
        RoleHint rootHint = isFile == RoleHint.ASSERTED_TRUE && isRootOrDrive == RoleHint.UNKNOWN
                ? RoleHint.ASSERTED_FALSE : isRootOrDrive;
        RoleHint fileHint = rootHint == RoleHint.ASSERTED_TRUE && isFile == RoleHint.UNKNOWN
                ? RoleHint.ASSERTED_FALSE : isFile;

        String text = node.strip();

        boolean mayBeRoot = switch (rootHint) {
            case UNKNOWN, ASSERTED_TRUE -> true;
            case ASSERTED_FALSE -> false;
        };
        if (mayBeRoot) {
            Optional<String> root = DriveRootDetector.detect(text);
            if (root.isPresent()) {
                return root.get();
            }
            if (rootHint == RoleHint.ASSERTED_TRUE) {
                throw new ContradictoryHintsException(
                        "Node '" + text + "' is not the root or a drive letter", text);
            }
        }

        String sanitized = text;
        if (isAmbiguousDots(sanitized)) {
            sanitized = wrap(sanitized);
        }
        sanitized = CharacterFilter.filter(sanitized);
        sanitized = ReservedNameGuard.guard(sanitized, policy.fatCompatible());
        if (sanitized.isBlank()) {
            sanitized = wrap(sanitized);
        }

        boolean mayBeDotDirectory = switch (fileHint) {
            case UNKNOWN, ASSERTED_FALSE -> true;
            case ASSERTED_TRUE -> false;
        };
        if (mayBeDotDirectory && TrailingTrimmer.isDotLiteral(sanitized)) {
            return sanitized;
        }

        // Trimming "NUL.." yields "NUL", so the guard runs again
        sanitized = ReservedNameGuard.guard(TrailingTrimmer.trim(sanitized), policy.fatCompatible());

        if (LengthEnforcer.exceedsLimit(sanitized)) {
            sanitized = LengthEnforcer.enforce(sanitized, node, policy.trimToLimit());
            sanitized = ReservedNameGuard.guard(TrailingTrimmer.trim(sanitized), policy.fatCompatible());
            // Wrapping a stem adds two chars; the wrapped stem is stable on the second cut
            if (LengthEnforcer.exceedsLimit(sanitized)) {
                sanitized = TrailingTrimmer.trim(LengthEnforcer.truncate(sanitized));
            }
        }

        if (log.isDebugEnabled() && !sanitized.equals(node)) {
            log.debug("Node '{}' → '{}'", node, sanitized);
        }
        return sanitized;
    }

    /**
     * Nodes made only of dots (spaces ignored) other than "." and "..".
     */
    static boolean isAmbiguousDots(String text) {
        if (text.isEmpty() || TrailingTrimmer.isDotLiteral(text)) {
            return false;
        }
        boolean sawDot = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.') {
                sawDot = true;
            } else if (c != ' ') {
                return false;
            }
        }
        return sawDot;
    }

    private static String wrap(String text) {
        return CharacterFilter.REPLACEMENT + text + CharacterFilter.REPLACEMENT;
    }
}
