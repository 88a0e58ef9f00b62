package com.largomodo.pathsanitizer.core;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Immutable settings for one sanitization call.
 *
 * @param fatCompatible also avoid names reserved on FAT volumes
 * @param trimToLimit   truncate over-long nodes instead of failing
 * @param flavor        separator convention of the reassembled path
 * @param warningSink   receives a message whenever a path is changed; see {@link WarningSinks}
 */
public record SanitizationPolicy(boolean fatCompatible, boolean trimToLimit,
                                 PathFlavor flavor, Consumer<String> warningSink) {

    public SanitizationPolicy {
        Objects.requireNonNull(flavor, "flavor cannot be null");
        Objects.requireNonNull(warningSink, "warningSink cannot be null (use WarningSinks.silent())");
    }

    /**
     * NTFS rules only, no truncation, POSIX separators, warnings logged.
     */
    public static SanitizationPolicy defaults() {
        return new SanitizationPolicy(false, false, PathFlavor.POSIX, WarningSinks.logging());
    }

    public SanitizationPolicy withFatCompatible(boolean fatCompatible) {
        return new SanitizationPolicy(fatCompatible, trimToLimit, flavor, warningSink);
    }

    public SanitizationPolicy withTrimToLimit(boolean trimToLimit) {
        return new SanitizationPolicy(fatCompatible, trimToLimit, flavor, warningSink);
    }

    public SanitizationPolicy withFlavor(PathFlavor flavor) {
        return new SanitizationPolicy(fatCompatible, trimToLimit, flavor, warningSink);
    }

    public SanitizationPolicy withWarningSink(Consumer<String> warningSink) {
        return new SanitizationPolicy(fatCompatible, trimToLimit, flavor, warningSink);
    }
}
