package com.largomodo.pathsanitizer.core.rules;

import com.largomodo.pathsanitizer.util.FileNameUtil;
import com.largomodo.pathsanitizer.util.FileNameUtil.NameParts;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Wraps Windows device names so a node can never address a device.
 * <p>
 * Whole-node matches are wrapped entirely ("nul" → "_nul_"). Otherwise, if the stem of a
 * node with an extension matches, only the stem is wrapped ("nul.txt" → "_nul_.txt").
 * Comparison is case-insensitive; the original casing is kept in the output.
 * <p>
 * FAT volumes reserve a few more names ({@code CLOCK$}, {@code LST}, ...). Those are only
 * checked when FAT compatibility is requested.
 */
public final class ReservedNameGuard {

    public static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    public static final Set<String> FAT_RESERVED_NAMES;

    static {
        Set<String> fat = new HashSet<>(RESERVED_NAMES);
        fat.addAll(Set.of("$IDLE$", "CONFIG$", "KEYBD$", "SCREEN$", "CLOCK$", "LST"));
        FAT_RESERVED_NAMES = Set.copyOf(fat);
    }

    private ReservedNameGuard() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check a name against the reserved set.
     *
     * @param name          node or stem
     * @param fatCompatible include the FAT-only names
     * @return true if the upper-cased name is reserved
     */
    public static boolean isReserved(String name, boolean fatCompatible) {
        Set<String> reserved = fatCompatible ? FAT_RESERVED_NAMES : RESERVED_NAMES;
        return reserved.contains(name.toUpperCase(Locale.ROOT));
    }

    /**
     * Wrap a reserved node or stem in underscores. Non-reserved input is returned unchanged.
     *
     * @param segment       node already passed through {@link CharacterFilter}
     * @param fatCompatible include the FAT-only names
     * @return safe node
     */
    public static String guard(String segment, boolean fatCompatible) {
        if (isReserved(segment, fatCompatible)) {
            return wrap(segment);
        }
        NameParts parts = FileNameUtil.split(segment);
        if (parts.hasExtension() && isReserved(parts.stem(), fatCompatible)) {
            return wrap(parts.stem()) + parts.extension();
        }
        return segment;
    }

    static String wrap(String text) {
        return CharacterFilter.REPLACEMENT + text + CharacterFilter.REPLACEMENT;
    }
}
