package com.largomodo.pathsanitizer.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.largomodo.pathsanitizer.core.RoleHint.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeSanitizerTest {

    private final NodeSanitizer sanitizer = new NodeSanitizer();
    private final SanitizationPolicy policy = SanitizationPolicy.defaults().withWarningSink(WarningSinks.silent());

    private String x(String node) {
        return sanitizer.sanitizeNode(node, UNKNOWN, UNKNOWN, policy);
    }

    private String x(String node, RoleHint isFile, RoleHint isRootOrDrive) {
        return sanitizer.sanitizeNode(node, isFile, isRootOrDrive, policy);
    }

    @Test
    void testRootAndDriveNodes() {
        for (RoleHint file : new RoleHint[]{UNKNOWN, ASSERTED_FALSE}) {
            for (RoleHint root : new RoleHint[]{UNKNOWN, ASSERTED_TRUE}) {
                assertEquals("C:\\", x("C:", file, root));
                assertEquals("C:\\", x("C:\\", file, root));
                assertEquals("C:\\", x("c:", file, root));
                assertEquals("/", x("/", file, root));
                assertEquals("\\", x("\\", file, root));
            }
        }
    }

    @Test
    void testDriveTextOutsideRootPosition() {
        assertEquals("C_", x("C:", UNKNOWN, ASSERTED_FALSE));
        assertEquals("C_", x(" C: ", UNKNOWN, ASSERTED_FALSE));
        assertEquals("C__", x("C:\\", UNKNOWN, ASSERTED_FALSE));
        assertEquals("C__", x("C:/", UNKNOWN, ASSERTED_FALSE));
        // A file is never a drive
        assertEquals("C_", x("C:", ASSERTED_TRUE, UNKNOWN));
    }

    @Test
    void testDotLiterals() {
        assertEquals(".", x(".", ASSERTED_FALSE, ASSERTED_FALSE));
        assertEquals("..", x("..", ASSERTED_FALSE, ASSERTED_FALSE));
        assertEquals(".", x(".", UNKNOWN, ASSERTED_FALSE));
        // Files may not end in a dot
        assertEquals("_._", x(".", ASSERTED_TRUE, UNKNOWN));
        assertEquals("_.._", x("..", ASSERTED_TRUE, UNKNOWN));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "NUL|_NUL_",
            "nul|_nul_",
            "nul.txt|_nul_.txt",
            "NUL..|_NUL_",
            "com1.|_com1_",
            "plums;and/or;apples|plums;and_or;apples",
            "'abc. '|abc",
            "xyz...|xyz",
            "...|_..._",
            "'. .'|_. ._",
            "''|__",
            "'   '|__",
            "'  padded  '|padded"
    })
    void testCorrections(String node, String expected) {
        assertEquals(expected, x(node));
    }

    @Test
    void testReservedNameKnownNotRoot() {
        assertEquals("_nul_", x("nul", UNKNOWN, ASSERTED_FALSE));
    }

    @Test
    void testTrailingTrimForFiles() {
        assertEquals("abc", x("abc. ", ASSERTED_TRUE, UNKNOWN));
    }

    @Test
    void testFatCompatibility() {
        assertEquals("CLOCK$", x("CLOCK$"));
        assertEquals("_CLOCK$_", sanitizer.sanitizeNode("CLOCK$", UNKNOWN, UNKNOWN, policy.withFatCompatible(true)));
        assertEquals("_LST_.txt", sanitizer.sanitizeNode("LST.txt", UNKNOWN, UNKNOWN, policy.withFatCompatible(true)));
    }

    @Test
    void testLengthBound() {
        String node = "x".repeat(300);

        assertEquals(254, sanitizer.sanitizeNode(node, UNKNOWN, UNKNOWN, policy.withTrimToLimit(true)).length());

        NodeLengthExceededException ex = assertThrows(NodeLengthExceededException.class, () -> x(node));
        assertEquals(node, ex.getValue());
    }

    @Test
    void testTruncationNeverLeavesTrailingDot() {
        String node = "a".repeat(253) + ". " + "b".repeat(10);

        String result = sanitizer.sanitizeNode(node, UNKNOWN, UNKNOWN, policy.withTrimToLimit(true));

        assertEquals("a".repeat(253), result);
    }

    @Test
    void testTruncationKeepsWrappedStem() {
        String node = "nul." + "x".repeat(260);

        String result = sanitizer.sanitizeNode(node, UNKNOWN, UNKNOWN, policy.withTrimToLimit(true));

        assertEquals(254, result.length());
        assertTrue(result.startsWith("_nul_.xxx"));
    }

    @Test
    void testContradictions() {
        ContradictoryHintsException notADrive = assertThrows(ContradictoryHintsException.class,
                () -> x("notadrive", UNKNOWN, ASSERTED_TRUE));
        assertEquals("notadrive", notADrive.getValue());

        assertThrows(ContradictoryHintsException.class, () -> x("C:", ASSERTED_TRUE, ASSERTED_TRUE));
    }

    @Test
    void testNullArguments() {
        assertThrows(NullPointerException.class, () -> x(null));
        assertThrows(NullPointerException.class, () -> sanitizer.sanitizeNode("a", null, UNKNOWN, policy));
        assertThrows(NullPointerException.class, () -> sanitizer.sanitizeNode("a", UNKNOWN, UNKNOWN, null));
    }

    @Test
    void testAmbiguousDots() {
        assertTrue(NodeSanitizer.isAmbiguousDots("..."));
        assertTrue(NodeSanitizer.isAmbiguousDots(". ."));
        assertFalse(NodeSanitizer.isAmbiguousDots("."));
        assertFalse(NodeSanitizer.isAmbiguousDots(".."));
        assertFalse(NodeSanitizer.isAmbiguousDots("   "));
        assertFalse(NodeSanitizer.isAmbiguousDots("a..."));
    }
}
