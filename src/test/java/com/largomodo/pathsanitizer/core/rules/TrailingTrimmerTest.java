package com.largomodo.pathsanitizer.core.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrailingTrimmerTest {

    @Test
    void testStripsTrailingDotsAndSpaces() {
        assertEquals("abc", TrailingTrimmer.trim("abc. "));
        assertEquals("xyz", TrailingTrimmer.trim("xyz..."));
        assertEquals("abc", TrailingTrimmer.trim("abc\u2003"));
        assertEquals("a. b", TrailingTrimmer.trim("a. b . "));
    }

    @Test
    void testInteriorDotsSurvive() {
        assertEquals("a.b", TrailingTrimmer.trim("a.b"));
        assertEquals(".hidden", TrailingTrimmer.trim(".hidden"));
    }

    @Test
    void testNothingLeftIsWrapped() {
        assertEquals("_._", TrailingTrimmer.trim("."));
        assertEquals("_.._", TrailingTrimmer.trim(".."));
        assertEquals("_. _", TrailingTrimmer.trim(". "));
    }

    @Test
    void testDotLiterals() {
        assertTrue(TrailingTrimmer.isDotLiteral("."));
        assertTrue(TrailingTrimmer.isDotLiteral(".."));
        assertFalse(TrailingTrimmer.isDotLiteral("..."));
        assertFalse(TrailingTrimmer.isDotLiteral(""));
    }
}
