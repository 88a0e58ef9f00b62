package com.largomodo.pathsanitizer.util;

import com.largomodo.pathsanitizer.util.FileNameUtil.NameParts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileNameUtilTest {

    @Test
    void testSimpleSplit() {
        assertEquals(new NameParts("nul", ".txt"), FileNameUtil.split("nul.txt"));
        assertEquals(new NameParts("report", ".pdf"), FileNameUtil.split("report.pdf"));
    }

    @Test
    void testMultipleDots() {
        // Rightmost dot is the separator
        assertEquals(new NameParts("archive.tar", ".gz"), FileNameUtil.split("archive.tar.gz"));
        assertEquals(new NameParts("..a", ".b"), FileNameUtil.split("..a.b"));
    }

    @Test
    void testLeadingDotsBelongToStem() {
        assertEquals(new NameParts(".bashrc", ""), FileNameUtil.split(".bashrc"));
        assertEquals(new NameParts("...", ""), FileNameUtil.split("..."));
        assertFalse(FileNameUtil.split(".bashrc").hasExtension());
    }

    @Test
    void testEdgeCases() {
        assertThrows(IllegalArgumentException.class, () -> FileNameUtil.split(null));

        assertEquals(new NameParts("noext", ""), FileNameUtil.split("noext"));
        assertEquals(new NameParts("", ""), FileNameUtil.split(""));

        // A bare trailing dot is an extension
        NameParts trailing = FileNameUtil.split("nul.");
        assertEquals("nul", trailing.stem());
        assertEquals(".", trailing.extension());
        assertTrue(trailing.hasExtension());
    }
}
