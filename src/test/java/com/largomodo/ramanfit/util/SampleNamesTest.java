package com.largomodo.ramanfit.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SampleNamesTest {

    @ParameterizedTest
    @CsvSource({
            "sample1.txt,sample1",
            "Site 4.b.txt,Site_4.b",
            "noext,noext",
            ".hidden,.hidden",
            "tab\tname.xy,tab_name"
    })
    void testFromFileName(String fileName, String expected) {
        assertEquals(expected, SampleNames.fromFileName(fileName));
    }

    @Test
    void testFromFileUsesLastPathElement() {
        assertEquals("s7", SampleNames.fromFile(Path.of("data", "run 1", "s7.txt")));
    }

    @Test
    void testBlankBaseNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> SampleNames.fromFileName("  .txt"));
    }
}
