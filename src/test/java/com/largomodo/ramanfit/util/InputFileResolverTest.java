package com.largomodo.ramanfit.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputFileResolverTest {

    @TempDir
    Path tempDir;

    private InputFileResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        Files.createFile(tempDir.resolve("b.txt"));
        Files.createFile(tempDir.resolve("a.txt"));
        Files.createFile(tempDir.resolve("c.csv"));
        Files.createDirectory(tempDir.resolve("dir.txt"));
        resolver = new InputFileResolver(tempDir);
    }

    @Test
    void testGlobMatchesFilesOnlyInSortedOrder() throws IOException {
        List<Path> files = resolver.resolve(List.of("*.txt"));

        assertEquals(List.of(tempDir.resolve("a.txt"), tempDir.resolve("b.txt")), files);
    }

    @Test
    void testLiteralAndOverlappingGlobAreDeduplicated() throws IOException {
        List<Path> files = resolver.resolve(List.of("c.csv", "*.csv", "b.txt"));

        assertEquals(List.of(tempDir.resolve("b.txt"), tempDir.resolve("c.csv")), files);
    }

    @Test
    void testUnmatchedArgumentContributesNothing() throws IOException {
        assertTrue(resolver.resolve(List.of("missing.txt", "nowhere/*.txt")).isEmpty());
    }

    @Test
    void testAbsolutePathIsTakenAsIs() throws IOException {
        Path absolute = tempDir.resolve("a.txt").toAbsolutePath();

        assertEquals(List.of(absolute), new InputFileResolver(Path.of("/")).resolve(List.of(absolute.toString())));
    }
}
