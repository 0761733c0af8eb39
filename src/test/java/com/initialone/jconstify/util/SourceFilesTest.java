package com.initialone.jconstify.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceFilesTest {

    @TempDir
    Path tmp;

    private Path touch(String rel) throws IOException {
        Path p = tmp.resolve(rel);
        Files.createDirectories(p.getParent());
        return Files.writeString(p, "class X {}");
    }

    @Test
    void walksSortsFiltersAndExcludes() throws IOException {
        Path b = touch("b/B.java");
        Path a = touch("a/A.java");
        touch("a/notes.txt");
        Path k = touch("K.java");

        assertEquals(List.of(a, b), SourceFiles.collect(tmp, List.of(".java"), k));
        assertEquals(List.of(k, a, b), SourceFiles.collect(tmp, List.of("JAVA"), null));
        assertEquals(3, SourceFiles.collect(tmp, List.of(), null).size());
    }

    @Test
    void singleFileAndMissingInput() throws IOException {
        Path a = touch("A.java");

        assertEquals(List.of(a), SourceFiles.collect(a, List.of(".java"), null));
        assertTrue(SourceFiles.collect(a, List.of(".kt"), null).isEmpty());
        assertTrue(SourceFiles.collect(tmp.resolve("missing"), List.of(".java"), null).isEmpty());
    }

    @Test
    void displayIsRelativeWithSlashes() throws IOException {
        Path a = touch("com/acme/A.java");

        assertEquals("com/acme/A.java", SourceFiles.display(tmp, a));
        assertEquals("A.java", SourceFiles.display(a, a));
    }
}
